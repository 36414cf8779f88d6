package stylekit.css;

import java.util.List;
import java.util.StringJoiner;

final class CssFormat {

    private CssFormat() {}

    /*
     * https://www.w3.org/TR/cssom-1/#serialize-a-string
     */
    static String quote(String value) {
        var builder = new StringBuilder(value.length() + 2).append('"');

        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);

            if (c == '"' || c == '\\') {
                builder.append('\\').append(c);
            } else if (c == '\n') {
                builder.append("\\a ");
            } else {
                builder.append(c);
            }
        }

        return builder.append('"').toString();
    }

    /*
     * https://www.w3.org/TR/cssom-1/#serialize-an-identifier
     */
    static String escapeIdentifier(String value) {
        var builder = new StringBuilder(value.length());

        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);

            if (c == '\u0000') {
                builder.append('\uFFFD');
            } else if ((c >= '\u0001' && c <= '\u001F') || c == '\u007F'
                    || (c >= '0' && c <= '9' && (i == 0 || (i == 1 && value.charAt(0) == '-')))) {
                builder.append('\\').append(Integer.toHexString(c)).append(' ');
            } else if (i == 0 && c == '-' && value.length() == 1) {
                builder.append("\\-");
            } else if (c >= '\u0080' || c == '-' || c == '_'
                    || (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                builder.append(c);
            } else {
                builder.append('\\').append(c);
            }
        }

        return builder.toString();
    }

    static String url(String value) {
        return "url(" + quote(value) + ")";
    }

    static String block(String prelude, String body) {
        return body.isEmpty() ? prelude + " { }" : prelude + " { " + body + " }";
    }

    static String join(List<? extends CssFormattable> items, String separator) {
        var joiner = new StringJoiner(separator);

        for (CssFormattable item : items) {
            joiner.add(item.toCss());
        }

        return joiner.toString();
    }

    static boolean isIdentifier(String value) {
        int start = value.startsWith("-") ? 1 : 0;

        if (value.length() <= start || Character.isDigit(value.charAt(start))) {
            return false;
        }

        for (int i = start; i < value.length(); ++i) {
            char c = value.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c >= '\u0080')) {
                return false;
            }
        }

        return true;
    }
}
