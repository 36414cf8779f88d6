package stylekit.css;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One of the functions of an {@code @document} rule that decides which documents the rule applies to.
 *
 * @param kind the function
 * @param argument the unquoted argument
 */
public record DocumentFunction(Kind kind, String argument) implements CssFormattable {

    public enum Kind {
        URL("url"),
        URL_PREFIX("url-prefix"),
        DOMAIN("domain"),
        REGEXP("regexp");

        private final String functionName;

        Kind(String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }

        /**
         * Returns the kind with the given function name, ignoring case, or {@code null}.
         */
        public static Kind fromFunctionName(String name) {
            for (Kind kind : values()) {
                if (kind.functionName.equalsIgnoreCase(name)) {
                    return kind;
                }
            }

            return null;
        }
    }

    public DocumentFunction {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(argument, "argument cannot be null");
    }

    /**
     * Determines whether a document with the given URL is matched by this function.
     */
    public boolean matches(String url) {
        return switch (kind) {
            case URL -> url.equals(argument);
            case URL_PREFIX -> url.startsWith(argument);
            case DOMAIN -> matchesDomain(url);
            case REGEXP -> matchesRegexp(url);
        };
    }

    private boolean matchesDomain(String url) {
        try {
            String host = new URI(url).getHost();
            return host != null && (host.equalsIgnoreCase(argument)
                || host.toLowerCase().endsWith("." + argument.toLowerCase()));
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private boolean matchesRegexp(String url) {
        try {
            return Pattern.matches(argument, url);
        } catch (PatternSyntaxException ex) {
            return false;
        }
    }

    @Override
    public String toCss() {
        return kind.functionName + "(" + CssFormat.quote(argument) + ")";
    }
}
