package stylekit.css.syntax;

import java.util.Objects;

/**
 * A positioned CSS token.
 * <p>
 * {@code data} is the token's value after unescaping (the name of an identifier, the contents
 * of a string, the number of a numeric token), while {@code text} is the exact source text the
 * token was read from. Concatenating the {@code text} of all tokens of a stylesheet reproduces it.
 */
public record CssToken(CssTokenType type, String data, String text, int line, int column) {

    public CssToken {
        Objects.requireNonNull(type, "type cannot be null");
        data = data != null ? data : "";
        text = text != null ? text : "";
    }

    public static CssToken eof(int line, int column) {
        return new CssToken(CssTokenType.EOF, "", "", line, column);
    }

    public boolean is(CssTokenType type) {
        return this.type == type;
    }

    public boolean is(CssTokenType type1, CssTokenType type2) {
        return type == type1 || type == type2;
    }

    public boolean isNot(CssTokenType type1, CssTokenType type2) {
        return type != type1 && type != type2;
    }

    public boolean isNot(CssTokenType type1, CssTokenType type2, CssTokenType type3) {
        return type != type1 && type != type2 && type != type3;
    }

    /**
     * Determines whether this is an identifier with the given name, ignoring ASCII case.
     */
    public boolean isIdent(String name) {
        return type == CssTokenType.IDENT && data.equalsIgnoreCase(name);
    }

    /**
     * Returns the textual value of this token as it is used to assemble names, which is the
     * unescaped name for identifiers and the source text for everything else.
     */
    public String toValue() {
        return type == CssTokenType.IDENT ? data : text;
    }

    @Override
    public String toString() {
        return "<" + type.name().toLowerCase().replace('_', '-') + ">" + text;
    }
}
