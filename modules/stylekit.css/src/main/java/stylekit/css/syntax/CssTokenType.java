package stylekit.css.syntax;

/**
 * The kinds of tokens produced by the CSS tokenizer.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#tokenization">Tokenization</a>
 */
public enum CssTokenType {
    IDENT,
    FUNCTION,
    AT_KEYWORD,
    HASH,
    STRING,
    BAD_STRING,
    URL,
    BAD_URL,
    DELIM,
    NUMBER,
    PERCENTAGE,
    DIMENSION,
    INCLUDE_MATCH,
    DASH_MATCH,
    PREFIX_MATCH,
    SUFFIX_MATCH,
    SUBSTRING_MATCH,
    COLUMN,
    WHITESPACE,
    COMMENT,
    CDO,
    CDC,
    COLON,
    SEMICOLON,
    COMMA,
    SQUARE_BRACKET_OPEN,
    SQUARE_BRACKET_CLOSE,
    ROUND_BRACKET_OPEN,
    ROUND_BRACKET_CLOSE,
    CURLY_BRACKET_OPEN,
    CURLY_BRACKET_CLOSE,
    EOF;

    /**
     * Whitespace, comments, {@code <!--} and {@code -->} carry no meaning for the
     * builder, but are kept in the concrete syntax tree.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT || this == CDO || this == CDC;
    }
}
