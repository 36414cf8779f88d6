package com.stylekit.css.syntax;

import stylekit.css.syntax.CssToken;

/**
 * A non-fatal diagnostic reported while tokenizing or building a stylesheet.
 */
public record CssParserError(Kind kind, int line, int column) {

    public enum Kind {
        UNEXPECTED_END_OF_FILE("Unexpected end of file"),
        INVALID_ESCAPE("Invalid escape sequence"),
        BAD_URL("Bad URL"),
        BAD_STRING("Unterminated string"),
        INVALID_BLOCK_START("Block start without rule"),
        INVALID_TOKEN("Unexpected token"),
        UNKNOWN_AT_RULE("Unknown at-rule"),
        INVALID_SELECTOR("Invalid selector"),
        UNKNOWN_DECLARATION_NAME("Unknown declaration name"),
        VALUE_MISSING("Value missing"),
        COLON_MISSING("Colon missing"),
        IDENT_EXPECTED("Identifier expected"),
        INVALID_VALUE("Invalid value");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    public static CssParserError unexpectedEndOfFile(int line, int column) {
        return new CssParserError(Kind.UNEXPECTED_END_OF_FILE, line, column);
    }

    public static CssParserError invalidEscape(int line, int column) {
        return new CssParserError(Kind.INVALID_ESCAPE, line, column);
    }

    public static CssParserError badUrl(int line, int column) {
        return new CssParserError(Kind.BAD_URL, line, column);
    }

    public static CssParserError badString(int line, int column) {
        return new CssParserError(Kind.BAD_STRING, line, column);
    }

    public static CssParserError of(Kind kind, CssToken token) {
        return new CssParserError(kind, token.line(), token.column());
    }

    public String message() {
        return kind.message();
    }

    @Override
    public String toString() {
        return String.format("%s [%d:%d]", kind.message(), line, column);
    }
}
