package com.stylekit.css.syntax;

import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import static com.stylekit.css.syntax.CssDefinitions.*;
import static com.stylekit.css.syntax.CssDefinitions.PatternType.*;

/**
 * W3C-compliant CSS tokenizer, implementing CSS Syntax Module Level 3.
 * <p>
 * Unlike the tokenizer described in CSS Syntax Level 3, comments are not discarded but returned
 * as {@link CssTokenType#COMMENT} tokens, and every token carries the source text it was read from.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#tokenization">Tokenization</a>
 */
public final class CssTokenizer implements CssTokenSource, AutoCloseable {

    private final CssStreamReader input;
    private final Consumer<CssParserError> errorHandler;
    private CssToken eof;

    public CssTokenizer(String text, Consumer<CssParserError> errorHandler) {
        this(new StringReader(text), errorHandler);
    }

    public CssTokenizer(InputStream input, Charset charset, Consumer<CssParserError> errorHandler) {
        this(new InputStreamReader(input, charset), errorHandler);
    }

    public CssTokenizer(Reader reader, Consumer<CssParserError> errorHandler) {
        this.input = new CssStreamReader(Objects.requireNonNull(reader, "reader cannot be null"));
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler cannot be null");
    }

    /**
     * Returns the next token of the input.
     *
     * @throws UncheckedIOException if the underlying reader fails
     */
    @Override
    public CssToken next() {
        try {
            return consumeToken();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Consumes the remaining input.
     *
     * @return the list of tokens, not including the terminating {@link CssTokenType#EOF} token
     */
    public List<CssToken> tokenize() throws IOException {
        List<CssToken> tokens = new ArrayList<>();

        while (true) {
            CssToken token = consumeToken();
            if (token.type() == CssTokenType.EOF) {
                break;
            }

            tokens.add(token);
        }

        return tokens;
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    private void error(CssParserError error) {
        errorHandler.accept(error);
    }

    private CssToken token(CssTokenType type, String data, int line, int column) {
        return new CssToken(type, data, input.captured(), line, column);
    }

    private CssToken delim(int codePoint, int line, int column) {
        return token(CssTokenType.DELIM, new String(Character.toChars(codePoint)), line, column);
    }

    /**
     * This algorithm consumes a single {@link CssToken} from the input.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-token">Consume a token</a>
     * @return a single token of any type
     */
    private CssToken consumeToken() throws IOException {
        if (eof != null) {
            return eof;
        }

        input.beginCapture();

        if (input.peek(COMMENT_START)) {
            return consumeCommentToken();
        }

        int codePoint = input.read();
        int line = input.currentLine(), column = input.currentColumn();

        return switch (codePoint) {
            case APOSTROPHE, QUOTATION_MARK -> consumeStringToken(codePoint, line, column);
            case NUMBER_SIGN -> handleNumberSign(line, column);
            case LEFT_PARENTHESIS -> token(CssTokenType.ROUND_BRACKET_OPEN, "(", line, column);
            case RIGHT_PARENTHESIS -> token(CssTokenType.ROUND_BRACKET_CLOSE, ")", line, column);
            case LEFT_SQUARE_BRACKET -> token(CssTokenType.SQUARE_BRACKET_OPEN, "[", line, column);
            case RIGHT_SQUARE_BRACKET -> token(CssTokenType.SQUARE_BRACKET_CLOSE, "]", line, column);
            case LEFT_CURLY_BRACKET -> token(CssTokenType.CURLY_BRACKET_OPEN, "{", line, column);
            case RIGHT_CURLY_BRACKET -> token(CssTokenType.CURLY_BRACKET_CLOSE, "}", line, column);
            case COMMA -> token(CssTokenType.COMMA, ",", line, column);
            case COLON -> token(CssTokenType.COLON, ":", line, column);
            case SEMICOLON -> token(CssTokenType.SEMICOLON, ";", line, column);
            case PLUS_SIGN, FULL_STOP -> handleNumberPrefix(codePoint, line, column);
            case HYPHEN_MINUS -> handleMinusSign(line, column);
            case LESS_THAN_SIGN -> handleLessThanSign(line, column);
            case COMMERCIAL_AT -> handleCommercialAt(line, column);
            case REVERSE_SOLIDUS -> handleReverseSolidus(line, column);
            case TILDE -> handleMatch(codePoint, CssTokenType.INCLUDE_MATCH, line, column);
            case CIRCUMFLEX_ACCENT -> handleMatch(codePoint, CssTokenType.PREFIX_MATCH, line, column);
            case DOLLAR_SIGN -> handleMatch(codePoint, CssTokenType.SUFFIX_MATCH, line, column);
            case ASTERISK -> handleMatch(codePoint, CssTokenType.SUBSTRING_MATCH, line, column);
            case VERTICAL_LINE -> handleVerticalLine(line, column);
            default -> handleOtherCodePoints(codePoint, line, column);
        };
    }

    /*
     * If the next input code point is an ident code point or the next two input code points are a valid escape, then:
     *   1. Create a <hash-token>.
     *   2. If the next 3 input code points would start an ident sequence, set the <hash-token>'s type flag to "id".
     *   3. Consume an ident sequence, and set the <hash-token>'s value to the returned string.
     *   4. Return the <hash-token>.
     * Otherwise, return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleNumberSign(int line, int column) throws IOException {
        if (input.peek(IDENT_CODE_POINT) || input.peek(VALID_ESCAPE)) {
            String value = consumeIdentSequence();
            return token(CssTokenType.HASH, value, line, column);
        }

        return delim(NUMBER_SIGN, line, column);
    }

    /*
     * If the input stream starts with a number, reconsume the current input code point,
     * consume a numeric token, and return it.
     *
     * Otherwise, return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleNumberPrefix(int codePoint, int line, int column) throws IOException {
        if (codePoint == FULL_STOP ? isDigit(input.peek()) : startsNumberAfterSign()) {
            input.unread(codePoint);
            return consumeNumericToken(line, column);
        }

        return delim(codePoint, line, column);
    }

    /*
     * If the next 3 input code points are U+0021 EXCLAMATION MARK U+002D HYPHEN-MINUS U+002D HYPHEN-MINUS (!--),
     * consume them and return a <CDO-token>.
     *
     * Otherwise, return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleLessThanSign(int line, int column) throws IOException {
        if (input.consume(EXCLAMATION_MARK, HYPHEN_MINUS, HYPHEN_MINUS)) {
            return token(CssTokenType.CDO, "<!--", line, column);
        }

        return delim(LESS_THAN_SIGN, line, column);
    }

    /*
     * If the next 3 input code points would start an ident sequence, consume an ident sequence, create
     * an <at-keyword-token> with its value set to the returned value, and return it.
     *
     * Otherwise, return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleCommercialAt(int line, int column) throws IOException {
        if (input.peek(IDENT_SEQUENCE_START)) {
            String value = consumeIdentSequence();
            return token(CssTokenType.AT_KEYWORD, value, line, column);
        }

        return delim(COMMERCIAL_AT, line, column);
    }

    /*
     * If the input stream starts with a valid escape, reconsume the current input code point,
     * consume an ident-like token, and return it.
     *
     * Otherwise, this is a parse error.
     * Return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleReverseSolidus(int line, int column) throws IOException {
        if (isValidEscape(REVERSE_SOLIDUS, input.peek())) {
            input.unread(REVERSE_SOLIDUS);
            return consumeIdentLikeToken(line, column);
        }

        error(CssParserError.invalidEscape(line, column));
        return delim(REVERSE_SOLIDUS, line, column);
    }

    /*
     * If the input stream starts with a number, reconsume the current input code point, consume
     * a numeric token, and return it.
     *
     * Otherwise, if the next 2 input code points are U+002D HYPHEN-MINUS U+003E GREATER-THAN SIGN (->),
     * consume them and return a <CDC-token>.
     *
     * Otherwise, if the input stream starts with an ident sequence, reconsume the current input code point,
     * consume an ident-like token, and return it.
     *
     * Otherwise, return a <delim-token> with its value set to the current input code point.
     */
    private CssToken handleMinusSign(int line, int column) throws IOException {
        if (startsNumberAfterSign()) {
            input.unread(HYPHEN_MINUS);
            return consumeNumericToken(line, column);
        }

        if (input.consume(HYPHEN_MINUS, GREATER_THAN_SIGN)) {
            return token(CssTokenType.CDC, "-->", line, column);
        }

        if (input.peek(HYPHEN_IDENT_REMAINDER)) {
            input.unread(HYPHEN_MINUS);
            return consumeIdentLikeToken(line, column);
        }

        return delim(HYPHEN_MINUS, line, column);
    }

    // https://www.w3.org/TR/css-syntax-3/#starts-with-a-number, the sign has been consumed
    private boolean startsNumberAfterSign() throws IOException {
        return isDigit(input.peek()) || input.peek(FULL_STOP_AND_DIGIT);
    }

    /*
     * ~=, ^=, $= and *= are attribute selector match tokens, everything else is a <delim-token>.
     */
    private CssToken handleMatch(int codePoint, CssTokenType matchType, int line, int column) throws IOException {
        if (input.consume(EQUALS_SIGN)) {
            return token(matchType, input.captured(), line, column);
        }

        return delim(codePoint, line, column);
    }

    private CssToken handleVerticalLine(int line, int column) throws IOException {
        if (input.consume(EQUALS_SIGN)) {
            return token(CssTokenType.DASH_MATCH, "|=", line, column);
        }

        if (input.consume(VERTICAL_LINE)) {
            return token(CssTokenType.COLUMN, "||", line, column);
        }

        return delim(VERTICAL_LINE, line, column);
    }

    private CssToken handleOtherCodePoints(int codePoint, int line, int column) throws IOException {
        if (codePoint < 0) {
            eof = CssToken.eof(line, Math.max(column, 0));
            return eof;
        }

        if (isWhitespace(codePoint)) {
            while (isWhitespace(input.peek())) {
                input.skip();
            }

            return token(CssTokenType.WHITESPACE, " ", line, column);
        }

        if (isDigit(codePoint)) {
            input.unread(codePoint);
            return consumeNumericToken(line, column);
        }

        if (isIdentStartCodePoint(codePoint)) {
            input.unread(codePoint);
            return consumeIdentLikeToken(line, column);
        }

        return delim(codePoint, line, column);
    }

    /**
     * This algorithm consumes a comment, including its delimiters.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-comment">Consume comments</a>
     */
    private CssToken consumeCommentToken() throws IOException {
        input.read();
        int line = input.currentLine(), column = input.currentColumn();
        input.read();
        var builder = new StringBuilder();

        while (true) {
            int next = input.read();

            if (next < 0) {
                error(CssParserError.unexpectedEndOfFile(line, column));
                break;
            }

            if (next == ASTERISK && input.consume(SOLIDUS)) {
                break;
            }

            builder.appendCodePoint(next);
        }

        return token(CssTokenType.COMMENT, builder.toString(), line, column);
    }

    /**
     * This algorithm returns an escaped code point.
     * <p>
     * Note: This algorithm assumes that the U+005C REVERSE SOLIDUS (\) has already been consumed and
     *       that the next input code point has already been verified to be part of a valid escape.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-escaped-code-point">Consume an escaped code point</a>
     */
    private int consumeEscapedCodePoint() throws IOException {
        int codePoint = input.read();

        if (isHexDigit(codePoint)) {
            var builder = new StringBuilder(6).appendCodePoint(codePoint);

            for (int i = 0; i < 5 && isHexDigit(input.peek()); ++i) {
                builder.appendCodePoint(input.read());
            }

            if (isWhitespace(input.peek())) {
                input.skip();
            }

            int value = Integer.parseInt(builder.toString(), 16);

            return value == 0
                || value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE
                || value > Character.MAX_CODE_POINT ? REPLACEMENT_CHARACTER : value;
        }

        if (codePoint < 0) {
            error(CssParserError.unexpectedEndOfFile(input.currentLine(), input.currentColumn()));
            return REPLACEMENT_CHARACTER;
        }

        return codePoint;
    }

    /**
     * This algorithm returns a string containing the largest name that can be formed from adjacent code
     * points in the stream, starting from the first.
     * <p>
     * Note: This algorithm does not do the verification of the first few code points that are necessary to
     *       ensure the returned code points would constitute an ident. If that is the intended use, ensure
     *       that the stream starts with an ident sequence before calling this algorithm.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-name">Consume an ident sequence</a>
     * @return an ident sequence
     */
    private String consumeIdentSequence() throws IOException {
        var builder = new StringBuilder();
        int codePoint = input.read();

        while (codePoint >= 0) {
            if (isIdentCodePoint(codePoint)) {
                builder.appendCodePoint(codePoint);
            } else {
                input.unread(codePoint);

                if (input.peek(VALID_ESCAPE)) {
                    input.consume(REVERSE_SOLIDUS);
                    builder.appendCodePoint(consumeEscapedCodePoint());
                } else {
                    break;
                }
            }

            codePoint = input.read();
        }

        return builder.toString();
    }

    /**
     * This algorithm returns an ident, function, url or bad-url token.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-ident-like-token">Consume an ident-like token</a>
     */
    private CssToken consumeIdentLikeToken(int line, int column) throws IOException {
        String result = consumeIdentSequence();

        if ("url".equalsIgnoreCase(result) && input.consume(LEFT_PARENTHESIS)) {
            while (input.peek(TWO_WHITESPACE)) {
                input.skip(); // consume one whitespace character
            }

            int codePoint = input.peek();

            if (codePoint == QUOTATION_MARK || codePoint == APOSTROPHE || input.peek(WHITESPACE_AND_QUOTE)) {
                return token(CssTokenType.FUNCTION, result, line, column);
            }

            return consumeUrlToken(line, column);
        }

        if (input.consume(LEFT_PARENTHESIS)) {
            return token(CssTokenType.FUNCTION, result, line, column);
        }

        return token(CssTokenType.IDENT, result, line, column);
    }

    /**
     * This algorithm returns either a url or a bad-url token.
     * <p>
     * Note: This algorithm assumes that the initial "url(" has already been consumed. This algorithm also assumes
     *       that it's being called to consume an "unquoted" value, like url(foo). A quoted value, like url("foo"),
     *       is returned as a function token.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-url-token">Consume a URL token</a>
     */
    private CssToken consumeUrlToken(int line, int column) throws IOException {
        var builder = new StringBuilder();
        skipWhitespace();

        while (true) {
            int codePoint = input.read();

            if (codePoint == RIGHT_PARENTHESIS) {
                return token(CssTokenType.URL, builder.toString(), line, column);
            }

            if (codePoint < 0) {
                error(CssParserError.unexpectedEndOfFile(line, column));
                return token(CssTokenType.URL, builder.toString(), line, column);
            }

            if (isWhitespace(codePoint)) {
                skipWhitespace();
                int next = input.peek();

                if (next == RIGHT_PARENTHESIS || next < 0) {
                    continue;
                }

                return badUrl(line, column);
            }

            if (codePoint == QUOTATION_MARK || codePoint == APOSTROPHE || codePoint == LEFT_PARENTHESIS
                    || isNonPrintableCodePoint(codePoint)) {
                return badUrl(line, column);
            }

            if (codePoint == REVERSE_SOLIDUS) {
                if (isValidEscape(REVERSE_SOLIDUS, input.peek())) {
                    builder.appendCodePoint(consumeEscapedCodePoint());
                } else {
                    return badUrl(line, column);
                }
            } else {
                builder.appendCodePoint(codePoint);
            }
        }
    }

    private CssToken badUrl(int line, int column) throws IOException {
        error(CssParserError.badUrl(line, column));
        consumeBadUrl();
        return token(CssTokenType.BAD_URL, "", line, column);
    }

    /**
     * This algorithm consumes the remnants of a bad URL from a stream of code points, "cleaning up" after
     * the tokenizer realizes that it's in the middle of a bad-url token rather than a url token.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-remnants-of-bad-url">Consume a bad URL</a>
     */
    private void consumeBadUrl() throws IOException {
        while (true) {
            if (input.peek(VALID_ESCAPE)) {
                input.skip();
                consumeEscapedCodePoint();
            } else {
                int codePoint = input.read();

                if (codePoint < 0 || codePoint == RIGHT_PARENTHESIS) {
                    break;
                }
            }
        }
    }

    private void skipWhitespace() throws IOException {
        while (isWhitespace(input.peek())) {
            input.skip();
        }
    }

    /**
     * This algorithm returns either a string or a bad-string token.
     * <p>
     * Note: the string delimiter, i.e. APOSTROPHE or QUOTATION MARK, has already been consumed.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-string-token">Consume a string token</a>
     */
    private CssToken consumeStringToken(int endingCodePoint, int line, int column) throws IOException {
        var builder = new StringBuilder();

        while (true) {
            int codePoint = input.read();

            if (codePoint < 0) {
                error(CssParserError.unexpectedEndOfFile(line, column));
                return token(CssTokenType.STRING, builder.toString(), line, column);
            }

            if (codePoint == endingCodePoint) {
                return token(CssTokenType.STRING, builder.toString(), line, column);
            }

            if (codePoint == LINE_FEED) {
                error(CssParserError.badString(line, column));
                input.unread(codePoint);
                return token(CssTokenType.BAD_STRING, builder.toString(), line, column);
            }

            if (codePoint == REVERSE_SOLIDUS) {
                int next = input.peek();

                if (next == LINE_FEED) {
                    input.skip();
                } else if (next >= 0) {
                    builder.appendCodePoint(consumeEscapedCodePoint());
                }
            } else {
                builder.appendCodePoint(codePoint);
            }
        }
    }

    /**
     * This algorithm returns the textual representation of a number.
     * <p>
     * Note: This algorithm does not do the verification of the first few code points that are necessary to
     *       ensure a number can be obtained from the stream. Ensure that the stream starts with a number
     *       before calling this algorithm.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-number">Consume a number</a>
     */
    private String consumeNumber() throws IOException {
        var builder = new StringBuilder();
        int codePoint = input.read();

        if (codePoint == PLUS_SIGN || codePoint == HYPHEN_MINUS) {
            builder.appendCodePoint(codePoint);
        } else {
            input.unread(codePoint);
        }

        consumeDigits(builder);

        if (input.peek(FULL_STOP_AND_DIGIT)) {
            builder.appendCodePoint(input.read())
                   .appendCodePoint(input.read());
            consumeDigits(builder);
        }

        if (input.peek(E_NOTATION_LONG)) {
            builder.appendCodePoint(input.read())
                   .appendCodePoint(input.read())
                   .appendCodePoint(input.read());
            consumeDigits(builder);
        } else if (input.peek(E_NOTATION_SHORT)) {
            builder.appendCodePoint(input.read())
                   .appendCodePoint(input.read());
            consumeDigits(builder);
        }

        return builder.toString();
    }

    private void consumeDigits(StringBuilder builder) throws IOException {
        while (isDigit(input.peek())) {
            builder.appendCodePoint(input.read());
        }
    }

    /**
     * This algorithm returns either a number, percentage or dimension token.
     *
     * @see <a href="https://www.w3.org/TR/css-syntax-3/#consume-numeric-token">Consume a numeric token</a>
     */
    private CssToken consumeNumericToken(int line, int column) throws IOException {
        String number = consumeNumber();

        if (input.peek(IDENT_SEQUENCE_START)) {
            String unit = consumeIdentSequence();
            return token(CssTokenType.DIMENSION, number + unit, line, column);
        }

        if (input.consume(PERCENTAGE_SIGN)) {
            return token(CssTokenType.PERCENTAGE, number, line, column);
        }

        return token(CssTokenType.NUMBER, number, line, column);
    }
}
