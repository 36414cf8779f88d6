package test.com.stylekit.css.syntax;

import com.stylekit.css.syntax.CssParserError;
import com.stylekit.css.syntax.CssTokenizer;
import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import org.junit.jupiter.api.Test;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static stylekit.css.syntax.CssTokenType.*;

public class CssTokenizerTest {

    private final List<CssParserError> errors = new ArrayList<>();

    private List<CssToken> tokenize(String text) throws IOException {
        return new CssTokenizer(text, errors::add).tokenize();
    }

    private static List<CssTokenType> types(List<CssToken> tokens) {
        return tokens.stream().map(CssToken::type).toList();
    }

    private static String text(List<CssToken> tokens) {
        var builder = new StringBuilder();
        tokens.forEach(token -> builder.append(token.text()));
        return builder.toString();
    }

    @Test
    void testIdentAndFunction() throws IOException {
        var tokens = tokenize("color rgb(");
        assertEquals(List.of(IDENT, WHITESPACE, FUNCTION), types(tokens));
        assertEquals("color", tokens.get(0).data());
        assertEquals("rgb", tokens.get(2).data());
        assertEquals("rgb(", tokens.get(2).text());
    }

    @Test
    void testAtKeyword() throws IOException {
        var tokens = tokenize("@media");
        assertEquals(List.of(AT_KEYWORD), types(tokens));
        assertEquals("media", tokens.get(0).data());
        assertEquals("@media", tokens.get(0).text());
    }

    @Test
    void testNumericTokens() throws IOException {
        var tokens = tokenize("10px 50% -3.5 +.5e2");
        assertEquals(List.of(DIMENSION, WHITESPACE, PERCENTAGE, WHITESPACE, NUMBER, WHITESPACE, NUMBER), types(tokens));
        assertEquals("10px", tokens.get(0).data());
        assertEquals("50", tokens.get(2).data());
        assertEquals("50%", tokens.get(2).text());
        assertEquals("-3.5", tokens.get(4).data());
        assertEquals("+.5e2", tokens.get(6).data());
    }

    @Test
    void testStringsAndUrls() throws IOException {
        var tokens = tokenize("\"a\\\"b\" url(x.png) url(\"y\")");
        assertEquals(List.of(STRING, WHITESPACE, URL, WHITESPACE, FUNCTION, STRING, ROUND_BRACKET_CLOSE), types(tokens));
        assertEquals("a\"b", tokens.get(0).data());
        assertEquals("\"a\\\"b\"", tokens.get(0).text());
        assertEquals("x.png", tokens.get(2).data());
        assertEquals("url(x.png)", tokens.get(2).text());
        assertEquals("y", tokens.get(5).data());
        assertTrue(errors.isEmpty());
    }

    @Test
    void testBadStringIsReported() throws IOException {
        var tokens = tokenize("'abc\nx");
        assertEquals(List.of(BAD_STRING, WHITESPACE, IDENT), types(tokens));
        assertEquals(1, errors.size());
        assertEquals(CssParserError.Kind.BAD_STRING, errors.get(0).kind());
    }

    @Test
    void testCommentsAreTokens() throws IOException {
        var tokens = tokenize("a/* c */b");
        assertEquals(List.of(IDENT, COMMENT, IDENT), types(tokens));
        assertEquals(" c ", tokens.get(1).data());
        assertEquals("/* c */", tokens.get(1).text());
    }

    @Test
    void testUnterminatedComment() throws IOException {
        var tokens = tokenize("/* abc");
        assertEquals(List.of(COMMENT), types(tokens));
        assertEquals(CssParserError.Kind.UNEXPECTED_END_OF_FILE, errors.get(0).kind());
    }

    @Test
    void testMatchTokens() throws IOException {
        var tokens = tokenize("~= |= ^= $= *= ||");
        assertEquals(List.of(INCLUDE_MATCH, WHITESPACE, DASH_MATCH, WHITESPACE, PREFIX_MATCH, WHITESPACE,
                             SUFFIX_MATCH, WHITESPACE, SUBSTRING_MATCH, WHITESPACE, COLUMN), types(tokens));
    }

    @Test
    void testCdoAndCdc() throws IOException {
        var tokens = tokenize("<!-- -->");
        assertEquals(List.of(CDO, WHITESPACE, CDC), types(tokens));
        assertTrue(tokens.get(0).type().isTrivia());
        assertTrue(tokens.get(2).type().isTrivia());
    }

    @Test
    void testHash() throws IOException {
        var tokens = tokenize("#fff #123");
        assertEquals(List.of(HASH, WHITESPACE, HASH), types(tokens));
        assertEquals("fff", tokens.get(0).data());
        assertEquals("123", tokens.get(2).data());
    }

    @Test
    void testDelimiters() throws IOException {
        var tokens = tokenize("a.b>c !");
        assertEquals(List.of(IDENT, DELIM, IDENT, DELIM, IDENT, WHITESPACE, DELIM), types(tokens));
        assertEquals(".", tokens.get(1).text());
        assertEquals("!", tokens.get(6).text());
    }

    @Test
    void testEndOfInputIsReturnedRepeatedly() {
        var tokenizer = new CssTokenizer("a", errors::add);
        assertEquals(IDENT, tokenizer.next().type());
        CssToken eof = tokenizer.next();
        assertEquals(EOF, eof.type());
        assertSame(eof, tokenizer.next());
        assertSame(eof, tokenizer.next());
    }

    @Test
    void testTokenTextReproducesInput() throws IOException {
        String css = "@media screen and (min-width: 100px) {\n"
                   + "  a.b > c:hover, #id::before { color: rgb(1, 2, 3) !important; }\n"
                   + "  /* comment */ [href^=\"http\"] { background: url(x.png) }\n"
                   + "}\n";
        assertEquals(css, text(tokenize(css)));
    }

    @Test
    void testLineEndingsAreNormalized() throws IOException {
        assertEquals("a\nb\nc", text(tokenize("a\r\nb\rc")));
    }

    @Test
    void testLinesAreCounted() throws IOException {
        var tokens = tokenize("a\nb");
        assertEquals(tokens.get(0).line() + 1, tokens.get(2).line());
    }
}
