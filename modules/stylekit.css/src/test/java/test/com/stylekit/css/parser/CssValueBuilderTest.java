package test.com.stylekit.css.parser;

import com.stylekit.css.parser.CssValueBuilder;
import com.stylekit.css.syntax.CssTokenizer;
import stylekit.css.syntax.CssTokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class CssValueBuilderTest {

    private CssValueBuilder builder;

    @BeforeEach
    void setup() {
        builder = new CssValueBuilder();
    }

    private void apply(String text) throws IOException {
        new CssTokenizer(text, error -> {}).tokenize().forEach(builder::apply);
    }

    @Test
    void testPlainValue() throws IOException {
        apply("1px  solid\nred ");
        assertTrue(builder.isValid());
        assertFalse(builder.isImportant());
        assertEquals("1px solid red", builder.toValue().toCss());
    }

    @Test
    void testImportantIsStripped() throws IOException {
        apply("red ! important ");
        assertTrue(builder.isValid());
        assertTrue(builder.isImportant());
        assertEquals("red", builder.toValue().toCss());
    }

    @Test
    void testExclamationMarkElsewhereIsInvalid() throws IOException {
        apply("red ! blue");
        assertFalse(builder.isValid());
        assertFalse(builder.isImportant());
        assertNotNull(builder.toValue());
    }

    @Test
    void testOnlyImportantIsEmpty() throws IOException {
        apply("!important");
        assertTrue(builder.isImportant());
        assertNull(builder.toValue());
        assertFalse(builder.isValid());
    }

    @Test
    void testEmptyValue() throws IOException {
        apply("  /* nothing */ ");
        assertNull(builder.toValue());
        assertFalse(builder.isValid());
    }

    @Test
    void testBracketsAreTracked() throws IOException {
        apply("rgb(1, 2");
        assertFalse(builder.isReady());
        assertFalse(builder.isReady(CssTokenType.ROUND_BRACKET_CLOSE));
        assertTrue(builder.isReady(CssTokenType.CURLY_BRACKET_CLOSE));
        assertFalse(builder.isValid());

        apply(", 3)");
        assertTrue(builder.isReady());
        assertTrue(builder.isValid());
        assertEquals("rgb(1, 2, 3)", builder.toValue().toCss());
    }

    @Test
    void testMismatchedClosingBracketIsInvalid() throws IOException {
        apply("a)");
        assertFalse(builder.isValid());
    }

    @Test
    void testAtKeywordIsInvalid() throws IOException {
        apply("foo @bar");
        assertFalse(builder.isValid());
    }
}
