package test.com.stylekit.css.parser;

import com.stylekit.css.syntax.CssParserError;
import stylekit.css.CssParser;
import stylekit.css.CssParserOptions;
import stylekit.css.CssProperty;
import stylekit.css.CssStyleDeclaration;
import stylekit.css.CssStyleRule;
import stylekit.css.CssStyleSheet;
import stylekit.css.CssUnknownProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationTest {

    private CssParser parser;
    private List<CssParserError> errors;

    @BeforeEach
    void setup() {
        parser = new CssParser();
        errors = new ArrayList<>();
        parser.addErrorListener(errors::add);
    }

    private List<CssParserError.Kind> kinds() {
        return errors.stream().map(CssParserError::kind).toList();
    }

    private CssStyleDeclaration style(String css) {
        CssStyleSheet sheet = parser.parseStyleSheet(css);
        return ((CssStyleRule)sheet.getRules().get(0)).getStyle();
    }

    @Test
    void testMissingValueDoesNotAffectFollowingDeclarations() {
        CssStyleDeclaration style = style("a { color: ; other: red; }");
        assertEquals(1, style.getLength());
        assertEquals("red", style.getPropertyValue("other"));
        assertInstanceOf(CssUnknownProperty.class, style.getProperty("other"));
        assertEquals("", style.getPropertyValue("color"));
        assertTrue(kinds().contains(CssParserError.Kind.VALUE_MISSING));
        assertTrue(kinds().contains(CssParserError.Kind.UNKNOWN_DECLARATION_NAME));
    }

    @Test
    void testMissingColon() {
        CssStyleDeclaration style = style("a { color red; margin: 0 }");
        assertEquals(1, style.getLength());
        assertEquals("0", style.getPropertyValue("margin"));
        assertEquals(List.of(CssParserError.Kind.COLON_MISSING), kinds());
    }

    @Test
    void testInvalidValue() {
        CssStyleDeclaration style = style("a { color: red ! blue; margin: 0 }");
        assertEquals("", style.getPropertyValue("color"));
        assertEquals("0", style.getPropertyValue("margin"));
        assertEquals(List.of(CssParserError.Kind.INVALID_VALUE), kinds());
    }

    @Test
    void testInvalidValueIsKeptWhenTolerated() {
        parser = new CssParser(CssParserOptions.DEFAULT.withTolerateInvalidValues(true));
        CssStyleDeclaration style = style("a { color: red ! blue }");
        assertEquals("red ! blue", style.getPropertyValue("color"));
    }

    @Test
    void testUnknownDeclarationsAreNotReportedWhenIncluded() {
        parser = new CssParser(CssParserOptions.DEFAULT.withIncludeUnknownDeclarations(true));
        parser.addErrorListener(errors::add);
        CssStyleDeclaration style = style("a { foo: bar; color: red }");
        assertEquals(2, style.getLength());
        assertInstanceOf(CssUnknownProperty.class, style.getProperty("foo"));
        assertTrue(errors.isEmpty());
    }

    @Test
    void testImportant() {
        CssStyleDeclaration style = style("a { color: red !important; margin: 0 ! IMPORTANT }");
        assertEquals("red", style.getPropertyValue("color"));
        assertEquals("important", style.getPropertyPriority("color"));
        assertEquals("important", style.getPropertyPriority("margin"));
        assertEquals("color: red !important; margin: 0 !important", style.toCss());
    }

    @Test
    void testLastDeclarationWins() {
        CssStyleDeclaration style = style("a { color: red; margin: 0; COLOR: blue }");
        assertEquals(2, style.getLength());
        assertEquals("blue", style.getPropertyValue("color"));
        assertEquals("color", style.getProperties().get(0).getName());
    }

    @Test
    void testCustomProperty() {
        CssStyleDeclaration style = style("a { --Main-Color: #06c; color: var(--Main-Color) }");
        assertEquals("#06c", style.getPropertyValue("--Main-Color"));
        assertEquals("", style.getPropertyValue("--main-color"));
        assertEquals("var(--Main-Color)", style.getPropertyValue("color"));
        assertTrue(errors.isEmpty());
    }

    @Test
    void testNestedBracketsInValue() {
        CssStyleDeclaration style = style("a { background: url(x.png) no-repeat, linear-gradient(red, blue); grid-template-areas: \"a;b\" }");
        assertEquals("url(x.png) no-repeat, linear-gradient(red, blue)", style.getPropertyValue("background"));
        assertEquals("\"a;b\"", style.getPropertyValue("grid-template-areas"));
    }

    @Test
    void testSemicolonInsideFunction() {
        CssStyleDeclaration style = style("a { content: foo(a; b); color: red }");
        assertEquals("foo(a; b)", style.getPropertyValue("content"));
        assertEquals("red", style.getPropertyValue("color"));
    }

    @Test
    void testParseDeclaration() {
        CssProperty property = parser.parseDeclaration("color: red !important");
        assertEquals("color", property.getName());
        assertEquals("red", property.getValue().toCss());
        assertTrue(property.isImportant());

        assertNull(parser.parseDeclaration("color:"));
        assertNull(parser.parseDeclaration("color: red; margin: 0"));
    }

    @Test
    void testParseDeclarations() {
        CssStyleDeclaration style = parser.parseDeclarations("color: red; margin: 0 auto;");
        assertEquals(2, style.getLength());
        assertEquals("0 auto", style.getPropertyValue("margin"));
    }

    @Test
    void testStyleDeclarationEditing() {
        CssStyleDeclaration style = parser.parseDeclarations("color: red");
        style.setProperty("margin", "0", "important");
        assertEquals("important", style.getPropertyPriority("margin"));
        assertEquals("red", style.removeProperty("color"));
        assertEquals("", style.removeProperty("color"));
        assertEquals("margin: 0 !important", style.getCssText());

        style.setCssText("width: 1px; height: 2px");
        assertEquals(2, style.getLength());
        assertEquals("", style.getPropertyValue("margin"));
    }
}
