package test.com.stylekit.css.parser;

import com.stylekit.css.syntax.CssParserError;
import stylekit.css.CssCharsetRule;
import stylekit.css.CssDocumentRule;
import stylekit.css.CssFontFaceRule;
import stylekit.css.CssImportRule;
import stylekit.css.CssKeyframesRule;
import stylekit.css.CssMediaRule;
import stylekit.css.CssNamespaceRule;
import stylekit.css.CssPageRule;
import stylekit.css.CssParser;
import stylekit.css.CssParserOptions;
import stylekit.css.CssRule;
import stylekit.css.CssRuleType;
import stylekit.css.CssStyleRule;
import stylekit.css.CssStyleSheet;
import stylekit.css.CssSupportsRule;
import stylekit.css.CssUnknownRule;
import stylekit.css.CssViewportRule;
import stylekit.css.condition.AndCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CssBuilderTest {

    private CssParser parser;

    @BeforeEach
    void setup() {
        parser = new CssParser();
    }

    private static List<CssParserError.Kind> kinds(CssStyleSheet sheet) {
        return sheet.getErrors().stream().map(CssParserError::kind).toList();
    }

    private CssRule single(String css) {
        CssStyleSheet sheet = parser.parseStyleSheet(css);
        assertEquals(1, sheet.getRules().size(), () -> "rules of " + css);
        return sheet.getRules().get(0);
    }

    @Test
    void testStyleRule() {
        var rule = (CssStyleRule)single("a, b > c { color: red; margin: 0 }");
        assertEquals(CssRuleType.STYLE, rule.getType());
        assertEquals("a, b > c", rule.getSelectorText());
        assertEquals(List.of("a", "b > c"), rule.getSelector().selectors());
        assertEquals("red", rule.getStyle().getPropertyValue("color"));
        assertEquals("0", rule.getStyle().getPropertyValue("margin"));
        assertEquals("a, b > c { color: red; margin: 0 }", rule.toCss());
    }

    @Test
    void testEmptyStyleRule() {
        var rule = (CssStyleRule)single("p {}");
        assertTrue(rule.getStyle().isEmpty());
        assertEquals("p { }", rule.toCss());
    }

    @Test
    void testInvalidSelectorDropsRule() {
        CssStyleSheet sheet = parser.parseStyleSheet("a..b { color: red } p { color: blue }");
        assertEquals(1, sheet.getRules().size());
        assertEquals("p", ((CssStyleRule)sheet.getRules().get(0)).getSelectorText());
        assertEquals(List.of(CssParserError.Kind.INVALID_SELECTOR), kinds(sheet));
    }

    @Test
    void testInvalidSelectorIsKeptWhenTolerated() {
        parser = new CssParser(CssParserOptions.DEFAULT.withTolerateInvalidValues(true));
        var rule = (CssStyleRule)single("a..b { color: red }");
        assertEquals("a..b", rule.getSelectorText());
    }

    @Test
    void testMediaRule() {
        var rule = (CssMediaRule)single("@media screen and (min-width: 100px) { a { color: red } }");
        assertEquals(CssRuleType.MEDIA, rule.getType());
        assertEquals("screen and (min-width: 100px)", rule.getMedia().getMediaText());
        assertEquals(1, rule.getRules().size());
        assertSame(rule, rule.getRules().get(0).getParentRule());
        assertEquals("@media screen and (min-width: 100px) { a { color: red } }", rule.toCss());
    }

    @Test
    void testMalformedMediaListFallsBackToNotAll() {
        var rule = (CssMediaRule)single("@media screen,,tv { a { color: red } }");
        assertEquals("not all", rule.getMedia().getMediaText());
        assertEquals(1, rule.getRules().size());
    }

    @Test
    void testUnknownMediaFeature() {
        var rule = (CssMediaRule)single("@media (foo: bar) { }");
        assertEquals("not all", rule.getMedia().getMediaText());

        parser = new CssParser(CssParserOptions.DEFAULT.withTolerateInvalidConstraints(true));
        rule = (CssMediaRule)single("@media (foo: bar) { }");
        assertEquals("(foo: bar)", rule.getMedia().getMediaText());
    }

    @Test
    void testMediaStatementWithoutBlockIsDropped() {
        var rule = single("@media screen; a { color: red }");
        assertInstanceOf(CssStyleRule.class, rule);
    }

    @Test
    void testSupportsRule() {
        var rule = (CssSupportsRule)single("@supports (display: grid) and (not (foo: bar)) { a { color: red } }");
        assertInstanceOf(AndCondition.class, rule.getCondition());
        assertEquals("(display: grid) and (not (foo: bar))", rule.getConditionText());
        assertTrue(rule.isSupported());
        assertEquals(1, rule.getRules().size());
    }

    @Test
    void testSupportsRuleWithoutCondition() {
        var rule = (CssSupportsRule)single("@supports { }");
        assertEquals("", rule.getConditionText());
        assertTrue(rule.isSupported());
        assertEquals("@supports { }", rule.toCss());
    }

    @Test
    void testImportRule() {
        var rule = (CssImportRule)single("@import url(\"theme.css\") screen, print;");
        assertEquals("theme.css", rule.getHref());
        assertEquals("screen, print", rule.getMedia().getMediaText());

        rule = (CssImportRule)single("@import 'x.css';");
        assertEquals("x.css", rule.getHref());
        assertTrue(rule.getMedia().isEmpty());
        assertEquals("@import url(\"x.css\");", rule.toCss());
    }

    @Test
    void testCharsetRule() {
        var rule = (CssCharsetRule)single("@charset \"utf-8\";");
        assertEquals("utf-8", rule.getCharset());
    }

    @Test
    void testNamespaceRule() {
        var rule = (CssNamespaceRule)single("@namespace svg url(http://www.w3.org/2000/svg);");
        assertEquals("svg", rule.getPrefix());
        assertEquals("http://www.w3.org/2000/svg", rule.getNamespaceUri());
        assertEquals("@namespace svg url(\"http://www.w3.org/2000/svg\");", rule.toCss());
    }

    @Test
    void testNamespacePrefixIsEscaped() {
        var rule = (CssNamespaceRule)single("@namespace \\31 a url(x);");
        assertEquals("1a", rule.getPrefix());
        assertEquals("@namespace \\31 a url(\"x\");", rule.toCss());

        rule = (CssNamespaceRule)single("@namespace \\  url(x);");
        assertEquals(" ", rule.getPrefix());
        assertEquals("@namespace \\  url(\"x\");", rule.toCss());
    }

    @Test
    void testFontFaceRule() {
        CssStyleSheet sheet = parser.parseStyleSheet("@font-face { font-family: Foo; src: url(foo.woff); color: red }");
        var rule = (CssFontFaceRule)sheet.getRules().get(0);
        assertEquals("Foo", rule.getStyle().getPropertyValue("font-family"));
        assertEquals("url(foo.woff)", rule.getStyle().getPropertyValue("src"));
        assertEquals(List.of(CssParserError.Kind.UNKNOWN_DECLARATION_NAME), kinds(sheet));
    }

    @Test
    void testPageRule() {
        var rule = (CssPageRule)single("@page :first { margin: 1in }");
        assertEquals(":first", rule.getSelector().text());
        assertEquals("@page :first { margin: 1in }", rule.toCss());

        rule = (CssPageRule)single("@page { margin: 1in }");
        assertNull(rule.getSelector());
        assertEquals("@page { margin: 1in }", rule.toCss());
    }

    @Test
    void testViewportRule() {
        var rule = (CssViewportRule)single("@viewport { width: device-width }");
        assertEquals("device-width", rule.getStyle().getPropertyValue("width"));
    }

    @Test
    void testKeyframesRule() {
        var rule = (CssKeyframesRule)single(
            "@keyframes fade { from { opacity: 0 } 50%, 75% { opacity: 0.5 } to { opacity: 1 } }");
        assertEquals("fade", rule.getName());
        assertEquals(3, rule.getRules().size());
        assertEquals(List.of(0.0), rule.getRules().get(0).getKey().getKeys());
        assertEquals("50%, 75%", rule.getRules().get(1).getKeyText());
        assertEquals("100%", rule.getRules().get(2).getKeyText());
        assertSame(rule, rule.getRules().get(1).getParentRule());
    }

    @Test
    void testInvalidKeyframeIsDropped() {
        CssStyleSheet sheet = parser.parseStyleSheet("@keyframes x { 120% { opacity: 0 } to { opacity: 1 } }");
        var rule = (CssKeyframesRule)sheet.getRules().get(0);
        assertEquals(1, rule.getRules().size());
        assertEquals(List.of(CssParserError.Kind.INVALID_SELECTOR), kinds(sheet));
    }

    @Test
    void testDocumentRule() {
        var rule = (CssDocumentRule)single(
            "@document url(http://a.com/), url-prefix(\"http://b.com/\"), domain(\"c.com\"), "
            + "regexp(\"https?://d\\\\.com/.*\") { a { color: red } }");
        assertEquals(4, rule.getFunctions().size());
        assertEquals(1, rule.getRules().size());
        assertTrue(rule.matches("http://a.com/"));
        assertTrue(rule.matches("http://b.com/page"));
        assertTrue(rule.matches("http://www.c.com/"));
        assertTrue(rule.matches("https://d.com/x"));
        assertFalse(rule.matches("http://e.com/"));
    }

    @Test
    void testDocumentRuleWithoutFunctionsIsDropped() {
        CssStyleSheet sheet = parser.parseStyleSheet("@document { a { color: red } } b { color: blue }");
        assertEquals(1, sheet.getRules().size());
        assertEquals("b", ((CssStyleRule)sheet.getRules().get(0)).getSelectorText());
        assertTrue(kinds(sheet).contains(CssParserError.Kind.INVALID_TOKEN));
    }

    @Test
    void testUnknownDocumentFunctionDropsOnlyItsRule() {
        CssStyleSheet sheet = parser.parseStyleSheet(
            "@document media(\"x\") { a { color: red } } b { color: blue } c { color: green }");
        assertEquals(2, sheet.getRules().size());
        assertEquals("b", ((CssStyleRule)sheet.getRules().get(0)).getSelectorText());
        assertEquals("c", ((CssStyleRule)sheet.getRules().get(1)).getSelectorText());
        assertTrue(kinds(sheet).contains(CssParserError.Kind.INVALID_TOKEN));
    }

    @Test
    void testUnknownAtRuleIsReportedAndSkipped() {
        CssStyleSheet sheet = parser.parseStyleSheet("@foo bar { x: 1; } a { color: red }");
        assertEquals(1, sheet.getRules().size());
        assertInstanceOf(CssStyleRule.class, sheet.getRules().get(0));
        assertEquals(List.of(CssParserError.Kind.UNKNOWN_AT_RULE), kinds(sheet));
    }

    @Test
    void testUnknownAtRuleIsCaptured() {
        parser = new CssParser(CssParserOptions.DEFAULT.withIncludeUnknownRules(true));
        String css = "@foo bar { x: 1; { y: 2; } }";
        var rule = (CssUnknownRule)single(css);
        assertEquals(CssRuleType.UNKNOWN, rule.getType());
        assertEquals("foo", rule.getName());
        assertEquals("bar", rule.getPrelude().trim());

        String content = rule.getContent();
        assertTrue(content.startsWith("{"));
        assertTrue(content.endsWith("}"));
        assertEquals(content.chars().filter(c -> c == '{').count(), content.chars().filter(c -> c == '}').count());
        assertEquals(css, rule.toCss());
    }

    @Test
    void testUnknownStatementAtRuleIsCaptured() {
        parser = new CssParser(CssParserOptions.DEFAULT.withIncludeUnknownRules(true));
        var rule = (CssUnknownRule)single("@custom-thing a b;");
        assertEquals("custom-thing", rule.getName());
        assertEquals(";", rule.getContent());
    }

    @Test
    void testUnknownAtRuleNameIsEscaped() {
        parser = new CssParser(CssParserOptions.DEFAULT.withIncludeUnknownRules(true));
        var rule = (CssUnknownRule)single("@x\\:y z;");
        assertEquals("x:y", rule.getName());
        assertTrue(rule.toCss().startsWith("@x\\:y"), rule.toCss());
    }

    @Test
    void testInvalidTokensAtTopLevel() {
        CssStyleSheet sheet = parser.parseStyleSheet("\"str\" { } a { color: red }");
        assertEquals(1, sheet.getRules().size());
        assertEquals(List.of(CssParserError.Kind.INVALID_TOKEN), kinds(sheet));

        sheet = parser.parseStyleSheet("{ color: red } a { color: red }");
        assertEquals(1, sheet.getRules().size());
        assertEquals(List.of(CssParserError.Kind.INVALID_BLOCK_START), kinds(sheet));
    }

    @Test
    void testStrayClosingBraceDoesNotStopParsing() {
        CssStyleSheet sheet = parser.parseStyleSheet("a { color: red } } b { color: blue }");
        assertEquals(2, sheet.getRules().size());
        assertTrue(kinds(sheet).contains(CssParserError.Kind.INVALID_TOKEN));
    }

    @Test
    void testTruncatedInputTerminates() {
        String[] inputs = {
            "a {", "a { color:", "@media screen {", "@media (", "@supports (not", "@keyframes k { from {",
            "@document url-prefix(", "@import url(", "}}}}", "{{{{", "a { b: (((; }", "@page :", "a, {"
        };

        for (String input : inputs) {
            assertNotNull(parser.parseStyleSheet(input), input);
        }
    }

    @Test
    void testMissingBlockAtEndOfInput() {
        CssStyleSheet sheet = parser.parseStyleSheet("a");
        assertTrue(sheet.getRules().isEmpty());
        assertEquals(List.of(CssParserError.Kind.UNEXPECTED_END_OF_FILE), kinds(sheet));
    }

    @Test
    void testRulesAreNestedInMediaAndSupports() {
        var media = (CssMediaRule)single(
            "@media print { @supports (display: grid) { a { color: red } } b { color: blue } }");
        assertEquals(2, media.getRules().size());

        var supports = (CssSupportsRule)media.getRules().get(0);
        assertSame(media, supports.getParentRule());
        assertEquals(1, supports.getRules().size());
        assertSame(supports, supports.getRules().get(0).getParentRule());
    }
}
