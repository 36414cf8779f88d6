package test.stylekit.css;

import stylekit.css.CssKeyframesRule;
import stylekit.css.CssParser;
import stylekit.css.CssSyntaxException;
import stylekit.css.KeyframeSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CssKeyframesRuleTest {

    private CssParser parser;
    private CssKeyframesRule rule;

    @BeforeEach
    void setup() {
        parser = new CssParser();
        rule = (CssKeyframesRule)parser.parseRule("@keyframes pulse { from { opacity: 0 } to { opacity: 1 } }");
    }

    @Test
    void testAppendRule() {
        rule.appendRule("50% { opacity: 0.5 }");
        assertEquals(3, rule.getRules().size());
        assertEquals("50%", rule.getRules().get(2).getKeyText());
        assertSame(rule, rule.getRules().get(2).getParentRule());
        assertThrows(CssSyntaxException.class, () -> rule.appendRule("150% { opacity: 0 }"));
    }

    @Test
    void testFindAndDeleteRule() {
        assertNotNull(rule.findRule("to"));
        assertSame(rule.getRules().get(0), rule.findRule("0%"));
        assertNull(rule.findRule("50%"));
        assertNull(rule.findRule("garbage"));

        rule.deleteRule("from");
        assertEquals(1, rule.getRules().size());
        assertEquals("100%", rule.getRules().get(0).getKeyText());
    }

    @Test
    void testToCss() {
        assertEquals("@keyframes pulse { 0% { opacity: 0 } 100% { opacity: 1 } }", rule.toCss());

        rule.setName("two words");
        assertEquals("@keyframes \"two words\" { 0% { opacity: 0 } 100% { opacity: 1 } }", rule.toCss());
    }

    @Test
    void testStringName() {
        var named = (CssKeyframesRule)parser.parseRule("@keyframes \"slide in\" { }");
        assertEquals("slide in", named.getName());
    }

    @Test
    void testKeyframeSelector() {
        KeyframeSelector selector = parser.parseKeyframeSelector("from, 50%, to");
        assertEquals(List.of(0.0, 50.0, 100.0), selector.getKeys());
        assertEquals("0%, 50%, 100%", selector.toCss());
        assertEquals("12.5%", new KeyframeSelector(List.of(12.5)).toCss());

        assertNull(parser.parseKeyframeSelector("from,"));
        assertNull(parser.parseKeyframeSelector("from to"));
        assertNull(parser.parseKeyframeSelector("101%"));
        assertThrows(IllegalArgumentException.class, () -> new KeyframeSelector(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new KeyframeSelector(List.of(-1.0)));
    }
}
