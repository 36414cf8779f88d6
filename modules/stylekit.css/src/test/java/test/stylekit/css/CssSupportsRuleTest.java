package test.stylekit.css;

import stylekit.css.CssParser;
import stylekit.css.CssSupportsRule;
import stylekit.css.CssSyntaxException;
import stylekit.css.condition.EmptyCondition;
import stylekit.css.condition.OrCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CssSupportsRuleTest {

    private CssSupportsRule rule;

    @BeforeEach
    void setup() {
        rule = (CssSupportsRule)new CssParser().parseRule("@supports (display: grid) { a { color: red } }");
    }

    @Test
    void testConditionText() {
        assertEquals("(display: grid)", rule.getConditionText());
        assertTrue(rule.isSupported());

        rule.setConditionText("(foo: bar) or (color: red)");
        assertInstanceOf(OrCondition.class, rule.getCondition());
        assertTrue(rule.isSupported());
        assertEquals("@supports (foo: bar) or (color: red) { a { color: red } }", rule.toCss());
    }

    @Test
    void testInvalidConditionTextThrows() {
        assertThrows(CssSyntaxException.class, () -> rule.setConditionText("garbage"));
        assertThrows(CssSyntaxException.class, () -> rule.setConditionText("(a: 1) and (b: 2) or (c: 3)"));
        assertThrows(CssSyntaxException.class, () -> rule.setConditionText(null));
        assertEquals("(display: grid)", rule.getConditionText());
    }

    @Test
    void testUnsupportedCondition() {
        rule.setConditionText("not (display: grid)");
        assertFalse(rule.isSupported());

        rule.setConditionText("(foo: bar)");
        assertFalse(rule.isSupported());
    }

    @Test
    void testEmptyCondition() {
        rule.setCondition(EmptyCondition.INSTANCE);
        assertTrue(rule.isSupported());
        assertEquals("@supports { a { color: red } }", rule.toCss());
    }
}
