package test.com.stylekit.css.parser;

import com.stylekit.css.parser.CssBuilder;
import com.stylekit.css.syntax.CssTokenizer;
import stylekit.css.CssParser;
import stylekit.css.condition.AndCondition;
import stylekit.css.condition.CssCondition;
import stylekit.css.condition.DeclarationCondition;
import stylekit.css.condition.GroupCondition;
import stylekit.css.condition.NotCondition;
import stylekit.css.condition.OrCondition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionTest {

    private final CssParser parser = new CssParser();

    private CssBuilder builder(String text) {
        var builder = new CssBuilder(new CssTokenizer(text, error -> {}), parser, error -> {});
        builder.advance();
        return builder;
    }

    @Test
    void testDeclaration() {
        CssCondition condition = parser.parseCondition("(display: grid)");
        var declaration = assertInstanceOf(DeclarationCondition.class, condition);
        assertEquals("display", declaration.property().getName());
        assertEquals("grid", declaration.value().toCss());
        assertEquals("(display: grid)", condition.toCss());
        assertTrue(condition.check());
    }

    @Test
    void testUnknownPropertyIsNotSupported() {
        CssCondition condition = parser.parseCondition("(foo: bar)");
        assertInstanceOf(DeclarationCondition.class, condition);
        assertFalse(condition.check());
        assertTrue(parser.parseCondition("not (foo: bar)").check());
    }

    @Test
    void testSameConnectorIsFlattened() {
        var and = assertInstanceOf(AndCondition.class,
            parser.parseCondition("(color: red) and (display: grid) and (margin: 0)"));
        assertEquals(3, and.conditions().size());
        assertEquals("(color: red) and (display: grid) and (margin: 0)", and.toCss());

        var or = assertInstanceOf(OrCondition.class,
            parser.parseCondition("(color: red) or (foo: bar) or (x: y)"));
        assertEquals(3, or.conditions().size());
        assertTrue(or.check());
    }

    @Test
    void testOtherConnectorEndsAggregate() {
        CssBuilder builder = builder("(color: red) and (display: grid) or (margin: 0)");
        var and = assertInstanceOf(AndCondition.class, builder.createCondition());
        assertEquals(2, and.conditions().size());
        assertTrue(builder.current().isIdent("or"));

        builder = builder("(color: red) or (display: grid) and (margin: 0)");
        var or = assertInstanceOf(OrCondition.class, builder.createCondition());
        assertEquals(2, or.conditions().size());
        assertTrue(builder.current().isIdent("and"));
    }

    @Test
    void testMixedConnectorsAreNotACondition() {
        assertNull(parser.parseCondition("(color: red) and (display: grid) or (margin: 0)"));
    }

    @Test
    void testMixedConnectorsInGroups() {
        CssCondition condition = parser.parseCondition("((color: red) and (display: grid)) or (margin: 0)");
        var or = assertInstanceOf(OrCondition.class, condition);
        var group = assertInstanceOf(GroupCondition.class, or.conditions().get(0));
        assertInstanceOf(AndCondition.class, group.content());
        assertEquals("((color: red) and (display: grid)) or (margin: 0)", condition.toCss());
    }

    @Test
    void testNot() {
        var not = assertInstanceOf(NotCondition.class, parser.parseCondition("not (display: grid)"));
        assertInstanceOf(DeclarationCondition.class, not.content());
        assertFalse(not.check());
        assertEquals("not (display: grid)", not.toCss());
    }

    @Test
    void testNotWithoutOperandIsNull() {
        assertNull(parser.parseCondition("not"));
        assertNull(parser.parseCondition("not (a)"));
        assertNull(parser.parseCondition("not not"));
    }

    @Test
    void testAggregateWithoutSecondOperandIsNull() {
        assertNull(builder("(color: red) and").createCondition());
        assertNull(builder("(color: red) or garbage").createCondition());
    }

    @Test
    void testBareIdentifierIsNotACondition() {
        assertNull(parser.parseCondition("(a) and (b)"));
        assertNull(parser.parseCondition("display: grid"));
    }

    @Test
    void testImportantInCondition() {
        var declaration = assertInstanceOf(DeclarationCondition.class,
            parser.parseCondition("(color: red !important)"));
        assertEquals("red", declaration.value().toCss());
        assertTrue(declaration.property().isImportant());
    }
}
