package stylekit.css.condition;

import stylekit.css.CssFormattable;

/**
 * A condition of an {@code @supports} rule.
 *
 * @see <a href="https://www.w3.org/TR/css-conditional-3/#at-supports">@supports</a>
 */
public sealed interface CssCondition extends CssFormattable
        permits EmptyCondition, DeclarationCondition, GroupCondition, NotCondition, AndCondition, OrCondition {

    /**
     * Evaluates the condition against the known properties.
     */
    boolean check();
}
