package stylekit.css;

import stylekit.css.condition.CssCondition;
import stylekit.css.condition.EmptyCondition;
import java.util.Objects;

/**
 * {@code @supports (display: grid) and (not (display: inline-grid)) { ... }}
 *
 * @see <a href="https://www.w3.org/TR/css-conditional-3/#the-csssupportsrule-interface">CSSSupportsRule</a>
 */
public final class CssSupportsRule extends CssConditionRule {

    private CssCondition condition = EmptyCondition.INSTANCE;

    public CssSupportsRule(CssParser parser) {
        super(CssRuleType.SUPPORTS, parser);
    }

    public CssCondition getCondition() {
        return condition;
    }

    public void setCondition(CssCondition condition) {
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
    }

    /**
     * Determines whether the condition of this rule is satisfied.
     */
    public boolean isSupported() {
        return condition.check();
    }

    @Override
    public String getConditionText() {
        return condition.toCss();
    }

    @Override
    public void setConditionText(String text) {
        CssCondition parsed = text != null ? getParser().parseCondition(text) : null;

        if (parsed == null) {
            throw new CssSyntaxException("Invalid condition: " + text);
        }

        condition = parsed;
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        condition = ((CssSupportsRule)rule).condition;
    }

    @Override
    public String toCss() {
        String text = condition.toCss();
        return CssFormat.block(text.isEmpty() ? "@supports" : "@supports " + text, rulesToCss());
    }
}
