package stylekit.css;

/**
 * Base class of the grouping rules whose nested rules only apply if a condition holds.
 */
public abstract sealed class CssConditionRule extends CssGroupingRule
        permits CssMediaRule, CssSupportsRule, CssDocumentRule {

    CssConditionRule(CssRuleType type, CssParser parser) {
        super(type, parser);
    }

    public abstract String getConditionText();

    /**
     * @throws CssSyntaxException if the text is not a valid condition for this rule
     */
    public abstract void setConditionText(String text);
}
