package stylekit.css;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the rules that contain a list of nested rules.
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#the-cssgroupingrule-interface">CSSGroupingRule</a>
 */
public abstract sealed class CssGroupingRule extends CssRule permits CssConditionRule {

    private final List<CssRule> rules = new ArrayList<>();

    CssGroupingRule(CssRuleType type, CssParser parser) {
        super(type, parser);
    }

    public List<CssRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void addRule(CssRule rule) {
        rules.add(rule);
        rule.setParent(this, getParentStyleSheet());
    }

    /**
     * Parses a rule and inserts it at the given index.
     *
     * @return the index
     * @throws CssSyntaxException if the text is not a rule
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public int insertRule(String text, int index) {
        if (index < 0 || index > rules.size()) {
            throw new IndexOutOfBoundsException(index);
        }

        CssRule rule = getParser().parseRule(text);

        if (rule == null) {
            throw new CssSyntaxException("Invalid rule: " + text);
        }

        rules.add(index, rule);
        rule.setParent(this, getParentStyleSheet());
        return index;
    }

    public void deleteRule(int index) {
        rules.remove(index).setParent(null, null);
    }

    @Override
    void setParent(CssRule parentRule, CssStyleSheet parentStyleSheet) {
        super.setParent(parentRule, parentStyleSheet);

        for (CssRule rule : rules) {
            rule.setParent(this, parentStyleSheet);
        }
    }

    @Override
    void replaceWith(CssRule rule) {
        var other = (CssGroupingRule)rule;
        rules.clear();
        other.rules.forEach(this::addRule);
    }

    String rulesToCss() {
        return CssFormat.join(rules, " ");
    }
}
