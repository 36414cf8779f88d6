package stylekit.css;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code @keyframes fade { from { opacity: 0 } to { opacity: 1 } }}
 *
 * @see <a href="https://www.w3.org/TR/css-animations-1/#interface-csskeyframesrule">CSSKeyframesRule</a>
 */
public final class CssKeyframesRule extends CssRule {

    private final List<CssKeyframeRule> rules = new ArrayList<>();
    private String name = "";

    public CssKeyframesRule(CssParser parser) {
        super(CssRuleType.KEYFRAMES, parser);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<CssKeyframeRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void addRule(CssKeyframeRule rule) {
        rules.add(rule);
        rule.setParent(this, getParentStyleSheet());
    }

    /**
     * Parses a keyframe rule and appends it.
     *
     * @throws CssSyntaxException if the text is not a keyframe rule
     */
    public void appendRule(String text) {
        CssKeyframeRule rule = getParser().parseKeyframeRule(text);

        if (rule == null) {
            throw new CssSyntaxException("Invalid keyframe rule: " + text);
        }

        addRule(rule);
    }

    /**
     * Removes the last keyframe rule with the given key, if there is one.
     */
    public void deleteRule(String key) {
        int index = indexOf(key);

        if (index >= 0) {
            rules.remove(index);
        }
    }

    /**
     * Returns the last keyframe rule with the given key, or {@code null}.
     */
    public CssKeyframeRule findRule(String key) {
        int index = indexOf(key);
        return index >= 0 ? rules.get(index) : null;
    }

    private int indexOf(String key) {
        KeyframeSelector selector = getParser().parseKeyframeSelector(key);

        if (selector == null) {
            return -1;
        }

        for (int i = rules.size() - 1; i >= 0; --i) {
            if (selector.equals(rules.get(i).getKey())) {
                return i;
            }
        }

        return -1;
    }

    @Override
    void setParent(CssRule parentRule, CssStyleSheet parentStyleSheet) {
        super.setParent(parentRule, parentStyleSheet);

        for (CssKeyframeRule rule : rules) {
            rule.setParent(this, parentStyleSheet);
        }
    }

    @Override
    void replaceWith(CssRule rule) {
        var other = (CssKeyframesRule)rule;
        name = other.name;
        rules.clear();
        other.rules.forEach(this::addRule);
    }

    @Override
    public String toCss() {
        String prelude = "@keyframes " + (CssFormat.isIdentifier(name) ? name : CssFormat.quote(name));
        return CssFormat.block(prelude, CssFormat.join(rules, " "));
    }
}
