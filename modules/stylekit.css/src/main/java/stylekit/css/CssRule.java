package stylekit.css;

import java.util.Objects;

/**
 * Base class of all rules of a stylesheet.
 * <p>
 * A rule remembers the parser that created it, which is used to parse text that is assigned to
 * the rule later on, for example with {@link #setCssText(String)}.
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#the-cssrule-interface">CSSRule</a>
 */
public abstract sealed class CssRule implements CssFormattable
        permits CssCharsetRule, CssImportRule, CssNamespaceRule, CssDeclarationRule, CssGroupingRule,
                CssKeyframesRule, CssUnknownRule {

    private final CssRuleType type;
    private final CssParser parser;
    private CssRule parentRule;
    private CssStyleSheet parentStyleSheet;

    CssRule(CssRuleType type, CssParser parser) {
        this.type = type;
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public final CssRuleType getType() {
        return type;
    }

    public final CssParser getParser() {
        return parser;
    }

    /**
     * Returns the rule that contains this rule, or {@code null} for a top-level rule.
     */
    public CssRule getParentRule() {
        return parentRule;
    }

    public CssStyleSheet getParentStyleSheet() {
        return parentStyleSheet;
    }

    void setParent(CssRule parentRule, CssStyleSheet parentStyleSheet) {
        this.parentRule = parentRule;
        this.parentStyleSheet = parentStyleSheet;
    }

    public String getCssText() {
        return toCss();
    }

    /**
     * Replaces the contents of this rule with the rule parsed from the text.
     *
     * @throws CssSyntaxException if the text is not a rule
     * @throws IllegalArgumentException if the text is a rule of another type
     */
    public void setCssText(String text) {
        CssRule rule = parser.parseRule(text);

        if (rule == null) {
            throw new CssSyntaxException("Invalid rule: " + text);
        }

        if (rule.type != type) {
            throw new IllegalArgumentException("Expected a " + type + " rule, but got " + rule.type);
        }

        replaceWith(rule);
    }

    /**
     * Copies the contents of a rule of the same type into this rule.
     */
    abstract void replaceWith(CssRule rule);

    @Override
    public String toString() {
        return toCss();
    }
}
