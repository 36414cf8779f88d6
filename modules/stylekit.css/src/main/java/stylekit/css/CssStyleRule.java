package stylekit.css;

/**
 * A qualified rule with a selector and declarations, such as {@code a:hover { color: red }}.
 */
public final class CssStyleRule extends CssDeclarationRule {

    private CssSelector selector;

    public CssStyleRule(CssParser parser) {
        super(CssRuleType.STYLE, parser);
    }

    public CssSelector getSelector() {
        return selector;
    }

    public void setSelector(CssSelector selector) {
        this.selector = selector;
    }

    public String getSelectorText() {
        return selector != null ? selector.toCss() : "";
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        selector = ((CssStyleRule)rule).selector;
    }

    @Override
    public String toCss() {
        return CssFormat.block(getSelectorText(), getStyle().toCss());
    }
}
