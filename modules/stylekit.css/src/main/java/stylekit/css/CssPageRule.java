package stylekit.css;

/**
 * {@code @page :first { margin: 1in }}
 */
public final class CssPageRule extends CssDeclarationRule {

    private CssSelector selector;

    public CssPageRule(CssParser parser) {
        super(CssRuleType.PAGE, parser);
    }

    /**
     * Returns the page selector, or {@code null} if the rule applies to all pages.
     */
    public CssSelector getSelector() {
        return selector;
    }

    public void setSelector(CssSelector selector) {
        this.selector = selector;
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        selector = ((CssPageRule)rule).selector;
    }

    @Override
    public String toCss() {
        String prelude = selector != null && !selector.text().isEmpty() ? "@page " + selector.toCss() : "@page";
        return CssFormat.block(prelude, getStyle().toCss());
    }
}
