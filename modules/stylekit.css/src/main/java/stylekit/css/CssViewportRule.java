package stylekit.css;

public final class CssViewportRule extends CssDeclarationRule {

    public CssViewportRule(CssParser parser) {
        super(CssRuleType.VIEWPORT, parser);
    }

    @Override
    public String toCss() {
        return CssFormat.block("@viewport", getStyle().toCss());
    }
}
