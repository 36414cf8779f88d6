package stylekit.css;

public final class CssFontFaceRule extends CssDeclarationRule {

    public CssFontFaceRule(CssParser parser) {
        super(CssRuleType.FONT_FACE, parser);
    }

    @Override
    public String toCss() {
        return CssFormat.block("@font-face", getStyle().toCss());
    }
}
