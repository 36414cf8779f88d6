package stylekit.css;

/**
 * Base class of the rules that consist of a prelude and a block of declarations.
 */
public abstract sealed class CssDeclarationRule extends CssRule
        permits CssStyleRule, CssPageRule, CssFontFaceRule, CssViewportRule, CssKeyframeRule {

    private final CssStyleDeclaration style;

    CssDeclarationRule(CssRuleType type, CssParser parser) {
        super(type, parser);
        style = new CssStyleDeclaration(parser);
    }

    public CssStyleDeclaration getStyle() {
        return style;
    }

    @Override
    void replaceWith(CssRule rule) {
        style.replaceWith(((CssDeclarationRule)rule).style);
    }
}
