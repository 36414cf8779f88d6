package stylekit.css;

/**
 * A single keyframe of a {@link CssKeyframesRule}, such as {@code 0%, 50% { opacity: 0 }}.
 */
public final class CssKeyframeRule extends CssDeclarationRule {

    private KeyframeSelector key;

    public CssKeyframeRule(CssParser parser) {
        super(CssRuleType.KEYFRAME, parser);
    }

    public KeyframeSelector getKey() {
        return key;
    }

    public void setKey(KeyframeSelector key) {
        this.key = key;
    }

    public String getKeyText() {
        return key != null ? key.toCss() : "";
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        key = ((CssKeyframeRule)rule).key;
    }

    @Override
    public String toCss() {
        return CssFormat.block(getKeyText(), getStyle().toCss());
    }
}
