package stylekit.css;

/**
 * {@code @media screen and (min-width: 900px) { ... }}
 */
public final class CssMediaRule extends CssConditionRule {

    private final MediaList media;

    public CssMediaRule(CssParser parser) {
        super(CssRuleType.MEDIA, parser);
        media = new MediaList(parser);
    }

    public MediaList getMedia() {
        return media;
    }

    @Override
    public String getConditionText() {
        return media.getMediaText();
    }

    @Override
    public void setConditionText(String text) {
        media.setMediaText(text);
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        media.clear();
        ((CssMediaRule)rule).media.forEach(media::add);
    }

    @Override
    public String toCss() {
        String prelude = media.isEmpty() ? "@media" : "@media " + media.toCss();
        return CssFormat.block(prelude, rulesToCss());
    }
}
