package stylekit.css;

/**
 * {@code @import url("theme.css") screen;}
 */
public final class CssImportRule extends CssRule {

    private final MediaList media;
    private String href = "";

    public CssImportRule(CssParser parser) {
        super(CssRuleType.IMPORT, parser);
        media = new MediaList(parser);
    }

    public String getHref() {
        return href;
    }

    public void setHref(String href) {
        this.href = href;
    }

    public MediaList getMedia() {
        return media;
    }

    @Override
    void replaceWith(CssRule rule) {
        var other = (CssImportRule)rule;
        href = other.href;
        media.clear();
        other.media.forEach(media::add);
    }

    @Override
    public String toCss() {
        String prelude = "@import " + CssFormat.url(href);
        return media.isEmpty() ? prelude + ";" : prelude + " " + media.toCss() + ";";
    }
}
