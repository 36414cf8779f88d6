package stylekit.css;

/**
 * {@code @charset "utf-8";}
 */
public final class CssCharsetRule extends CssRule {

    private String charset = "";

    public CssCharsetRule(CssParser parser) {
        super(CssRuleType.CHARSET, parser);
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    @Override
    void replaceWith(CssRule rule) {
        charset = ((CssCharsetRule)rule).charset;
    }

    @Override
    public String toCss() {
        return "@charset " + CssFormat.quote(charset) + ";";
    }
}
