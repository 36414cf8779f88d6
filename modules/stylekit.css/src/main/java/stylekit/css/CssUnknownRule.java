package stylekit.css;

/**
 * An at-rule that is not known, kept with its prelude and block exactly as they were written.
 */
public final class CssUnknownRule extends CssRule {

    private String name;
    private String prelude;
    private String content;

    /**
     * @param name the at-keyword without {@code @}
     * @param prelude the source text between the at-keyword and the block
     * @param content the source text of the block including its braces, or of the terminating semicolon
     */
    public CssUnknownRule(CssParser parser, String name, String prelude, String content) {
        super(CssRuleType.UNKNOWN, parser);
        this.name = name;
        this.prelude = prelude;
        this.content = content;
    }

    public String getName() {
        return name;
    }

    public String getPrelude() {
        return prelude;
    }

    public String getContent() {
        return content;
    }

    @Override
    void replaceWith(CssRule rule) {
        var other = (CssUnknownRule)rule;
        name = other.name;
        prelude = other.prelude;
        content = other.content;
    }

    @Override
    public String toCss() {
        return "@" + CssFormat.escapeIdentifier(name) + prelude + content;
    }
}
