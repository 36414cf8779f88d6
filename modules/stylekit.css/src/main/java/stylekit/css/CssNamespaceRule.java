package stylekit.css;

/**
 * {@code @namespace svg url("http://www.w3.org/2000/svg");}
 */
public final class CssNamespaceRule extends CssRule {

    private String prefix = "";
    private String namespaceUri = "";

    public CssNamespaceRule(CssParser parser) {
        super(CssRuleType.NAMESPACE, parser);
    }

    /**
     * Returns the prefix, or an empty string for the default namespace.
     */
    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public void setNamespaceUri(String namespaceUri) {
        this.namespaceUri = namespaceUri;
    }

    @Override
    void replaceWith(CssRule rule) {
        var other = (CssNamespaceRule)rule;
        prefix = other.prefix;
        namespaceUri = other.namespaceUri;
    }

    @Override
    public String toCss() {
        return prefix.isEmpty()
            ? "@namespace " + CssFormat.url(namespaceUri) + ";"
            : "@namespace " + CssFormat.escapeIdentifier(prefix) + " " + CssFormat.url(namespaceUri) + ";";
    }
}
