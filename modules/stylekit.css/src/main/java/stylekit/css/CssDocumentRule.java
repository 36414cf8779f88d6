package stylekit.css;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code @document url-prefix("https://example.com/") { ... }}
 */
public final class CssDocumentRule extends CssConditionRule {

    private final List<DocumentFunction> functions = new ArrayList<>();

    public CssDocumentRule(CssParser parser) {
        super(CssRuleType.DOCUMENT, parser);
    }

    public List<DocumentFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public void addFunction(DocumentFunction function) {
        functions.add(function);
    }

    /**
     * Determines whether any of the functions matches the document with the given URL.
     */
    public boolean matches(String url) {
        for (DocumentFunction function : functions) {
            if (function.matches(url)) {
                return true;
            }
        }

        return false;
    }

    @Override
    public String getConditionText() {
        return CssFormat.join(functions, ", ");
    }

    @Override
    public void setConditionText(String text) {
        List<DocumentFunction> parsed = text != null ? getParser().parseDocumentFunctions(text) : null;

        if (parsed == null || parsed.isEmpty()) {
            throw new CssSyntaxException("Invalid document functions: " + text);
        }

        functions.clear();
        functions.addAll(parsed);
    }

    @Override
    void replaceWith(CssRule rule) {
        super.replaceWith(rule);
        functions.clear();
        functions.addAll(((CssDocumentRule)rule).functions);
    }

    @Override
    public String toCss() {
        return CssFormat.block("@document " + getConditionText(), rulesToCss());
    }
}
