package stylekit.css;

import com.stylekit.css.syntax.CssNode;
import com.stylekit.css.syntax.CssParserError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed stylesheet with its top-level rules and the errors that were found while parsing it.
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#the-cssstylesheet-interface">CSSStyleSheet</a>
 */
public final class CssStyleSheet implements CssFormattable {

    private final CssParser parser;
    private final List<CssRule> rules = new ArrayList<>();
    private final List<CssParserError> errors = new ArrayList<>();
    private CssNode source;

    public CssStyleSheet(CssParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public CssParser getParser() {
        return parser;
    }

    public List<CssRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void addRule(CssRule rule) {
        rules.add(rule);
        rule.setParent(null, this);
    }

    /**
     * Parses a rule and inserts it at the given index.
     *
     * @return the index
     * @throws CssSyntaxException if the text is not a rule
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public int insertRule(String text, int index) {
        if (index < 0 || index > rules.size()) {
            throw new IndexOutOfBoundsException(index);
        }

        CssRule rule = parser.parseRule(text);

        if (rule == null) {
            throw new CssSyntaxException("Invalid rule: " + text);
        }

        rules.add(index, rule);
        rule.setParent(null, this);
        return index;
    }

    public void deleteRule(int index) {
        rules.remove(index).setParent(null, null);
    }

    /**
     * Returns the errors that were reported while parsing this stylesheet.
     */
    public List<CssParserError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void addErrors(List<CssParserError> errors) {
        this.errors.addAll(errors);
    }

    /**
     * Returns the root of the concrete syntax tree, or {@code null} if trivia were not stored.
     */
    public CssNode getSource() {
        return source;
    }

    void setSource(CssNode source) {
        this.source = source;
    }

    @Override
    public String toCss() {
        return CssFormat.join(rules, "\n");
    }

    @Override
    public String toString() {
        return toCss();
    }
}
