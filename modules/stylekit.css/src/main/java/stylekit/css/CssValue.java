package stylekit.css;

import stylekit.css.syntax.CssToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The value of a declaration, media feature or supports condition as a sequence of tokens.
 * <p>
 * Whitespace and comments between tokens are collapsed into a single space in the textual form,
 * leading and trailing trivia are dropped.
 */
public final class CssValue implements CssFormattable {

    public static final CssValue EMPTY = new CssValue(List.of());

    private final List<CssToken> tokens;
    private final String text;

    public CssValue(List<CssToken> tokens) {
        var significant = new ArrayList<CssToken>(tokens.size());
        var builder = new StringBuilder();
        boolean separate = false;

        for (CssToken token : tokens) {
            if (token.type().isTrivia()) {
                separate = builder.length() > 0;
                continue;
            }

            if (separate) {
                builder.append(' ');
                separate = false;
            }

            builder.append(token.text());
            significant.add(token);
        }

        this.tokens = Collections.unmodifiableList(significant);
        this.text = builder.toString();
    }

    /**
     * Returns the tokens of this value, without whitespace and comments.
     */
    public List<CssToken> getTokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toCss() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof CssValue other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
