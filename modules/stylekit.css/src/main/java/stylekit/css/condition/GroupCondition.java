package stylekit.css.condition;

import java.util.Objects;

/**
 * A parenthesized condition.
 */
public record GroupCondition(CssCondition content) implements CssCondition {

    public GroupCondition {
        Objects.requireNonNull(content, "content cannot be null");
    }

    @Override
    public boolean check() {
        return content.check();
    }

    @Override
    public String toCss() {
        return "(" + content.toCss() + ")";
    }
}
