package stylekit.css.condition;

import java.util.Objects;

public record NotCondition(CssCondition content) implements CssCondition {

    public NotCondition {
        Objects.requireNonNull(content, "content cannot be null");
    }

    @Override
    public boolean check() {
        return !content.check();
    }

    @Override
    public String toCss() {
        return "not " + content.toCss();
    }
}
