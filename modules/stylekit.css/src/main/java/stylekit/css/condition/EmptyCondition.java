package stylekit.css.condition;

/**
 * The condition of an {@code @supports} rule without a condition. It is always satisfied.
 */
public final class EmptyCondition implements CssCondition {

    public static final EmptyCondition INSTANCE = new EmptyCondition();

    private EmptyCondition() {}

    @Override
    public boolean check() {
        return true;
    }

    @Override
    public String toCss() {
        return "";
    }

    @Override
    public String toString() {
        return "EmptyCondition";
    }
}
