package stylekit.css;

import java.util.Objects;

/**
 * A parenthesized media feature of a medium, such as {@code (min-width: 100px)} or {@code (color)}.
 *
 * @see <a href="https://www.w3.org/TR/mediaqueries-4/#media-descriptor-table">Media features</a>
 */
public class MediaFeature implements CssFormattable {

    private final String name;
    private final boolean valueRequired;
    private CssValue value = CssValue.EMPTY;

    /**
     * @param name the feature name
     * @param valueRequired {@code true} if the feature cannot be used in a boolean context,
     *                      which is the case for range features with a {@code min-} or {@code max-} prefix
     */
    public MediaFeature(String name, boolean valueRequired) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.valueRequired = valueRequired;
    }

    public String getName() {
        return name;
    }

    public boolean isValueRequired() {
        return valueRequired;
    }

    public CssValue getValue() {
        return value;
    }

    public boolean hasValue() {
        return !value.isEmpty();
    }

    /**
     * Assigns the value if the feature accepts it. An empty value is accepted only by features
     * that can be evaluated in a boolean context.
     */
    public boolean trySetValue(CssValue value) {
        if (value == null || value.isEmpty() && valueRequired) {
            return false;
        }

        this.value = value;
        return true;
    }

    @Override
    public String toCss() {
        return hasValue() ? "(" + name + ": " + value.toCss() + ")" : "(" + name + ")";
    }

    @Override
    public String toString() {
        return toCss();
    }
}
