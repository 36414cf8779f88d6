package stylekit.css;

import java.util.Objects;

/**
 * A declared property with its value and priority.
 */
public class CssProperty implements CssFormattable {

    private final String name;
    private CssValue value;
    private boolean important;

    public CssProperty(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the value, or {@code null} if no value has been accepted yet.
     */
    public CssValue getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isImportant() {
        return important;
    }

    public void setImportant(boolean important) {
        this.important = important;
    }

    /**
     * Assigns the value if this property accepts it.
     *
     * @return {@code true} if the value was accepted
     */
    public boolean trySetValue(CssValue value) {
        if (value == null || value.isEmpty()) {
            return false;
        }

        this.value = value;
        return true;
    }

    @Override
    public String toCss() {
        String text = name + ": " + (value != null ? value.toCss() : "");
        return important ? text + " !important" : text;
    }

    @Override
    public String toString() {
        return toCss();
    }
}
