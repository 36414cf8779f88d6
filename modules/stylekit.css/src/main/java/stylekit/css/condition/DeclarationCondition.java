package stylekit.css.condition;

import stylekit.css.CssProperty;
import stylekit.css.CssUnknownProperty;
import stylekit.css.CssValue;
import java.util.Objects;

/**
 * Tests whether a declaration such as {@code (display: grid)} is supported.
 */
public record DeclarationCondition(CssProperty property, CssValue value) implements CssCondition {

    public DeclarationCondition {
        Objects.requireNonNull(property, "property cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public boolean check() {
        return !(property instanceof CssUnknownProperty) && property.trySetValue(value);
    }

    @Override
    public String toCss() {
        return "(" + property.getName() + ": " + value.toCss() + ")";
    }
}
