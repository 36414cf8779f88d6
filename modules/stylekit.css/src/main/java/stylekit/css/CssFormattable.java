package stylekit.css;

/**
 * An entity of the style object model that has a canonical textual form.
 */
public interface CssFormattable {

    /**
     * Returns the canonical CSS text of this entity.
     */
    String toCss();
}
