package stylekit.css;

/**
 * A property with a name that is not known. The value is kept as written.
 */
public final class CssUnknownProperty extends CssProperty {

    public CssUnknownProperty(String name) {
        super(name);
    }
}
