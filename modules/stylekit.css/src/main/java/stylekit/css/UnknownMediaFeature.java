package stylekit.css;

/**
 * A media feature with a name that is not known. Any value is accepted.
 */
public final class UnknownMediaFeature extends MediaFeature {

    public UnknownMediaFeature(String name) {
        super(name, false);
    }
}
