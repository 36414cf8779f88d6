package stylekit.css;

import java.util.List;
import java.util.Objects;

/**
 * A single media query of a media list: an optional {@code not} or {@code only} prefix,
 * an optional media type and the media features that are joined with {@code and}.
 *
 * @see <a href="https://www.w3.org/TR/mediaqueries-4/#mq-syntax">Media query syntax</a>
 */
public final class CssMedium implements CssFormattable {

    /**
     * The medium that a malformed media query is replaced with. It matches nothing.
     */
    public static final CssMedium NOT_ALL = new CssMedium("all", true, false, List.of());

    private final String type;
    private final boolean inverse;
    private final boolean exclusive;
    private final List<MediaFeature> features;

    public CssMedium(String type, boolean inverse, boolean exclusive, List<MediaFeature> features) {
        if (inverse && exclusive) {
            throw new IllegalArgumentException("A medium cannot be both inverse and exclusive");
        }

        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.inverse = inverse;
        this.exclusive = exclusive;
        this.features = List.copyOf(features);
    }

    /**
     * Returns the media type, or an empty string if the medium only consists of features.
     */
    public String getType() {
        return type;
    }

    /** Prefixed with {@code not}. */
    public boolean isInverse() {
        return inverse;
    }

    /** Prefixed with {@code only}. */
    public boolean isExclusive() {
        return exclusive;
    }

    public List<MediaFeature> getFeatures() {
        return features;
    }

    @Override
    public String toCss() {
        var builder = new StringBuilder();

        if (inverse) {
            builder.append("not ");
        } else if (exclusive) {
            builder.append("only ");
        }

        builder.append(CssFormat.escapeIdentifier(type));
        boolean first = type.isEmpty();

        for (MediaFeature feature : features) {
            if (!first) {
                builder.append(" and ");
            }

            first = false;

            builder.append(feature.toCss());
        }

        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof CssMedium other && toCss().equals(other.toCss());
    }

    @Override
    public int hashCode() {
        return toCss().hashCode();
    }

    @Override
    public String toString() {
        return toCss();
    }
}
