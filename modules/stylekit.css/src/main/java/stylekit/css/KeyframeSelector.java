package stylekit.css;

import java.util.List;
import java.util.StringJoiner;

/**
 * The comma-separated keys of a keyframe rule, as percentages between 0 and 100.
 * {@code from} is stored as 0 and {@code to} as 100.
 */
public final class KeyframeSelector implements CssFormattable {

    private final List<Double> keys;

    public KeyframeSelector(List<Double> keys) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("keys cannot be empty");
        }

        for (Double key : keys) {
            if (key < 0 || key > 100) {
                throw new IllegalArgumentException("key out of range: " + key);
            }
        }

        this.keys = List.copyOf(keys);
    }

    public List<Double> getKeys() {
        return keys;
    }

    @Override
    public String toCss() {
        var joiner = new StringJoiner(", ");

        for (double key : keys) {
            joiner.add(key == Math.rint(key) ? (long)key + "%" : key + "%");
        }

        return joiner.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof KeyframeSelector other && keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return toCss();
    }
}
