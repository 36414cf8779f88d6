package com.stylekit.css.parser;

import stylekit.css.MediaFeature;
import java.util.Set;

/**
 * Creates media features for feature names. A name that is not known yields {@code null}.
 * Range features may be prefixed with {@code min-} or {@code max-}, in which case they need a value.
 *
 * @see <a href="https://www.w3.org/TR/mediaqueries-4/#mq-features">Media features</a>
 */
public final class MediaFeatureFactory {

    private static final MediaFeatureFactory DEFAULT = new MediaFeatureFactory();

    private static final Set<String> RANGE_FEATURES = Set.of(
        "aspect-ratio", "color", "color-index", "device-aspect-ratio", "device-height", "device-width",
        "height", "monochrome", "resolution", "width");

    private static final Set<String> DISCRETE_FEATURES = Set.of(
        "any-hover", "any-pointer", "color-gamut", "display-mode", "grid", "hover", "orientation",
        "overflow-block", "overflow-inline", "pointer", "prefers-color-scheme", "prefers-contrast",
        "prefers-reduced-motion", "scan", "update");

    public static MediaFeatureFactory getDefault() {
        return DEFAULT;
    }

    public MediaFeature create(String name) {
        String lowerCaseName = name.toLowerCase();

        if (RANGE_FEATURES.contains(lowerCaseName) || DISCRETE_FEATURES.contains(lowerCaseName)) {
            return new MediaFeature(lowerCaseName, false);
        }

        if (lowerCaseName.startsWith("min-") || lowerCaseName.startsWith("max-")) {
            if (RANGE_FEATURES.contains(lowerCaseName.substring(4))) {
                return new MediaFeature(lowerCaseName, true);
            }
        }

        return null;
    }
}
