package com.stylekit.css.parser;

import stylekit.css.CssProperty;
import java.util.Set;

/**
 * Creates properties for declaration names. A name that is not known yields {@code null}.
 * <p>
 * Three sets of names are known: the properties of style, page and keyframe rules, the descriptors
 * of {@code @font-face} rules and the descriptors of {@code @viewport} rules. Custom properties
 * (names starting with {@code --}) are known in every set.
 */
public final class CssPropertyFactory {

    private static final CssPropertyFactory DEFAULT = new CssPropertyFactory();

    private static final Set<String> PROPERTIES = Set.of(
        "align-content", "align-items", "align-self", "all", "animation", "animation-delay",
        "animation-direction", "animation-duration", "animation-fill-mode", "animation-iteration-count",
        "animation-name", "animation-play-state", "animation-timing-function", "backface-visibility",
        "background", "background-attachment", "background-clip", "background-color", "background-image",
        "background-origin", "background-position", "background-repeat", "background-size",
        "border", "border-bottom", "border-bottom-color", "border-bottom-left-radius",
        "border-bottom-right-radius", "border-bottom-style", "border-bottom-width", "border-collapse",
        "border-color", "border-image", "border-left", "border-left-color", "border-left-style",
        "border-left-width", "border-radius", "border-right", "border-right-color", "border-right-style",
        "border-right-width", "border-spacing", "border-style", "border-top", "border-top-color",
        "border-top-left-radius", "border-top-right-radius", "border-top-style", "border-top-width",
        "border-width", "bottom", "box-shadow", "box-sizing", "caption-side", "clear", "clip", "color",
        "column-count", "column-gap", "column-rule", "column-width", "columns", "content",
        "counter-increment", "counter-reset", "cursor", "direction", "display", "empty-cells", "filter",
        "flex", "flex-basis", "flex-direction", "flex-flow", "flex-grow", "flex-shrink", "flex-wrap",
        "float", "font", "font-family", "font-feature-settings", "font-size", "font-size-adjust",
        "font-stretch", "font-style", "font-variant", "font-weight", "gap", "grid", "grid-area",
        "grid-column", "grid-row", "grid-template", "grid-template-areas", "grid-template-columns",
        "grid-template-rows", "height", "justify-content", "left", "letter-spacing", "line-height",
        "list-style", "list-style-image", "list-style-position", "list-style-type", "margin",
        "margin-bottom", "margin-left", "margin-right", "margin-top", "marks", "max-height", "max-width",
        "min-height", "min-width", "object-fit", "opacity", "order", "orphans", "outline", "outline-color",
        "outline-offset", "outline-style", "outline-width", "overflow", "overflow-x", "overflow-y",
        "padding", "padding-bottom", "padding-left", "padding-right", "padding-top", "page-break-after",
        "page-break-before", "page-break-inside", "perspective", "perspective-origin", "pointer-events",
        "position", "quotes", "resize", "right", "row-gap", "size", "table-layout", "text-align",
        "text-decoration", "text-indent", "text-overflow", "text-shadow", "text-transform", "top",
        "transform", "transform-origin", "transform-style", "transition", "transition-delay",
        "transition-duration", "transition-property", "transition-timing-function", "unicode-bidi",
        "user-select", "vertical-align", "visibility", "white-space", "widows", "width", "word-break",
        "word-spacing", "word-wrap", "z-index");

    private static final Set<String> FONT_DESCRIPTORS = Set.of(
        "font-display", "font-family", "font-feature-settings", "font-stretch", "font-style",
        "font-variant", "font-weight", "src", "unicode-range");

    private static final Set<String> VIEWPORT_DESCRIPTORS = Set.of(
        "height", "max-height", "max-width", "max-zoom", "min-height", "min-width", "min-zoom",
        "orientation", "user-zoom", "width", "zoom");

    public static CssPropertyFactory getDefault() {
        return DEFAULT;
    }

    /**
     * Creates a property of a style, page or keyframe rule.
     */
    public CssProperty create(String name) {
        return create(name, PROPERTIES);
    }

    /**
     * Creates a descriptor of a {@code @font-face} rule.
     */
    public CssProperty createFont(String name) {
        return create(name, FONT_DESCRIPTORS);
    }

    /**
     * Creates a descriptor of a {@code @viewport} rule.
     */
    public CssProperty createViewport(String name) {
        return create(name, VIEWPORT_DESCRIPTORS);
    }

    private static CssProperty create(String name, Set<String> names) {
        if (name.startsWith("--") && name.length() > 2) {
            return new CssProperty(name);
        }

        String lowerCaseName = name.toLowerCase();
        return names.contains(lowerCaseName) ? new CssProperty(lowerCaseName) : null;
    }
}
