package stylekit.css;

public enum CssRuleType {
    STYLE,
    CHARSET,
    IMPORT,
    NAMESPACE,
    MEDIA,
    SUPPORTS,
    DOCUMENT,
    FONT_FACE,
    PAGE,
    KEYFRAMES,
    KEYFRAME,
    VIEWPORT,
    UNKNOWN
}
