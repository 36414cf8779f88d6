package stylekit.css;

/**
 * Options that control how tolerant a {@link CssParser} is.
 *
 * @param storeTrivia keep a concrete syntax tree with every token, including whitespace and comments
 * @param includeUnknownRules keep unknown at-rules verbatim instead of skipping them
 * @param includeUnknownDeclarations keep declarations with unknown property names as opaque declarations
 * @param tolerateInvalidValues keep values and selectors that are not valid
 * @param tolerateInvalidConstraints keep media features that are not known
 */
public record CssParserOptions(boolean storeTrivia,
                               boolean includeUnknownRules,
                               boolean includeUnknownDeclarations,
                               boolean tolerateInvalidValues,
                               boolean tolerateInvalidConstraints) {

    public static final CssParserOptions DEFAULT = new CssParserOptions(false, false, false, false, false);

    private static final String PROPERTY_PREFIX = "stylekit.css.";

    /**
     * Reads the options from the {@code stylekit.css.storeTrivia}, {@code stylekit.css.includeUnknownRules},
     * {@code stylekit.css.includeUnknownDeclarations}, {@code stylekit.css.tolerateInvalidValues} and
     * {@code stylekit.css.tolerateInvalidConstraints} system properties.
     */
    public static CssParserOptions fromSystemProperties() {
        return new CssParserOptions(
            Boolean.getBoolean(PROPERTY_PREFIX + "storeTrivia"),
            Boolean.getBoolean(PROPERTY_PREFIX + "includeUnknownRules"),
            Boolean.getBoolean(PROPERTY_PREFIX + "includeUnknownDeclarations"),
            Boolean.getBoolean(PROPERTY_PREFIX + "tolerateInvalidValues"),
            Boolean.getBoolean(PROPERTY_PREFIX + "tolerateInvalidConstraints"));
    }

    public CssParserOptions withStoreTrivia(boolean value) {
        return new CssParserOptions(value, includeUnknownRules, includeUnknownDeclarations,
                                    tolerateInvalidValues, tolerateInvalidConstraints);
    }

    public CssParserOptions withIncludeUnknownRules(boolean value) {
        return new CssParserOptions(storeTrivia, value, includeUnknownDeclarations,
                                    tolerateInvalidValues, tolerateInvalidConstraints);
    }

    public CssParserOptions withIncludeUnknownDeclarations(boolean value) {
        return new CssParserOptions(storeTrivia, includeUnknownRules, value,
                                    tolerateInvalidValues, tolerateInvalidConstraints);
    }

    public CssParserOptions withTolerateInvalidValues(boolean value) {
        return new CssParserOptions(storeTrivia, includeUnknownRules, includeUnknownDeclarations,
                                    value, tolerateInvalidConstraints);
    }

    public CssParserOptions withTolerateInvalidConstraints(boolean value) {
        return new CssParserOptions(storeTrivia, includeUnknownRules, includeUnknownDeclarations,
                                    tolerateInvalidValues, value);
    }
}
