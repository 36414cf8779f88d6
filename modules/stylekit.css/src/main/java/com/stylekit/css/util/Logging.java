package com.stylekit.css.util;

import java.lang.System.Logger;

/**
 * Provides the loggers of the library.
 */
public final class Logging {

    private static final String CSS_LOGGER_NAME = "stylekit.css";

    private Logging() {}

    /**
     * Returns the logger for CSS parsing diagnostics.
     */
    public static Logger getCSSLogger() {
        return System.getLogger(CSS_LOGGER_NAME);
    }
}
