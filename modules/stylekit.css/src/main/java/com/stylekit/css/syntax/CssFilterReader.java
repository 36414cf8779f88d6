package com.stylekit.css.syntax;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Filters the input to normalize line endings and replace {@code U+0000 NULL} with
 * {@code U+FFFD REPLACEMENT CHARACTER}.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#input-preprocessing">Preprocessing the input stream</a>
 */
public final class CssFilterReader extends FilterReader {

    private int nextValue = -1;

    public CssFilterReader(Reader in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int value;

        if (nextValue >= 0) {
            value = nextValue;
            nextValue = -1;
        } else {
            value = super.read();
        }

        if (value == '\0') {
            return CssDefinitions.REPLACEMENT_CHARACTER;
        }

        if (value == CssDefinitions.FORM_FEED) {
            return CssDefinitions.LINE_FEED;
        }

        if (value == CssDefinitions.CARRIAGE_RETURN) {
            int secondValue = super.read();
            if (secondValue != CssDefinitions.LINE_FEED) {
                nextValue = secondValue;
            }

            return CssDefinitions.LINE_FEED;
        }

        return value;
    }

    @Override
    public int read(char[] buffer, int offset, int length) throws IOException {
        int count = 0;

        while (count < length) {
            int value = read();
            if (value < 0) {
                return count == 0 ? -1 : count;
            }

            buffer[offset + count++] = (char)value;
        }

        return count;
    }
}
