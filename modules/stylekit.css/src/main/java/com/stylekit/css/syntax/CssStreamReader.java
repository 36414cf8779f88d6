package com.stylekit.css.syntax;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import static com.stylekit.css.syntax.CssDefinitions.*;

/**
 * Code point reader with pushback, line/column tracking and a capture buffer that holds the
 * source text consumed since the last call to {@link #beginCapture()}.
 */
public final class CssStreamReader extends PushbackReader {

    public static final int MAX_PUSHBACK_SIZE = 4;

    private final List<Integer> lineLengths = new ArrayList<>();
    private final StringBuilder capture = new StringBuilder();
    private int currentCodePoint = -1;
    private int currentColumn = -1;
    private int currentLine;

    public CssStreamReader(Reader in) {
        super(new CssFilterReader(in), MAX_PUSHBACK_SIZE);
    }

    public int currentColumn() {
        return currentColumn;
    }

    public int currentLine() {
        return currentLine;
    }

    public int currentCodePoint() {
        return currentCodePoint;
    }

    public void beginCapture() {
        capture.setLength(0);
    }

    public String captured() {
        return capture.toString();
    }

    public void skip() throws IOException {
        read();
    }

    @Override
    public int read() throws IOException {
        if (currentCodePoint == LINE_FEED) {
            lineLengths.add(currentColumn);
            currentLine++;
            currentColumn = -1;
        }

        currentCodePoint = super.read();

        if (currentCodePoint >= 0) {
            currentColumn++;
            capture.append((char)currentCodePoint);
        }

        return currentCodePoint;
    }

    public boolean consume(int... codePoints) throws IOException {
        int line = currentLine, column = currentColumn, codePoint = currentCodePoint;
        int[] stack = new int[codePoints.length];

        for (int index = 0; index < codePoints.length; index++) {
            stack[index] = read();

            if (stack[index] != codePoints[index]) {
                for (int i = index; i >= 0; --i) {
                    if (stack[i] >= 0) {
                        unread(stack[i]);
                    }
                }

                currentLine = line;
                currentColumn = column;
                currentCodePoint = codePoint;
                return false;
            }
        }

        return true;
    }

    @Override
    public void unread(int c) throws IOException {
        if (currentColumn == 0 && currentLine > 0) {
            currentLine--;
            currentColumn = lineLengths.isEmpty() ? -1 : lineLengths.remove(lineLengths.size() - 1);
            currentCodePoint = LINE_FEED;
        } else {
            currentColumn--;
            currentCodePoint = currentColumn < 0 ? -1 : 0;
        }

        if (capture.length() > 0) {
            capture.setLength(capture.length() - 1);
        }

        super.unread(c);
    }

    public int peek() throws IOException {
        int line = currentLine, column = currentColumn, codePoint = currentCodePoint;
        int value = read();
        if (value >= 0) {
            unread(value);
        }

        currentLine = line;
        currentColumn = column;
        currentCodePoint = codePoint;
        return value;
    }

    public boolean peek(PatternType patternType) throws IOException {
        CssDefinitions.Pattern pattern = patternType.getPattern();

        if (pattern instanceof MonoPattern mono) {
            int value = super.read();

            try {
                return mono.test(value);
            } finally {
                if (value >= 0) super.unread(value);
            }
        }

        if (pattern instanceof BiPattern bi) {
            int value1 = super.read(), value2 = super.read();

            try {
                return bi.test(value1, value2);
            } finally {
                if (value2 >= 0) super.unread(value2);
                if (value1 >= 0) super.unread(value1);
            }
        }

        var tri = (TriPattern)pattern;
        int value1 = super.read(), value2 = super.read(), value3 = super.read();

        try {
            return tri.test(value1, value2, value3);
        } finally {
            if (value3 >= 0) super.unread(value3);
            if (value2 >= 0) super.unread(value2);
            if (value1 >= 0) super.unread(value1);
        }
    }
}
