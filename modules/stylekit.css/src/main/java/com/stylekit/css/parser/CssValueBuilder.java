package com.stylekit.css.parser;

import com.stylekit.css.syntax.CssDefinitions;
import stylekit.css.CssValue;
import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the tokens of a value and tracks the nesting of brackets, so that the builder knows
 * when a {@code ;} or closing bracket ends the value instead of being part of it.
 * <p>
 * A value is invalid if it is empty, if it contains a bad string, bad URL or at-keyword, if a
 * closing bracket does not match an opening bracket, if a bracket is left open, or if a {@code !}
 * appears anywhere but in a trailing {@code !important}.
 */
public final class CssValueBuilder {

    private final List<CssToken> tokens = new ArrayList<>();
    private final List<CssTokenType> openBrackets = new ArrayList<>();
    private boolean malformed;

    private boolean finished;
    private boolean valid;
    private boolean important;
    private CssValue value;

    public CssValueBuilder() {}

    public void apply(CssToken token) {
        finished = false;
        tokens.add(token);

        switch (token.type()) {
            case FUNCTION, ROUND_BRACKET_OPEN -> openBrackets.add(CssTokenType.ROUND_BRACKET_CLOSE);
            case SQUARE_BRACKET_OPEN -> openBrackets.add(CssTokenType.SQUARE_BRACKET_CLOSE);
            case CURLY_BRACKET_OPEN -> openBrackets.add(CssTokenType.CURLY_BRACKET_CLOSE);
            case ROUND_BRACKET_CLOSE, SQUARE_BRACKET_CLOSE, CURLY_BRACKET_CLOSE -> close(token.type());
            case BAD_STRING, BAD_URL, AT_KEYWORD, CDO, CDC -> malformed = true;
            default -> {}
        }
    }

    private void close(CssTokenType type) {
        int last = openBrackets.size() - 1;

        if (last >= 0 && openBrackets.get(last) == type) {
            openBrackets.remove(last);
        } else {
            malformed = true;
        }
    }

    /**
     * Determines whether all brackets are closed, so that a {@code ;} would end the value.
     */
    public boolean isReady() {
        return openBrackets.isEmpty();
    }

    /**
     * Determines whether the given closing bracket would end the value, which is the case if
     * no bracket of the same kind is open.
     */
    public boolean isReady(CssTokenType closing) {
        return !openBrackets.contains(closing);
    }

    public boolean isValid() {
        finish();
        return valid;
    }

    public boolean isImportant() {
        finish();
        return important;
    }

    /**
     * Returns the value without a trailing {@code !important}, or {@code null} if it is empty.
     * The value is returned even if it is not valid.
     */
    public CssValue toValue() {
        finish();
        return value;
    }

    private void finish() {
        if (finished) {
            return;
        }

        finished = true;
        important = false;

        var values = new ArrayList<>(tokens);
        removeTrailingTrivia(values);

        // If the last two significant tokens are "!" and "important", remove them and all trivia
        // in-between, and set the 'important' flag.
        int last = values.size() - 1;
        if (last >= 0 && values.get(last).isIdent("important")) {
            for (int i = last - 1; i >= 0; --i) {
                if (isExclamationMark(values.get(i))) {
                    values.subList(i, values.size()).clear();
                    important = true;
                    break;
                } else if (!values.get(i).type().isTrivia()) {
                    break;
                }
            }
        }

        var result = new CssValue(values);
        value = result.isEmpty() ? null : result;
        valid = value != null && !malformed && openBrackets.isEmpty();

        for (CssToken token : values) {
            if (isExclamationMark(token)) {
                valid = false;
            }
        }
    }

    private static void removeTrailingTrivia(List<CssToken> values) {
        while (!values.isEmpty() && values.get(values.size() - 1).type().isTrivia()) {
            values.remove(values.size() - 1);
        }
    }

    private static boolean isExclamationMark(CssToken token) {
        return token.type() == CssTokenType.DELIM
            && token.text().equals(String.valueOf(CssDefinitions.EXCLAMATION_MARK));
    }
}
