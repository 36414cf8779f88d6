package com.stylekit.css.parser;

import stylekit.css.CssSelector;
import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a selector list from the prelude tokens of a style or page rule and checks that its
 * structure is well-formed.
 * <p>
 * Only the shape of the selector is checked: compound selectors must not be empty, combinators
 * and commas must be placed between compound selectors, class and pseudo-class markers must be
 * followed by a name, and attribute selectors and functional pseudo-classes must be balanced.
 * The arguments of functional pseudo-classes and attribute selectors are not interpreted.
 *
 * @see <a href="https://www.w3.org/TR/selectors-4/#grammar">Selectors grammar</a>
 */
public final class CssSelectorConstructor {

    private enum Expect {
        ANY,
        CLASS_NAME,     // after '.'
        PSEUDO_NAME,    // after ':'
        ELEMENT_NAME    // after '::'
    }

    private final List<CssTokenType> openBrackets = new ArrayList<>();
    private final List<String> selectors = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder current = new StringBuilder();
    private Expect expect = Expect.ANY;
    private boolean needCompound = true;
    private boolean pendingSpace;
    private boolean valid = true;

    public void apply(CssToken token) {
        CssTokenType type = token.type();

        if (type.isTrivia()) {
            pendingSpace = text.length() > 0;

            if (openBrackets.isEmpty() && expect != Expect.ANY) {
                valid = false;
            }

            return;
        }

        if (!openBrackets.isEmpty()) {
            applyNested(token);
        } else {
            applyTopLevel(token);
        }

        append(token);
    }

    private void applyNested(CssToken token) {
        switch (token.type()) {
            case FUNCTION, ROUND_BRACKET_OPEN -> openBrackets.add(CssTokenType.ROUND_BRACKET_CLOSE);
            case SQUARE_BRACKET_OPEN -> openBrackets.add(CssTokenType.SQUARE_BRACKET_CLOSE);
            case ROUND_BRACKET_CLOSE, SQUARE_BRACKET_CLOSE -> {
                if (openBrackets.get(openBrackets.size() - 1) == token.type()) {
                    openBrackets.remove(openBrackets.size() - 1);
                } else {
                    valid = false;
                }
            }
            case BAD_STRING, BAD_URL, SEMICOLON, CURLY_BRACKET_OPEN, CURLY_BRACKET_CLOSE, AT_KEYWORD ->
                valid = false;
            default -> {}
        }
    }

    private void applyTopLevel(CssToken token) {
        Expect expected = expect;
        expect = Expect.ANY;

        switch (token.type()) {
            case IDENT -> needCompound = false;

            case FUNCTION -> {
                if (expected == Expect.PSEUDO_NAME || expected == Expect.ELEMENT_NAME) {
                    openBrackets.add(CssTokenType.ROUND_BRACKET_CLOSE);
                    needCompound = false;
                } else {
                    valid = false;
                }
            }

            case COLON -> {
                if (expected == Expect.PSEUDO_NAME) {
                    expect = Expect.ELEMENT_NAME;
                } else if (expected == Expect.ANY) {
                    expect = Expect.PSEUDO_NAME;
                } else {
                    valid = false;
                }
            }

            case HASH, SQUARE_BRACKET_OPEN -> {
                if (expected != Expect.ANY) {
                    valid = false;
                }

                if (token.type() == CssTokenType.SQUARE_BRACKET_OPEN) {
                    openBrackets.add(CssTokenType.SQUARE_BRACKET_CLOSE);
                }

                needCompound = false;
            }

            case COMMA -> {
                if (expected != Expect.ANY || needCompound) {
                    valid = false;
                }

                selectors.add(current.toString().trim());
                current.setLength(0);
                needCompound = true;
            }

            case COLUMN -> combinator(expected);

            case DELIM -> {
                if (expected != Expect.ANY) {
                    valid = false;
                }

                switch (token.text()) {
                    case "." -> expect = Expect.CLASS_NAME;
                    case "*", "&", "|" -> needCompound = false;
                    case ">", "+", "~" -> combinator(expected);
                    default -> valid = false;
                }
            }

            default -> valid = false;
        }
    }

    private void combinator(Expect expected) {
        if (expected != Expect.ANY || needCompound) {
            valid = false;
        }

        needCompound = true;
    }

    private void append(CssToken token) {
        if (pendingSpace) {
            text.append(' ');

            if (token.type() != CssTokenType.COMMA || !openBrackets.isEmpty()) {
                current.append(' ');
            }

            pendingSpace = false;
        }

        text.append(token.text());

        if (token.type() != CssTokenType.COMMA || !openBrackets.isEmpty()) {
            current.append(token.text());
        }
    }

    public boolean isValid() {
        return valid && openBrackets.isEmpty() && !needCompound && expect == Expect.ANY;
    }

    public CssSelector toSelector() {
        var list = new ArrayList<>(selectors);
        list.add(current.toString().trim());
        return new CssSelector(text.toString(), list);
    }
}
