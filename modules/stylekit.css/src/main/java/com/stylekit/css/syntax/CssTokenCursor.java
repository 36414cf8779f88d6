package com.stylekit.css.syntax;

import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import java.util.Objects;

/**
 * The current token of a {@link CssTokenSource}. Every token that is pulled from the source is
 * recorded in the {@link CssNodeStack}.
 */
public final class CssTokenCursor {

    private final CssTokenSource source;
    private final CssNodeStack nodes;
    private CssToken current;

    public CssTokenCursor(CssTokenSource source, CssNodeStack nodes) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.nodes = Objects.requireNonNull(nodes, "nodes cannot be null");
    }

    /**
     * Returns the current token, or {@code null} if no token has been read yet.
     */
    public CssToken current() {
        return current;
    }

    public CssTokenType type() {
        return current.type();
    }

    public boolean is(CssTokenType type) {
        return current.type() == type;
    }

    public boolean isEof() {
        return current.type() == CssTokenType.EOF;
    }

    /**
     * Reads the next token and makes it the current token.
     */
    public CssToken next() {
        current = source.next();
        nodes.record(current);
        return current;
    }

    /**
     * Skips whitespace, comments and CDO/CDC tokens, starting with the current token.
     */
    public CssToken collectTrivia() {
        while (current.type().isTrivia()) {
            next();
        }

        return current;
    }
}
