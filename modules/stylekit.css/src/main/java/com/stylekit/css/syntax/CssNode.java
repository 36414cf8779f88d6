package com.stylekit.css.syntax;

import stylekit.css.CssFormattable;
import stylekit.css.syntax.CssToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the concrete syntax tree that is recorded when trivia are stored.
 * <p>
 * A node owns the tokens that were read while it was the innermost open node, interleaved with
 * its child nodes in the order in which they were read or opened, and the entity that was built
 * from them. Concatenating the text of {@link #flatten()} reproduces the covered source text.
 */
public final class CssNode {

    // Either CssToken or CssNode, in source order.
    private final List<Object> parts = new ArrayList<>();
    private CssFormattable entity;

    CssNode() {}

    public CssFormattable getEntity() {
        return entity;
    }

    void setEntity(CssFormattable entity) {
        this.entity = entity;
    }

    /**
     * Returns the tokens that belong directly to this node.
     */
    public List<CssToken> getTokens() {
        var tokens = new ArrayList<CssToken>();

        for (Object part : parts) {
            if (part instanceof CssToken token) {
                tokens.add(token);
            }
        }

        return Collections.unmodifiableList(tokens);
    }

    public List<CssNode> getChildren() {
        var children = new ArrayList<CssNode>();

        for (Object part : parts) {
            if (part instanceof CssNode child) {
                children.add(child);
            }
        }

        return Collections.unmodifiableList(children);
    }

    /**
     * Returns all tokens of this node and its descendants in source order.
     */
    public List<CssToken> flatten() {
        var tokens = new ArrayList<CssToken>();
        flatten(tokens);
        return tokens;
    }

    private void flatten(List<CssToken> tokens) {
        for (Object part : parts) {
            if (part instanceof CssToken token) {
                tokens.add(token);
            } else {
                ((CssNode)part).flatten(tokens);
            }
        }
    }

    /**
     * Returns the source text covered by this node.
     */
    public String toText() {
        var builder = new StringBuilder();

        for (CssToken token : flatten()) {
            builder.append(token.text());
        }

        return builder.toString();
    }

    void addToken(CssToken token) {
        parts.add(token);
    }

    void addChild(CssNode child) {
        parts.add(child);
    }

    /**
     * Removes and returns the last part of this node if it is a token, so that it can be
     * handed over to an adjacent node without changing the source order.
     */
    CssToken removeTrailingToken() {
        int last = parts.size() - 1;

        if (last >= 0 && parts.get(last) instanceof CssToken token) {
            parts.remove(last);
            return token;
        }

        return null;
    }

    @Override
    public String toString() {
        return "CssNode[" + (entity != null ? entity.getClass().getSimpleName() : "") + "]" + toText();
    }
}
