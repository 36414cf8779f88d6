package com.stylekit.css.syntax;

import stylekit.css.CssFormattable;
import stylekit.css.syntax.CssToken;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The stack of open {@link CssNode}s of the concrete syntax tree.
 * <p>
 * When the stack is inactive, no nodes are recorded and {@link #open()} returns a scope that
 * does nothing. When active, every token that is read is appended to the innermost open node.
 * A node is opened and closed with a {@link Scope}:
 * <pre>{@code
 *     try (var scope = nodes.open()) {
 *         var rule = ...;
 *         return scope.complete(rule);
 *     }
 * }</pre>
 * Leaving the {@code try} block without calling {@link Scope#complete} closes the node without
 * an entity, so that opens and closes stay balanced on every path.
 */
public final class CssNodeStack {

    private static final Scope INACTIVE_SCOPE = new Scope(null);

    private final Deque<CssNode> nodes = new ArrayDeque<>();
    private final CssNode root;

    public CssNodeStack(boolean active) {
        if (active) {
            root = new CssNode();
            nodes.push(root);
        } else {
            root = null;
        }
    }

    /**
     * Returns the root node, or {@code null} if the stack is inactive.
     */
    public CssNode getRoot() {
        return root;
    }

    /**
     * Returns the number of open nodes, including the root node.
     */
    public int depth() {
        return nodes.size();
    }

    public void record(CssToken token) {
        if (!nodes.isEmpty()) {
            nodes.peek().addToken(token);
        }
    }

    /**
     * Opens a new node as a child of the innermost open node. The last token read belongs to the
     * construct that is about to be built, so it is moved from the parent into the new node.
     */
    public Scope open() {
        if (nodes.isEmpty()) {
            return INACTIVE_SCOPE;
        }

        var parent = nodes.peek();
        var node = new CssNode();
        CssToken token = parent.removeTrailingToken();

        if (token != null) {
            node.addToken(token);
        }

        parent.addChild(node);
        nodes.push(node);
        return new Scope(this, node);
    }

    private void close(CssNode node, CssFormattable entity) {
        if (nodes.peek() != node) {
            throw new IllegalStateException("Unbalanced syntax tree node");
        }

        nodes.pop();
        node.setEntity(entity);

        // The last token read was the lookahead that ended the construct; it belongs to the parent.
        CssToken token = node.removeTrailingToken();
        if (token != null) {
            nodes.peek().addToken(token);
        }
    }

    /**
     * Keeps a node open until it is completed or closed.
     */
    public static final class Scope implements AutoCloseable {

        private final CssNodeStack stack;
        private final CssNode node;
        private boolean closed;

        private Scope(CssNodeStack stack) {
            this(stack, null);
        }

        private Scope(CssNodeStack stack, CssNode node) {
            this.stack = stack;
            this.node = node;
        }

        /**
         * Closes the node, attaching the given entity to it.
         *
         * @return the entity
         */
        public <T extends CssFormattable> T complete(T entity) {
            if (stack != null && !closed) {
                closed = true;
                stack.close(node, entity);
            }

            return entity;
        }

        @Override
        public void close() {
            complete(null);
        }
    }
}
