package com.exstyler.api;

import com.exstyler.ast.TreeCursor;

/**
 * Outcome of running a {@link Style} on one node.
 */
public class StyleResult {

    public enum Traversal {
        CONTINUE,   // descend into the focused node
        SKIP        // move past the focused node's subtree
    }

    private final TreeCursor cursor;
    private final Traversal traversal;

    private StyleResult(TreeCursor cursor, Traversal traversal) {
        this.cursor = cursor;
        this.traversal = traversal;
    }

    public static StyleResult cont(TreeCursor cursor) {
        return new StyleResult(cursor, Traversal.CONTINUE);
    }

    public static StyleResult skip(TreeCursor cursor) {
        return new StyleResult(cursor, Traversal.SKIP);
    }

    public TreeCursor getCursor() {
        return cursor;
    }

    public Traversal getTraversal() {
        return traversal;
    }

    public boolean isSkip() {
        return traversal == Traversal.SKIP;
    }
}
