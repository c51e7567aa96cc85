package com.exstyler.api;

import com.exstyler.ast.TreeCursor;
import com.exstyler.core.StyleContext;

/**
 * A style rule applied to every node of a tree during traversal.
 */
public interface Style {
    /**
     * Short identifier used in configuration and reports.
     */
    String name();

    /**
     * Inspect (and possibly rewrite around) the focused node.
     *
     * @return where traversal resumes, and whether it descends into that node
     */
    StyleResult run(TreeCursor cursor, StyleContext context);
}
