package com.exstyler.core;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.exstyler.api.Style;
import com.exstyler.api.StyleReport;
import com.exstyler.api.StyleResult;
import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeCursor;
import com.exstyler.config.StylerConfig;
import com.exstyler.styles.directives.ModuleDirectivesStyle;
import com.exstyler.util.LoggerUtil;

/**
 * Runs style rules over syntax trees. Each style gets its own depth-first pass over
 * the tree and steers that pass through the {@link StyleResult} it returns.
 *
 * <p>Instances hold no per-tree state apart from statistics counters, so one styler
 * may be shared by threads styling different trees.
 */
public class Styler {
    private static final Logger logger = LoggerUtil.getLogger(Styler.class);

    private final StylerConfig config;
    private final List<Style> styles;

    private final AtomicInteger processedTreeCount = new AtomicInteger(0);
    private final AtomicInteger changedTreeCount = new AtomicInteger(0);
    private final AtomicInteger failureCount = new AtomicInteger(0);

    /**
     * Creates a styler running the module directives style.
     */
    public Styler(StylerConfig config) {
        this(config, List.of(new ModuleDirectivesStyle()));
    }

    public Styler(StylerConfig config, List<Style> styles) {
        this.config = config;
        this.styles = List.copyOf(styles);
        logger.fine("Styler initialized with styles: " + styles.stream().map(Style::name).toList());
    }

    /**
     * Styles a whole tree in place.
     */
    public StyleReport style(SyntaxTree tree) {
        return _style(tree, TreeCursor.root(tree));
    }

    /**
     * Styles only the module definition under {@code module}; the rest of the tree is
     * touched only where a rewrite must place code in front of the module.
     */
    public StyleReport styleModule(TreeCursor module) {
        if (module.kind() != NodeKind.MODULE) {
            throw new IllegalArgumentException("Cursor is not on a module definition: " + module.kind());
        }
        return _style(module.tree(), module);
    }

    private StyleReport _style(SyntaxTree tree, TreeCursor start) {
        processedTreeCount.incrementAndGet();
        StyleContext context = StyleContext.from(config);
        String before = tree.render();
        StyleReport.Builder report = StyleReport.builder();

        TreeCursor current = start;
        for (Style style : styles) {
            int snapshot = tree.copy(tree.root());
            int target = current.node();
            try {
                _traverse(style, current, context);
            } catch (RuntimeException e) {
                failureCount.incrementAndGet();
                logger.log(Level.SEVERE, "Style '" + style.name() + "' failed, leaving the tree unchanged", e);
                tree.setRoot(snapshot);
                report.addFailedStyle(style.name());
            }
            // the style may have wrapped or relinked ancestors of the start node
            current = start.isRoot() ? TreeCursor.root(tree) : TreeCursor.root(tree).find(target);
            if (current == null) {
                break;
            }
        }

        String after = tree.render();
        boolean changed = !before.equals(after);
        if (changed) {
            changedTreeCount.incrementAndGet();
            logger.fine("Styled tree with " + context.getRefactorings().size() + " refactorings");
        }

        return report
                .changed(changed)
                .styledCode(after)
                .appliedRefactorings(context.getRefactorings())
                .build();
    }

    /**
     * Depth-first pass over the subtree under {@code start}.
     */
    private void _traverse(Style style, TreeCursor start, StyleContext context) {
        int boundary = start.depth();
        TreeCursor cursor = start;
        while (cursor != null) {
            StyleResult result = style.run(cursor, context);
            cursor = result.getCursor();
            TreeCursor child = result.isSkip() ? null : cursor.down();
            cursor = child != null ? child : _skipWithin(cursor, boundary);
        }
    }

    private static TreeCursor _skipWithin(TreeCursor cursor, int boundary) {
        TreeCursor current = cursor;
        while (current != null && current.depth() > boundary) {
            TreeCursor sibling = current.right();
            if (sibling != null) {
                return sibling;
            }
            current = current.up();
        }
        return null;
    }

    public int getProcessedTreeCount() {
        return processedTreeCount.get();
    }

    public int getChangedTreeCount() {
        return changedTreeCount.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }
}
