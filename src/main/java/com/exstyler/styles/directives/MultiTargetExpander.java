package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits {@code alias Foo.{Bar, Baz}} style directives into one directive per target
 * and drops aliases of a root name to itself.
 */
public final class MultiTargetExpander {

    private MultiTargetExpander() {
    }

    /**
     * Directives replacing {@code directive}, in reading order. Shapes that are not
     * recognized come back as the directive alone.
     */
    public static List<Integer> expand(SyntaxTree tree, int directive) {
        if (tree.childCount(directive) != 1) {
            return List.of(directive);
        }
        int target = tree.child(directive, 0);

        // alias Foo
        if (tree.is(directive, NodeKind.CALL, "alias") && tree.is(target, NodeKind.ALIASES)
                && tree.childCount(target) == 1 && tree.is(tree.child(target, 0), NodeKind.NAME)) {
            return List.of();
        }

        if (!_isExpandable(tree, target)) {
            return List.of(directive);
        }

        int root = tree.child(target, 0);
        List<Integer> targets = tree.children(target).subList(1, tree.childCount(target));
        List<Integer> expanded = new ArrayList<>(targets.size());
        for (int suffix : targets) {
            int line = tree.line(suffix) != SyntaxTree.UNKNOWN_LINE ? tree.line(suffix) : tree.line(directive);

            List<Integer> segments = new ArrayList<>();
            if (tree.is(root, NodeKind.MODULE_SELF)) {
                segments.add(tree.copy(root));
            } else {
                for (int segment : tree.children(root)) {
                    segments.add(tree.copy(segment));
                }
            }
            segments.addAll(tree.children(suffix));

            int aliases = tree.add(NodeKind.ALIASES, null, line, segments);
            expanded.add(tree.add(NodeKind.CALL, tree.value(directive), line, List.of(aliases)));
        }
        return expanded;
    }

    private static boolean _isExpandable(SyntaxTree tree, int target) {
        if (!tree.is(target, NodeKind.MULTI) || tree.childCount(target) < 2) {
            return false;
        }
        int root = tree.child(target, 0);
        if (!tree.is(root, NodeKind.ALIASES) && !tree.is(root, NodeKind.MODULE_SELF)) {
            return false;
        }
        for (int i = 1; i < tree.childCount(target); i++) {
            if (!tree.is(tree.child(target, i), NodeKind.ALIASES)) {
                return false;
            }
        }
        return true;
    }
}
