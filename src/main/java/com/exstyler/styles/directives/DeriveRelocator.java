package com.exstyler.styles.directives;

import com.exstyler.api.StyleResult;
import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Moves {@code @derive} in front of the struct definition it applies to; the compiler
 * only honours it when it comes first.
 */
public final class DeriveRelocator {
    private static final Set<String> STRUCT_DEFINITIONS = Set.of("defstruct", "schema", "embedded_schema");

    private DeriveRelocator() {
    }

    public static boolean isDerive(SyntaxTree tree, int node) {
        return tree.is(node, NodeKind.ATTRIBUTE, "derive");
    }

    /**
     * @param derive cursor on an {@code @derive} statement inside a block
     */
    public static StyleResult relocate(TreeCursor derive) {
        TreeCursor block = derive.up();
        if (block == null || block.kind() != NodeKind.BLOCK) {
            return StyleResult.cont(derive);
        }
        SyntaxTree tree = derive.tree();
        List<Integer> siblings = new ArrayList<>(block.children());
        int index = derive.index();

        int structIndex = -1;
        for (int i = index - 1; i >= 0; i--) {
            if (_isStructDefinition(tree, siblings.get(i))) {
                structIndex = i;
                break;
            }
        }
        if (structIndex < 0) {
            return StyleResult.cont(derive);
        }

        int structLine = tree.line(siblings.get(structIndex));
        if (structLine != SyntaxTree.UNKNOWN_LINE && tree.line(derive.node()) != SyntaxTree.UNKNOWN_LINE) {
            tree.shiftLines(derive.node(), structLine - 1 - tree.line(derive.node()));
        }

        siblings.remove(index);
        siblings.add(structIndex, derive.node());
        block.replaceChildren(siblings);

        // the statement that preceded @derive now sits at its old index
        return StyleResult.skip(block.down(index));
    }

    private static boolean _isStructDefinition(SyntaxTree tree, int statement) {
        return (tree.is(statement, NodeKind.CALL) || tree.is(statement, NodeKind.DEF))
                && STRUCT_DEFINITIONS.contains(tree.value(statement));
    }
}
