package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;

import java.util.List;
import java.util.OptionalInt;

/**
 * Builds the final preamble: synthesized module documentation and line repair.
 */
public final class LayoutAssembler {
    /**
     * Anchor used when nothing follows the preamble, and the line given to nodes
     * created without a position.
     */
    public static final int LAST_LINE = 999_999;

    private LayoutAssembler() {
    }

    /**
     * {@code @moduledoc false} for the module, placed on the line after its name, or
     * empty when the name is dynamic or ends with one of {@code skipSuffixes}.
     */
    public static OptionalInt moduledoc(SyntaxTree tree, int module, List<String> skipSuffixes) {
        int name = tree.child(module, 0);
        if (!tree.is(name, NodeKind.ALIASES) || tree.childCount(name) == 0) {
            return OptionalInt.empty();
        }
        int last = tree.child(name, tree.childCount(name) - 1);
        if (!tree.is(last, NodeKind.NAME)) {
            return OptionalInt.empty();
        }
        String lastSegment = tree.value(last);
        for (String suffix : skipSuffixes) {
            if (lastSegment.endsWith(suffix)) {
                return OptionalInt.empty();
            }
        }

        int line = tree.line(name) != SyntaxTree.UNKNOWN_LINE ? tree.line(name) : tree.line(module);
        TreeBuilder builder = new TreeBuilder(tree)
                .atLine(line == SyntaxTree.UNKNOWN_LINE ? SyntaxTree.UNKNOWN_LINE : line + 1);
        return OptionalInt.of(builder.attribute("moduledoc", builder.literal("false")));
    }

    /**
     * Pulls directives whose line lies past the next statement back onto that line, so
     * line numbers never decrease along the preamble and never pass the first
     * non-directive.
     *
     * @param firstNonDirective id of the statement after the preamble, or -1
     */
    public static void fixLineNumbers(SyntaxTree tree, List<Integer> directives, int firstNonDirective) {
        int anchor = LAST_LINE;
        if (firstNonDirective >= 0 && tree.line(firstNonDirective) != SyntaxTree.UNKNOWN_LINE) {
            anchor = tree.line(firstNonDirective);
        }

        for (int i = directives.size() - 1; i >= 0; i--) {
            int directive = directives.get(i);
            int line = tree.line(directive);
            if (line == SyntaxTree.UNKNOWN_LINE) {
                continue;
            }
            if (line > anchor) {
                tree.shiftLines(directive, anchor - line);
            } else {
                anchor = line;
            }
        }
    }
}
