package com.exstyler.ast;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical textual form of a subtree. Directives are sorted on this text, so two
 * nodes with the same shape always render identically regardless of line metadata.
 * Bodies are indented by two spaces per level.
 */
public final class SourceRenderer {
    private static final String INDENT = "  ";
    private static final Set<String> PARENLESS_CALLS = Set.of("alias", "import", "require", "use");

    private SourceRenderer() {
    }

    public static String render(SyntaxTree tree, int id) {
        StringBuilder sb = new StringBuilder();
        _statement(tree, id, "", sb);
        return sb.toString();
    }

    private static void _statement(SyntaxTree tree, int id, String indent, StringBuilder sb) {
        switch (tree.kind(id)) {
            case BLOCK -> {
                List<Integer> statements = tree.children(id);
                for (int i = 0; i < statements.size(); i++) {
                    if (i > 0) {
                        sb.append('\n');
                    }
                    _statement(tree, statements.get(i), indent, sb);
                }
            }
            case MODULE -> _withBody(tree, id, tree.value(id) + " " + _expression(tree, tree.child(id, 0)),
                    tree.child(id, 1), indent, sb);
            case DEF -> _withBody(tree, id, tree.value(id) + " " + _head(tree, tree.child(id, 0)),
                    tree.child(id, 1), indent, sb);
            case QUOTE -> _withBody(tree, id, "quote", tree.child(id, 0), indent, sb);
            default -> sb.append(indent).append(_expression(tree, id));
        }
    }

    private static void _withBody(SyntaxTree tree, int id, String head, int body, String indent, StringBuilder sb) {
        sb.append(indent).append(head);
        if (TreeBuilder.KEYWORD_BODY.equals(tree.value(body))) {
            String expression = tree.children(body).stream()
                    .map(child -> _expression(tree, child))
                    .collect(Collectors.joining("; "));
            sb.append(", do: ").append(expression);
            return;
        }
        sb.append(" do\n");
        if (tree.childCount(body) > 0) {
            _statement(tree, body, indent + INDENT, sb);
            sb.append('\n');
        }
        sb.append(indent).append("end");
    }

    private static String _expression(SyntaxTree tree, int id) {
        String value = tree.value(id);
        return switch (tree.kind(id)) {
            case ALIASES -> _join(tree, tree.children(id), ".");
            case NAME, VARIABLE, LITERAL, MODULE_SELF -> value;
            case STRING -> "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            case ATTRIBUTE -> tree.childCount(id) == 0
                    ? "@" + value
                    : "@" + value + " " + _expression(tree, tree.child(id, 0));
            case CALL -> {
                String args = _join(tree, tree.children(id), ", ");
                if (PARENLESS_CALLS.contains(value) && !args.isEmpty()) {
                    yield value + " " + args;
                }
                yield value + "(" + args + ")";
            }
            case REMOTE_CALL -> {
                List<Integer> children = tree.children(id);
                yield _expression(tree, children.get(0)) + "." + value
                        + "(" + _join(tree, children.subList(1, children.size()), ", ") + ")";
            }
            case MULTI -> {
                List<Integer> children = tree.children(id);
                yield _expression(tree, children.get(0))
                        + ".{" + _join(tree, children.subList(1, children.size()), ", ") + "}";
            }
            case KEYWORD -> value + ": " + _expression(tree, tree.child(id, 0));
            case MATCH, OPERATOR -> _expression(tree, tree.child(id, 0)) + " " + value + " "
                    + _expression(tree, tree.child(id, 1));
            case BLOCK, MODULE, DEF, QUOTE -> {
                StringBuilder sb = new StringBuilder();
                _statement(tree, id, "", sb);
                yield sb.toString();
            }
        };
    }

    // function heads always keep their parentheses, even `def import(foo)`
    private static String _head(SyntaxTree tree, int head) {
        if (tree.is(head, NodeKind.CALL)) {
            return tree.value(head) + "(" + _join(tree, tree.children(head), ", ") + ")";
        }
        return _expression(tree, head);
    }

    private static String _join(SyntaxTree tree, List<Integer> ids, String separator) {
        return ids.stream()
                .map(child -> _expression(tree, child))
                .collect(Collectors.joining(separator));
    }
}
