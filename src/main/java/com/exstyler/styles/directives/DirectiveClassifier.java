package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;

import java.util.Optional;

/**
 * Sorts the statements of a body into preamble directives, custom attribute
 * assignments and everything else, by shape alone.
 */
public final class DirectiveClassifier {

    public enum Category {
        DIRECTIVE,
        ATTRIBUTE_ASSIGNMENT,
        NON_DIRECTIVE
    }

    /**
     * Category of one statement. {@code kind} is set for directives, {@code attribute}
     * for attribute assignments.
     */
    public static final class Classification {
        private static final Classification NON_DIRECTIVE = new Classification(Category.NON_DIRECTIVE, null, null);

        private final Category category;
        private final DirectiveKind kind;
        private final String attribute;

        private Classification(Category category, DirectiveKind kind, String attribute) {
            this.category = category;
            this.kind = kind;
            this.attribute = attribute;
        }

        public Category getCategory() {
            return category;
        }

        public DirectiveKind getKind() {
            return kind;
        }

        public String getAttribute() {
            return attribute;
        }

        public boolean isDirective() {
            return category == Category.DIRECTIVE;
        }
    }

    private DirectiveClassifier() {
    }

    public static Classification classify(SyntaxTree tree, int statement) {
        return switch (tree.kind(statement)) {
            case ATTRIBUTE -> _classifyAttribute(tree, statement);
            case CALL -> isDirectiveCall(tree, statement)
                    ? new Classification(Category.DIRECTIVE, DirectiveKind.forCall(tree.value(statement)).get(), null)
                    : Classification.NON_DIRECTIVE;
            default -> Classification.NON_DIRECTIVE;
        };
    }

    /**
     * An {@code alias}, {@code import}, {@code require} or {@code use} call with at
     * least one argument. Whether it sits in statement position is up to the caller.
     */
    public static boolean isDirectiveCall(SyntaxTree tree, int node) {
        return tree.is(node, NodeKind.CALL)
                && tree.childCount(node) > 0
                && DirectiveKind.forCall(tree.value(node)).isPresent();
    }

    private static Classification _classifyAttribute(SyntaxTree tree, int attribute) {
        String name = tree.value(attribute);
        Optional<DirectiveKind> kind = DirectiveKind.forAttribute(name);
        if (kind.isPresent()) {
            return new Classification(Category.DIRECTIVE, kind.get(), null);
        }
        if (tree.childCount(attribute) == 1) {
            return new Classification(Category.ATTRIBUTE_ASSIGNMENT, null, name);
        }
        return Classification.NON_DIRECTIVE;
    }
}
