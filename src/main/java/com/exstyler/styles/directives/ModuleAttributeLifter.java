package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import com.exstyler.ast.TreeCursor;
import com.exstyler.ast.TreeFold;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps hoisted directives reading the value an attribute had where they were written.
 *
 * <p>A read of {@code @name} inside a directive is replaced by a local variable (or by
 * {@code unquote(name)} inside {@code use}), the assignment {@code @name value} becomes
 * {@code @name name}, and {@code name = value} is placed in front of the statement that
 * holds the enclosing definition. Only attributes assigned exactly once, before the
 * directive, are lifted.
 */
public class ModuleAttributeLifter {
    private final SyntaxTree tree;
    private final boolean enabled;
    private final Set<String> assignedOnce;
    private final Set<String> assigned = new HashSet<>();
    private final Set<String> lifted = new LinkedHashSet<>();
    private final List<Integer> bindings = new ArrayList<>();

    /**
     * @param statements the body being organized, used to find attributes assigned more than once
     * @param enabled    false when there is no enclosing statement to place bindings before
     */
    public ModuleAttributeLifter(SyntaxTree tree, List<Integer> statements, boolean enabled) {
        this.tree = tree;
        this.enabled = enabled;

        Map<String, Integer> counts = new HashMap<>();
        for (int statement : statements) {
            if (DirectiveClassifier.classify(tree, statement).getCategory()
                    == DirectiveClassifier.Category.ATTRIBUTE_ASSIGNMENT) {
                counts.merge(tree.value(statement), 1, Integer::sum);
            }
        }
        Set<String> once = new HashSet<>();
        counts.forEach((name, count) -> {
            if (count == 1) {
                once.add(name);
            }
        });
        this.assignedOnce = once;
    }

    public void recordAssignment(String attribute) {
        assigned.add(attribute);
    }

    /**
     * Replaces reads of already assigned attributes inside {@code directive}.
     *
     * @param deferred whether the directive is a {@code use}, whose options are
     *                 evaluated inside the used module's macro
     */
    public int liftReferences(int directive, boolean deferred) {
        if (!enabled || assigned.isEmpty()) {
            return directive;
        }
        TreeFold.Folded<Set<String>> folded = TreeFold.prewalk(tree, directive, lifted, (t, node, acc) -> {
            if (node == directive || !t.is(node, NodeKind.ATTRIBUTE) || t.childCount(node) != 0) {
                return new TreeFold.Folded<>(node, acc);
            }
            String name = t.value(node);
            if (!assigned.contains(name) || !assignedOnce.contains(name)) {
                return new TreeFold.Folded<>(node, acc);
            }
            TreeBuilder builder = new TreeBuilder(t).atLine(t.line(node));
            int replacement = deferred
                    ? builder.call("unquote", builder.variable(name))
                    : builder.variable(name);
            acc.add(name);
            return new TreeFold.Folded<>(replacement, acc);
        });
        return folded.node();
    }

    public boolean hasLifts() {
        return !lifted.isEmpty();
    }

    public Set<String> getLifted() {
        return Collections.unmodifiableSet(lifted);
    }

    /**
     * Rewrites {@code @name value} to {@code @name name} for every lifted attribute and
     * collects the matching {@code name = value} bindings.
     */
    public List<Integer> rewriteAssignments(List<Integer> nondirectives) {
        List<Integer> rewritten = new ArrayList<>(nondirectives.size());
        for (int statement : nondirectives) {
            if (tree.is(statement, NodeKind.ATTRIBUTE) && tree.childCount(statement) == 1
                    && lifted.contains(tree.value(statement))) {
                String name = tree.value(statement);
                TreeBuilder builder = new TreeBuilder(tree).atLine(tree.line(statement));
                bindings.add(builder.match(builder.variable(name), tree.child(statement, 0)));
                rewritten.add(builder.attribute(name, builder.variable(name)));
            } else {
                rewritten.add(statement);
            }
        }
        return rewritten;
    }

    public List<Integer> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    /**
     * Inserts {@code bindings} before the statement holding {@code body} in the nearest
     * enclosing block, wrapping the root in a new block when there is none.
     *
     * @return a cursor on {@code body} valid after the insertion
     */
    public static TreeCursor promote(TreeCursor body, List<Integer> bindings) {
        SyntaxTree tree = body.tree();
        int target = body.node();

        TreeCursor statement = body.up();
        if (statement == null) {
            throw new IllegalStateException("Cannot promote bindings above the root node");
        }
        while (!statement.isRoot() && statement.up().kind() != NodeKind.BLOCK) {
            statement = statement.up();
        }

        if (statement.isRoot()) {
            List<Integer> statements = new ArrayList<>(bindings);
            statements.add(statement.node());
            tree.setRoot(tree.add(NodeKind.BLOCK, null, tree.line(statement.node()), statements));
            return TreeCursor.root(tree).find(target);
        }
        return statement.prependSiblings(bindings).find(target);
    }
}
