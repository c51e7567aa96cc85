package com.exstyler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Depth-first rewriting fold that threads an accumulator alongside tree
 * reconstruction. Untouched subtrees are shared; any node whose children changed is
 * reallocated, so the input subtree itself is never mutated.
 */
public final class TreeFold {

    /**
     * One rewriting step, applied to a node before its children are visited.
     */
    @FunctionalInterface
    public interface Step<A> {
        Folded<A> apply(SyntaxTree tree, int node, A accumulator);
    }

    /**
     * Result of folding a subtree: the (possibly new) node id and the accumulator.
     */
    public static final class Folded<A> {
        private final int node;
        private final A accumulator;

        public Folded(int node, A accumulator) {
            this.node = node;
            this.accumulator = accumulator;
        }

        public int node() {
            return node;
        }

        public A accumulator() {
            return accumulator;
        }
    }

    private TreeFold() {
    }

    /**
     * Applies {@code step} to {@code node}, then folds the children of whatever node
     * the step returned, left to right.
     */
    public static <A> Folded<A> prewalk(SyntaxTree tree, int node, A accumulator, Step<A> step) {
        Folded<A> visited = step.apply(tree, node, accumulator);
        int current = visited.node();
        A acc = visited.accumulator();

        List<Integer> children = tree.children(current);
        List<Integer> rewritten = new ArrayList<>(children.size());
        boolean changed = false;
        for (int child : children) {
            Folded<A> folded = prewalk(tree, child, acc, step);
            acc = folded.accumulator();
            rewritten.add(folded.node());
            changed |= folded.node() != child;
        }

        if (changed) {
            current = tree.withChildren(current, rewritten);
        }
        return new Folded<>(current, acc);
    }

    /**
     * Accumulator-free variant of {@link #prewalk}.
     */
    public static int rewrite(SyntaxTree tree, int node, IntUnaryOperator step) {
        Step<Void> voidStep = (t, n, acc) -> new Folded<>(step.applyAsInt(n), null);
        return prewalk(tree, node, null, voidStep).node();
    }
}
