package com.exstyler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Immutable position inside a {@link SyntaxTree}: the focused node plus the path of
 * (parent, index) frames leading to it from the root.
 *
 * <p>Navigation returns new cursors, or {@code null} when the move is impossible.
 * Edits mutate the underlying arena and return a cursor that is valid after the edit.
 * Cursors taken before an edit to one of their ancestors' child lists may be stale;
 * use {@link #find(int)} from a fresh cursor to relocate a captured node.
 */
public final class TreeCursor {
    private final SyntaxTree tree;
    private final int focus;
    private final List<Frame> path;

    private static final class Frame {
        final int parent;
        final int index;

        Frame(int parent, int index) {
            this.parent = parent;
            this.index = index;
        }
    }

    private TreeCursor(SyntaxTree tree, int focus, List<Frame> path) {
        this.tree = tree;
        this.focus = focus;
        this.path = path;
    }

    /**
     * A cursor on the root of the tree.
     */
    public static TreeCursor root(SyntaxTree tree) {
        return new TreeCursor(tree, tree.root(), Collections.emptyList());
    }

    public SyntaxTree tree() {
        return tree;
    }

    public int node() {
        return focus;
    }

    public NodeKind kind() {
        return tree.kind(focus);
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    public List<Integer> children() {
        return tree.children(focus);
    }

    /**
     * Index of the focus among its siblings, -1 at the root.
     */
    public int index() {
        return path.isEmpty() ? -1 : path.get(path.size() - 1).index;
    }

    /**
     * Number of ancestors above the focus.
     */
    public int depth() {
        return path.size();
    }

    public TreeCursor down() {
        return down(0);
    }

    /**
     * Cursor on the child at {@code index}, or {@code null} when there is none.
     */
    public TreeCursor down(int index) {
        if (index < 0 || index >= tree.childCount(focus)) {
            return null;
        }
        return new TreeCursor(tree, tree.child(focus, index), _push(new Frame(focus, index)));
    }

    public TreeCursor up() {
        if (path.isEmpty()) {
            return null;
        }
        Frame frame = path.get(path.size() - 1);
        return new TreeCursor(tree, frame.parent, path.subList(0, path.size() - 1));
    }

    public TreeCursor right() {
        return _sibling(1);
    }

    public TreeCursor left() {
        return _sibling(-1);
    }

    public TreeCursor rightmost() {
        if (path.isEmpty()) {
            return this;
        }
        Frame frame = path.get(path.size() - 1);
        int last = tree.childCount(frame.parent) - 1;
        return new TreeCursor(tree, tree.child(frame.parent, last), _replaceLast(new Frame(frame.parent, last)));
    }

    /**
     * Depth-first successor: first child, else the next node after this subtree.
     */
    public TreeCursor next() {
        TreeCursor child = down();
        return child != null ? child : skip();
    }

    /**
     * The next node in depth-first order that is not inside this subtree, or
     * {@code null} when the traversal is exhausted.
     */
    public TreeCursor skip() {
        TreeCursor current = this;
        while (current != null) {
            TreeCursor sibling = current.right();
            if (sibling != null) {
                return sibling;
            }
            current = current.up();
        }
        return null;
    }

    public TreeCursor replaceChildren(List<Integer> children) {
        tree.setChildren(focus, children);
        return this;
    }

    /**
     * Puts {@code replacement} where the focus was.
     */
    public TreeCursor replace(int replacement) {
        if (path.isEmpty()) {
            tree.setRoot(replacement);
            return new TreeCursor(tree, replacement, path);
        }
        Frame frame = path.get(path.size() - 1);
        List<Integer> siblings = new ArrayList<>(tree.children(frame.parent));
        siblings.set(frame.index, replacement);
        tree.setChildren(frame.parent, siblings);
        return new TreeCursor(tree, replacement, path);
    }

    /**
     * Inserts nodes right after the focus, which stays focused.
     */
    public TreeCursor insertSiblingsAfter(List<Integer> siblings) {
        Frame frame = _requireParent();
        List<Integer> children = new ArrayList<>(tree.children(frame.parent));
        children.addAll(frame.index + 1, siblings);
        tree.setChildren(frame.parent, children);
        return this;
    }

    /**
     * Inserts nodes right before the focus, which stays focused at its new index.
     */
    public TreeCursor prependSiblings(List<Integer> siblings) {
        Frame frame = _requireParent();
        List<Integer> children = new ArrayList<>(tree.children(frame.parent));
        children.addAll(frame.index, siblings);
        tree.setChildren(frame.parent, children);
        return new TreeCursor(tree, focus, _replaceLast(new Frame(frame.parent, frame.index + siblings.size())));
    }

    /**
     * Unlinks the focus and returns a cursor on the previous sibling, or on the
     * parent when the focus was the first child.
     */
    public TreeCursor remove() {
        Frame frame = _requireParent();
        List<Integer> children = new ArrayList<>(tree.children(frame.parent));
        children.remove(frame.index);
        tree.setChildren(frame.parent, children);
        TreeCursor parent = up();
        if (frame.index == 0) {
            return parent;
        }
        return new TreeCursor(tree, children.get(frame.index - 1), _replaceLast(new Frame(frame.parent, frame.index - 1)));
    }

    /**
     * Nearest strict ancestor whose node satisfies the predicate.
     */
    public TreeCursor findAncestor(IntPredicate predicate) {
        TreeCursor current = up();
        while (current != null && !predicate.test(current.focus)) {
            current = current.up();
        }
        return current;
    }

    /**
     * Locates a previously captured node within the subtree under the focus.
     */
    public TreeCursor find(int target) {
        if (focus == target) {
            return this;
        }
        TreeCursor child = down();
        while (child != null) {
            TreeCursor found = child.find(target);
            if (found != null) {
                return found;
            }
            child = child.right();
        }
        return null;
    }

    private TreeCursor _sibling(int offset) {
        if (path.isEmpty()) {
            return null;
        }
        Frame frame = path.get(path.size() - 1);
        int index = frame.index + offset;
        if (index < 0 || index >= tree.childCount(frame.parent)) {
            return null;
        }
        return new TreeCursor(tree, tree.child(frame.parent, index), _replaceLast(new Frame(frame.parent, index)));
    }

    private Frame _requireParent() {
        if (path.isEmpty()) {
            throw new IllegalStateException("The root node has no siblings");
        }
        return path.get(path.size() - 1);
    }

    private List<Frame> _push(Frame frame) {
        List<Frame> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(frame);
        return Collections.unmodifiableList(extended);
    }

    private List<Frame> _replaceLast(Frame frame) {
        List<Frame> replaced = new ArrayList<>(path);
        replaced.set(replaced.size() - 1, frame);
        return Collections.unmodifiableList(replaced);
    }
}
