package com.exstyler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Arena holding every node of one parsed file. Nodes are addressed by integer id
 * and never freed; rewrites allocate new nodes and relink children, so ids captured
 * before an edit stay valid afterwards.
 */
public class SyntaxTree {
    public static final int UNKNOWN_LINE = 0;

    private final List<Entry> nodes = new ArrayList<>();
    private int root = -1;

    private static final class Entry {
        final NodeKind kind;
        final String value;
        int line;
        List<Integer> children;

        Entry(NodeKind kind, String value, int line, List<Integer> children) {
            this.kind = kind;
            this.value = value;
            this.line = line;
            this.children = children;
        }
    }

    /**
     * Allocates a new node and returns its id.
     */
    public int add(NodeKind kind, String value, int line, List<Integer> children) {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind is required");
        }
        for (int child : children) {
            _entry(child);
        }
        nodes.add(new Entry(kind, value, line, new ArrayList<>(children)));
        return nodes.size() - 1;
    }

    public int root() {
        if (root < 0) {
            throw new IllegalStateException("Tree has no root");
        }
        return root;
    }

    public void setRoot(int id) {
        _entry(id);
        this.root = id;
    }

    public NodeKind kind(int id) {
        return _entry(id).kind;
    }

    public String value(int id) {
        return _entry(id).value;
    }

    public int line(int id) {
        return _entry(id).line;
    }

    public void setLine(int id, int line) {
        _entry(id).line = line;
    }

    public List<Integer> children(int id) {
        return Collections.unmodifiableList(new ArrayList<>(_entry(id).children));
    }

    public int childCount(int id) {
        return _entry(id).children.size();
    }

    public int child(int id, int index) {
        return _entry(id).children.get(index);
    }

    public void setChildren(int id, List<Integer> children) {
        for (int child : children) {
            _entry(child);
        }
        _entry(id).children = new ArrayList<>(children);
    }

    public boolean is(int id, NodeKind kind) {
        return kind(id) == kind;
    }

    public boolean is(int id, NodeKind kind, String value) {
        return kind(id) == kind && value.equals(value(id));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Copies a subtree into fresh nodes.
     */
    public int copy(int id) {
        Entry entry = _entry(id);
        List<Integer> children = new ArrayList<>(entry.children.size());
        for (int child : entry.children) {
            children.add(copy(child));
        }
        return add(entry.kind, entry.value, entry.line, children);
    }

    /**
     * Allocates a node like {@code id} with the given children.
     */
    public int withChildren(int id, List<Integer> children) {
        Entry entry = _entry(id);
        return add(entry.kind, entry.value, entry.line, children);
    }

    /**
     * Moves every known line in the subtree by {@code delta}.
     */
    public void shiftLines(int id, int delta) {
        Entry entry = _entry(id);
        if (entry.line != UNKNOWN_LINE) {
            entry.line = Math.max(1, entry.line + delta);
        }
        for (int child : entry.children) {
            shiftLines(child, delta);
        }
    }

    /**
     * Structural equality ignoring line metadata.
     */
    public boolean sameShape(int a, int b) {
        if (a == b) {
            return true;
        }
        Entry left = _entry(a);
        Entry right = _entry(b);
        if (left.kind != right.kind || !Objects.equals(left.value, right.value)
                || left.children.size() != right.children.size()) {
            return false;
        }
        for (int i = 0; i < left.children.size(); i++) {
            if (!sameShape(left.children.get(i), right.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders a subtree, see {@link SourceRenderer}.
     */
    public String render(int id) {
        return SourceRenderer.render(this, id);
    }

    public String render() {
        return render(root());
    }

    private Entry _entry(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return nodes.get(id);
    }
}
