package com.exstyler.ast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeCursorTest {
    private SyntaxTree tree;
    private TreeBuilder b;
    private int first;
    private int second;
    private int third;

    @BeforeEach
    void setUp() {
        tree = new SyntaxTree();
        b = new TreeBuilder(tree);
        first = b.literal("1");
        second = b.call("run", b.variable("x"));
        third = b.literal("3");
        b.root(b.block(first, second, third));
    }

    @Test
    @DisplayName("Sibling and parent navigation")
    void navigation() {
        TreeCursor root = TreeCursor.root(tree);
        TreeCursor cursor = root.down();

        assertTrue(root.isRoot());
        assertNull(root.up());
        assertNull(root.right());
        assertEquals(first, cursor.node());
        assertEquals(0, cursor.index());
        assertEquals(1, cursor.depth());
        assertNull(cursor.left());
        assertEquals(second, cursor.right().node());
        assertEquals(third, cursor.rightmost().node());
        assertEquals(root.node(), cursor.right().up().node());
        assertNull(root.down(3));
    }

    @Test
    @DisplayName("Depth-first order visits every node once")
    void depthFirst() {
        StringBuilder visited = new StringBuilder();
        for (TreeCursor cursor = TreeCursor.root(tree); cursor != null; cursor = cursor.next()) {
            visited.append(cursor.kind()).append(' ');
        }

        assertEquals("BLOCK LITERAL CALL VARIABLE LITERAL ", visited.toString());
    }

    @Test
    @DisplayName("Skip moves past the focused subtree")
    void skip() {
        TreeCursor call = TreeCursor.root(tree).down(1);

        assertEquals(third, call.skip().node());
        assertNull(call.skip().skip());
    }

    @Test
    @DisplayName("Inserting after keeps the focus")
    void insertSiblingsAfter() {
        int extra = b.literal("2.5");
        TreeCursor cursor = TreeCursor.root(tree).down(1).insertSiblingsAfter(List.of(extra));

        assertEquals(second, cursor.node());
        assertEquals(extra, cursor.right().node());
        assertEquals("1\nrun(x)\n2.5\n3", tree.render());
    }

    @Test
    @DisplayName("Prepending shifts the focus to its new index")
    void prependSiblings() {
        TreeCursor cursor = TreeCursor.root(tree).down(1).prependSiblings(List.of(b.literal("a"), b.literal("b")));

        assertEquals(second, cursor.node());
        assertEquals(3, cursor.index());
        assertEquals("1\na\nb\nrun(x)\n3", tree.render());
    }

    @Test
    @DisplayName("Removing returns the previous sibling or the parent")
    void remove() {
        TreeCursor previous = TreeCursor.root(tree).down(1).remove();
        assertEquals(first, previous.node());

        TreeCursor parent = previous.remove();
        assertTrue(parent.isRoot());
        assertEquals("3", tree.render());
    }

    @Test
    @DisplayName("The root has no siblings to edit")
    void rootEdits() {
        TreeCursor root = TreeCursor.root(tree);

        assertThrows(IllegalStateException.class, () -> root.insertSiblingsAfter(List.of(first)));
        assertThrows(IllegalStateException.class, root::remove);
    }

    @Test
    @DisplayName("Replacing the root changes the tree root")
    void replaceRoot() {
        int other = b.literal("other");

        TreeCursor cursor = TreeCursor.root(tree).replace(other);

        assertEquals(other, tree.root());
        assertTrue(cursor.isRoot());
    }

    @Test
    @DisplayName("Find and findAncestor locate captured nodes")
    void find() {
        int variable = tree.child(second, 0);
        TreeCursor found = TreeCursor.root(tree).find(variable);

        assertNotNull(found);
        assertEquals(2, found.depth());
        assertEquals(second, found.findAncestor(id -> tree.is(id, NodeKind.CALL)).node());
        assertNull(found.findAncestor(id -> tree.is(id, NodeKind.MODULE)));
        assertNull(TreeCursor.root(tree).down().find(variable));
    }
}
