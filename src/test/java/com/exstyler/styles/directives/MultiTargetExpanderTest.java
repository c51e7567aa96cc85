package com.exstyler.styles.directives;

import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MultiTargetExpanderTest {
    private SyntaxTree tree;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        tree = new SyntaxTree();
        b = new TreeBuilder(tree);
    }

    private List<String> _render(List<Integer> nodes) {
        return nodes.stream().map(tree::render).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Braced targets expand in reading order")
    void expandsTargets() {
        int directive = b.call("import", b.multi(b.aliases("Foo"), b.aliases("Bar"), b.aliases("Baz", "Qux")));

        assertEquals(List.of("import Foo.Bar", "import Foo.Baz.Qux"), _render(MultiTargetExpander.expand(tree, directive)));
    }

    @Test
    @DisplayName("__MODULE__ works as the root")
    void moduleSelfRoot() {
        int directive = b.call("alias", b.multi(b.moduleSelf(), b.aliases("Child"), b.aliases("Other")));

        assertEquals(List.of("alias __MODULE__.Child", "alias __MODULE__.Other"),
                _render(MultiTargetExpander.expand(tree, directive)));
    }

    @Test
    @DisplayName("Expanded directives take the line of their target")
    void lines() {
        int bar = b.atLine(3).aliases("Bar");
        int baz = b.atLine(SyntaxTree.UNKNOWN_LINE).aliases("Baz");
        int directive = b.atLine(2).call("alias", b.multi(b.aliases("Foo"), bar, baz));

        List<Integer> expanded = MultiTargetExpander.expand(tree, directive);

        assertEquals(3, tree.line(expanded.get(0)));
        assertEquals(2, tree.line(expanded.get(1)));
    }

    @Test
    @DisplayName("Root segments are not shared between expanded directives")
    void copiesRoot() {
        int directive = b.call("alias", b.multi(b.aliases("Foo"), b.aliases("Bar"), b.aliases("Baz")));

        List<Integer> expanded = MultiTargetExpander.expand(tree, directive);
        int first = tree.child(tree.child(expanded.get(0), 0), 0);
        int second = tree.child(tree.child(expanded.get(1), 0), 0);

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Aliasing a root name to itself is dropped")
    void dropsBareAlias() {
        assertTrue(MultiTargetExpander.expand(tree, b.call("alias", b.aliases("Foo"))).isEmpty());
        assertEquals(1, MultiTargetExpander.expand(tree, b.call("alias", b.aliases("Foo"), b.keyword("as", b.aliases("Bar")))).size());
        assertEquals(1, MultiTargetExpander.expand(tree, b.call("import", b.aliases("Foo"))).size());
    }

    @Test
    @DisplayName("Unrecognized shapes pass through")
    void passesThrough() {
        int dynamic = b.call("alias", b.multi(b.variable("root"), b.aliases("Bar")));
        int options = b.call("import", b.multi(b.aliases("Foo"), b.aliases("Bar")), b.keyword("only", b.literal("[a: 1]")));

        assertEquals(List.of(dynamic), MultiTargetExpander.expand(tree, dynamic));
        assertEquals(List.of(options), MultiTargetExpander.expand(tree, options));
    }
}
