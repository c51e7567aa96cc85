package com.exstyler.styles.directives;

import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DirectiveSorterTest {
    private SyntaxTree tree;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        tree = new SyntaxTree();
        b = new TreeBuilder(tree);
    }

    @Test
    @DisplayName("Sorting ignores case")
    void caseInsensitive() {
        List<Integer> sorted = DirectiveSorter.sort(tree, List.of(
                b.call("alias", b.aliases("Zeta")),
                b.call("alias", b.aliases("alpha", "Beta")),
                b.call("alias", b.aliases("Alpha", "Alpha"))));

        assertEquals(List.of("alias Alpha.Alpha", "alias alpha.Beta", "alias Zeta"),
                sorted.stream().map(tree::render).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Duplicates collapse onto the first occurrence")
    void dedup() {
        int first = b.atLine(2).call("alias", b.aliases("Foo", "BAR"));
        int duplicate = b.atLine(5).call("alias", b.aliases("Foo", "Bar"));
        int other = b.atLine(3).call("alias", b.aliases("Baz"));

        assertEquals(List.of(other, first), DirectiveSorter.sort(tree, List.of(first, duplicate, other)));
    }

    @Test
    @DisplayName("Sorting uses the whole statement")
    void wholeStatement() {
        int renamed = b.call("alias", b.aliases("Foo", "Bar"), b.keyword("as", b.aliases("Baz")));
        int plain = b.call("alias", b.aliases("Foo", "Bar"));

        assertEquals(List.of(plain, renamed), DirectiveSorter.sort(tree, List.of(renamed, plain)));
    }
}
