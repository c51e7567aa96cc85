package com.exstyler.core;

import com.exstyler.api.Refactoring;
import com.exstyler.api.Style;
import com.exstyler.api.StyleReport;
import com.exstyler.api.StyleResult;
import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import com.exstyler.ast.TreeCursor;
import com.exstyler.config.ConfigurationLoader;
import com.exstyler.config.StylerConfig;
import com.exstyler.styles.directives.ModuleDirectivesStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StylerTest {
    private StylerConfig config;
    private SyntaxTree tree;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        config = ConfigurationLoader.loadDefaultConfig();
        tree = new SyntaxTree();
        b = new TreeBuilder(tree);
    }

    private int _module(String name, int... statements) {
        return b.module(b.aliases(name), b.block(statements));
    }

    @Test
    @DisplayName("Refactorings carry their type, lines and a description")
    void refactoringDetails() {
        b.atLine(3);
        b.root(_module("Foo"));

        StyleReport report = new Styler(config).style(tree);

        assertEquals(1, report.getAppliedRefactorings().size());
        Refactoring added = report.getAppliedRefactorings().get(0);
        assertEquals(ModuleDirectivesStyle.MODULEDOC_ADDED, added.getType());
        assertEquals(4, added.getStartLine());
        assertEquals(4, added.getEndLine());
        assertEquals("Added @moduledoc false", added.getDescription());
    }

    @Test
    @DisplayName("Styling reports the rewrites and a second run changes nothing")
    void reportsAndSettles() {
        b.root(_module("Foo",
                b.call("alias", b.aliases("Zed")),
                b.call("alias", b.aliases("Foo", "Bar")),
                b.def("def", b.call("run"), b.block(b.literal(":ok")))));
        Styler styler = new Styler(config);

        StyleReport first = styler.style(tree);
        StyleReport second = styler.style(tree);

        assertTrue(first.isChanged());
        assertTrue(first.hasRefactoring(ModuleDirectivesStyle.MODULEDOC_ADDED));
        assertTrue(first.hasRefactoring(ModuleDirectivesStyle.DIRECTIVES_ORGANIZED));
        assertEquals(tree.render(), first.getStyledCode());
        assertFalse(second.isChanged());
        assertTrue(second.getAppliedRefactorings().isEmpty());
        assertEquals(2, styler.getProcessedTreeCount());
        assertEquals(1, styler.getChangedTreeCount());
    }

    @Test
    @DisplayName("A failing style leaves the tree as it was")
    void failingStyle() {
        b.root(_module("Foo", b.literal("1"), b.literal("2")));
        String before = tree.render();
        Style broken = new Style() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public StyleResult run(TreeCursor cursor, StyleContext context) {
                if (cursor.kind() == NodeKind.LITERAL) {
                    cursor.up().replaceChildren(List.of());
                    throw new IllegalStateException("boom");
                }
                return StyleResult.cont(cursor);
            }
        };
        Styler styler = new Styler(config, List.of(broken, new ModuleDirectivesStyle()));

        StyleReport report = styler.style(tree);

        assertEquals(List.of("broken"), report.getFailedStyles());
        assertEquals(1, styler.getFailureCount());
        assertTrue(report.isChanged());
        assertTrue(tree.render().startsWith("defmodule Foo do\n  @moduledoc false\n  1\n  2"), tree.render());
        assertNotEquals(before, tree.render());
    }

    @Test
    @DisplayName("Styles see every node unless they skip")
    void traversalControl() {
        b.root(b.block(
                b.call("f", b.variable("a")),
                b.call("skip_me", b.variable("b")),
                b.variable("c")));
        List<String> seen = new ArrayList<>();
        Style recorder = new Style() {
            @Override
            public String name() {
                return "recorder";
            }

            @Override
            public StyleResult run(TreeCursor cursor, StyleContext context) {
                SyntaxTree t = cursor.tree();
                if (t.value(cursor.node()) != null) {
                    seen.add(t.value(cursor.node()));
                }
                return t.is(cursor.node(), NodeKind.CALL, "skip_me") ? StyleResult.skip(cursor) : StyleResult.cont(cursor);
            }
        };

        new Styler(config, List.of(recorder)).style(tree);

        assertEquals(List.of("f", "a", "skip_me", "c"), seen);
    }

    @Test
    @DisplayName("Styling one module leaves its siblings alone")
    void styleModule() {
        int first = _module("First", b.literal("1"), b.literal("2"));
        int second = _module("Second", b.literal("1"), b.literal("2"));
        b.root(b.block(first, second));
        Styler styler = new Styler(config);

        StyleReport report = styler.styleModule(TreeCursor.root(tree).down(1));

        assertTrue(report.isChanged());
        assertEquals(String.join("\n",
                "defmodule First do",
                "  1",
                "  2",
                "end",
                "defmodule Second do",
                "  @moduledoc false",
                "  1",
                "  2",
                "end"), tree.render());
    }

    @Test
    @DisplayName("styleModule requires a cursor on a module")
    void styleModuleRejectsOtherNodes() {
        b.root(b.block(b.literal("1")));

        assertThrows(IllegalArgumentException.class,
                () -> new Styler(config).styleModule(TreeCursor.root(tree)));
    }
}
