package com.exstyler.ast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceRendererTest {
    private SyntaxTree tree;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        tree = new SyntaxTree();
        b = new TreeBuilder(tree);
    }

    @Test
    @DisplayName("Directives render without parentheses")
    void directives() {
        assertEquals("alias Foo.Bar, as: Baz",
                tree.render(b.call("alias", b.aliases("Foo", "Bar"), b.keyword("as", b.aliases("Baz")))));
        assertEquals("use __MODULE__.Helpers", tree.render(b.call("use", b.aliases("__MODULE__", "Helpers"))));
        assertEquals("import Foo.{Bar, Baz}",
                tree.render(b.call("import", b.multi(b.aliases("Foo"), b.aliases("Bar"), b.aliases("Baz")))));
    }

    @Test
    @DisplayName("Other calls render with parentheses")
    void calls() {
        assertEquals("run()", tree.render(b.call("run")));
        assertEquals("unquote(opts)", tree.render(b.call("unquote", b.variable("opts"))));
        assertEquals("A.B.C.f(1, x)", tree.render(b.remoteCall(b.aliases("A", "B", "C"), "f", b.literal("1"), b.variable("x"))));
        assertEquals("foo |> Baz.Boom.bop()",
                tree.render(b.operator("|>", b.variable("foo"), b.remoteCall(b.aliases("Baz", "Boom"), "bop"))));
    }

    @Test
    @DisplayName("Attributes, strings and matches")
    void expressions() {
        assertEquals("@moduledoc false", tree.render(b.attribute("moduledoc", b.literal("false"))));
        assertEquals("@opts", tree.render(b.attribute("opts")));
        assertEquals("\"say \\\"hi\\\"\"", tree.render(b.string("say \"hi\"")));
        assertEquals("opts = [a: 1]", tree.render(b.match(b.variable("opts"), b.literal("[a: 1]"))));
    }

    @Test
    @DisplayName("Bodies are indented two spaces per level")
    void bodies() {
        int module = b.module(b.aliases("Foo"), b.block(
                b.attribute("moduledoc", b.literal("false")),
                b.def("def", b.call("run"), b.block(b.quote(b.block(b.literal(":ok")))))));

        String expected = String.join("\n",
                "defmodule Foo do",
                "  @moduledoc false",
                "  def run() do",
                "    quote do",
                "      :ok",
                "    end",
                "  end",
                "end");
        assertEquals(expected, tree.render(module));
    }

    @Test
    @DisplayName("Empty and keyword bodies")
    void specialBodies() {
        assertEquals("defmodule Foo do\nend", tree.render(b.module(b.aliases("Foo"), b.block())));
        assertEquals("defmodule Foo, do: run()", tree.render(b.keywordModule(b.aliases("Foo"), b.call("run"))));
    }
}
