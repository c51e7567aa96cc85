package com.exstyler.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Allocates nodes in a {@link SyntaxTree}. Every node created is stamped with the
 * builder's current line, set through {@link #atLine(int)}.
 */
public class TreeBuilder {
    public static final String MODULE_SELF = "__MODULE__";
    public static final String KEYWORD_BODY = "do:";

    private final SyntaxTree tree;
    private int line = SyntaxTree.UNKNOWN_LINE;

    public TreeBuilder(SyntaxTree tree) {
        this.tree = tree;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public TreeBuilder atLine(int line) {
        this.line = line;
        return this;
    }

    /**
     * A dotted reference; the segment {@code "__MODULE__"} becomes a module self-reference.
     */
    public int aliases(String... segments) {
        List<Integer> children = new ArrayList<>(segments.length);
        for (String segment : segments) {
            children.add(MODULE_SELF.equals(segment) ? moduleSelf() : name(segment));
        }
        return tree.add(NodeKind.ALIASES, null, line, children);
    }

    /**
     * A dotted reference whose segments are arbitrary nodes, e.g. an unquote call.
     */
    public int aliasesOf(int... segments) {
        return tree.add(NodeKind.ALIASES, null, line, _ids(segments));
    }

    public int name(String name) {
        return tree.add(NodeKind.NAME, name, line, List.of());
    }

    public int moduleSelf() {
        return tree.add(NodeKind.MODULE_SELF, MODULE_SELF, line, List.of());
    }

    public int multi(int root, int... targets) {
        List<Integer> children = new ArrayList<>();
        children.add(root);
        children.addAll(_ids(targets));
        return tree.add(NodeKind.MULTI, null, line, children);
    }

    public int attribute(String name) {
        return tree.add(NodeKind.ATTRIBUTE, name, line, List.of());
    }

    public int attribute(String name, int value) {
        return tree.add(NodeKind.ATTRIBUTE, name, line, List.of(value));
    }

    public int call(String name, int... args) {
        return tree.add(NodeKind.CALL, name, line, _ids(args));
    }

    public int call(String name, List<Integer> args) {
        return tree.add(NodeKind.CALL, name, line, args);
    }

    public int remoteCall(int target, String name, int... args) {
        List<Integer> children = new ArrayList<>();
        children.add(target);
        children.addAll(_ids(args));
        return tree.add(NodeKind.REMOTE_CALL, name, line, children);
    }

    public int keyword(String key, int value) {
        return tree.add(NodeKind.KEYWORD, key, line, List.of(value));
    }

    public int variable(String name) {
        return tree.add(NodeKind.VARIABLE, name, line, List.of());
    }

    public int literal(String text) {
        return tree.add(NodeKind.LITERAL, text, line, List.of());
    }

    public int string(String text) {
        return tree.add(NodeKind.STRING, text, line, List.of());
    }

    public int match(int left, int right) {
        return tree.add(NodeKind.MATCH, "=", line, List.of(left, right));
    }

    public int operator(String operator, int left, int right) {
        return tree.add(NodeKind.OPERATOR, operator, line, List.of(left, right));
    }

    public int block(int... statements) {
        return tree.add(NodeKind.BLOCK, null, line, _ids(statements));
    }

    public int block(List<Integer> statements) {
        return tree.add(NodeKind.BLOCK, null, line, statements);
    }

    public int module(int name, int body) {
        return tree.add(NodeKind.MODULE, "defmodule", line, List.of(name, body));
    }

    /**
     * {@code defmodule Name, do: expression}
     */
    public int keywordModule(int name, int expression) {
        int body = tree.add(NodeKind.BLOCK, KEYWORD_BODY, line, List.of(expression));
        return tree.add(NodeKind.MODULE, "defmodule", line, List.of(name, body));
    }

    public int definition(String macro, int name, int body) {
        return tree.add(NodeKind.MODULE, macro, line, List.of(name, body));
    }

    public int def(String macro, int head, int body) {
        return tree.add(NodeKind.DEF, macro, line, List.of(head, body));
    }

    public int quote(int body) {
        return tree.add(NodeKind.QUOTE, "quote", line, List.of(body));
    }

    /**
     * Makes {@code id} the tree root and returns it.
     */
    public int root(int id) {
        tree.setRoot(id);
        return id;
    }

    private static List<Integer> _ids(int... ids) {
        List<Integer> list = new ArrayList<>(ids.length);
        Arrays.stream(ids).forEach(list::add);
        return list;
    }
}
