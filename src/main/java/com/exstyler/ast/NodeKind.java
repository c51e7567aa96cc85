package com.exstyler.ast;

/**
 * The shapes a {@link SyntaxTree} node can take.
 */
public enum NodeKind {
    BLOCK,          // statement sequence, value "do:" for a keyword-form body
    MODULE,         // defmodule/defprotocol/defimpl: [name, body]
    ALIASES,        // dotted reference, children are segments
    NAME,           // static alias segment
    MODULE_SELF,    // __MODULE__
    MULTI,          // Root.{A, B}: [root, targets...]
    ATTRIBUTE,      // @name or @name value
    CALL,           // name(args...)
    REMOTE_CALL,    // target.name(args...): [target, args...]
    KEYWORD,        // key: value
    VARIABLE,
    LITERAL,        // verbatim text: numbers, atoms, booleans, lists
    STRING,
    MATCH,          // left = right
    OPERATOR,       // left op right
    DEF,            // def/defp/defmacro: [head, body]
    QUOTE           // quote do ... end: [body]
}
