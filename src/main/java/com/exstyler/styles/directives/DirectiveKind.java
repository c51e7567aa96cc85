package com.exstyler.styles.directives;

import java.util.Optional;

/**
 * Preamble categories, declared in the order they are laid out in a module body.
 */
public enum DirectiveKind {
    SHORTDOC("shortdoc", true, false),
    MODULEDOC("moduledoc", true, false),
    BEHAVIOUR("behaviour", true, true),
    USE("use", false, false),       // order carries side effects, never sorted
    IMPORT("import", false, true),
    ALIAS("alias", false, true),
    REQUIRE("require", false, true);

    private final String keyword;
    private final boolean attribute;
    private final boolean sorted;

    DirectiveKind(String keyword, boolean attribute, boolean sorted) {
        this.keyword = keyword;
        this.attribute = attribute;
        this.sorted = sorted;
    }

    /**
     * Attribute name or call name that introduces the directive.
     */
    public String keyword() {
        return keyword;
    }

    public boolean isAttribute() {
        return attribute;
    }

    public boolean isSorted() {
        return sorted;
    }

    public static Optional<DirectiveKind> forAttribute(String name) {
        return _lookup(name, true);
    }

    public static Optional<DirectiveKind> forCall(String name) {
        return _lookup(name, false);
    }

    private static Optional<DirectiveKind> _lookup(String name, boolean attribute) {
        for (DirectiveKind kind : values()) {
            if (kind.attribute == attribute && kind.keyword.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
