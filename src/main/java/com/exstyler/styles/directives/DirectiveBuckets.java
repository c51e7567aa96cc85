package com.exstyler.styles.directives;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A body split into one list per directive kind plus the remaining statements, all
 * in the order they were added.
 */
public class DirectiveBuckets {
    private final Map<DirectiveKind, List<Integer>> directives = new EnumMap<>(DirectiveKind.class);
    private List<Integer> nondirectives = new ArrayList<>();

    public DirectiveBuckets() {
        for (DirectiveKind kind : DirectiveKind.values()) {
            directives.put(kind, new ArrayList<>());
        }
    }

    public void add(DirectiveKind kind, int directive) {
        directives.get(kind).add(directive);
    }

    public List<Integer> get(DirectiveKind kind) {
        return Collections.unmodifiableList(directives.get(kind));
    }

    public void set(DirectiveKind kind, List<Integer> replacement) {
        directives.put(kind, new ArrayList<>(replacement));
    }

    public void addNonDirective(int statement) {
        nondirectives.add(statement);
    }

    public List<Integer> getNonDirectives() {
        return Collections.unmodifiableList(nondirectives);
    }

    public void setNonDirectives(List<Integer> replacement) {
        nondirectives = new ArrayList<>(replacement);
    }

    /**
     * All directives, category by category in layout order.
     */
    public List<Integer> directives() {
        List<Integer> all = new ArrayList<>();
        for (DirectiveKind kind : DirectiveKind.values()) {
            all.addAll(directives.get(kind));
        }
        return all;
    }
}
