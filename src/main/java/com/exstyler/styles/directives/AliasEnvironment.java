package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import com.exstyler.ast.TreeFold;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Short names bound by {@code alias} statements, accumulated in reading order.
 * Each binding maps to the fully expanded segment list, where {@code __MODULE__}
 * stands for the enclosing module.
 */
public class AliasEnvironment {
    private final Map<String, List<String>> bindings = new LinkedHashMap<>();

    /**
     * Environment built from a sequence of alias statements.
     */
    public static AliasEnvironment of(SyntaxTree tree, List<Integer> aliases) {
        AliasEnvironment env = new AliasEnvironment();
        for (int alias : aliases) {
            env.define(tree, alias);
        }
        return env;
    }

    /**
     * Records the binding introduced by {@code alias X.Y} or {@code alias X.Y, as: Z}.
     * Any other shape leaves the environment unchanged.
     */
    public void define(SyntaxTree tree, int directive) {
        String shortName = boundName(tree, directive);
        if (shortName == null) {
            return;
        }
        bindings.put(shortName, _resolve(staticSegments(tree, tree.child(directive, 0))));
    }

    /**
     * Rewrites every dotted reference under {@code node} whose first segment is a bound
     * short name to its full form. Returns {@code node} itself when nothing matched.
     */
    public int expand(SyntaxTree tree, int node) {
        if (bindings.isEmpty()) {
            return node;
        }
        return TreeFold.rewrite(tree, node, id -> {
            if (!tree.is(id, NodeKind.ALIASES) || tree.childCount(id) == 0) {
                return id;
            }
            int first = tree.child(id, 0);
            if (!tree.is(first, NodeKind.NAME) || !bindings.containsKey(tree.value(first))) {
                return id;
            }
            TreeBuilder builder = new TreeBuilder(tree).atLine(tree.line(id));
            List<Integer> segments = new ArrayList<>();
            for (String segment : bindings.get(tree.value(first))) {
                segments.add(TreeBuilder.MODULE_SELF.equals(segment) ? builder.moduleSelf() : builder.name(segment));
            }
            List<Integer> children = tree.children(id);
            segments.addAll(children.subList(1, children.size()));
            return tree.add(NodeKind.ALIASES, null, tree.line(id), segments);
        });
    }

    public boolean binds(String shortName) {
        return bindings.containsKey(shortName);
    }

    public Optional<List<String>> resolve(String shortName) {
        return Optional.ofNullable(bindings.get(shortName));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    /**
     * Segment names of a dotted reference made only of static names and
     * {@code __MODULE__}, or {@code null} for anything else.
     */
    static List<String> staticSegments(SyntaxTree tree, int node) {
        if (!tree.is(node, NodeKind.ALIASES) || tree.childCount(node) == 0) {
            return null;
        }
        List<String> segments = new ArrayList<>();
        for (int segment : tree.children(node)) {
            if (!tree.is(segment, NodeKind.NAME) && !tree.is(segment, NodeKind.MODULE_SELF)) {
                return null;
            }
            segments.add(tree.value(segment));
        }
        return segments;
    }

    /**
     * Short name bound by {@code alias X.Y} or {@code alias X.Y, as: Z}, or {@code null}
     * when the statement binds nothing this environment can track.
     */
    static String boundName(SyntaxTree tree, int directive) {
        if (!tree.is(directive, NodeKind.CALL, "alias") || tree.childCount(directive) == 0) {
            return null;
        }
        List<String> segments = staticSegments(tree, tree.child(directive, 0));
        if (segments == null) {
            return null;
        }

        String shortName;
        if (tree.childCount(directive) == 1) {
            shortName = segments.get(segments.size() - 1);
        } else if (tree.childCount(directive) == 2) {
            shortName = _renameTarget(tree, tree.child(directive, 1));
        } else {
            return null;
        }
        return shortName == null || TreeBuilder.MODULE_SELF.equals(shortName) ? null : shortName;
    }

    private List<String> _resolve(List<String> segments) {
        List<String> bound = bindings.get(segments.get(0));
        if (bound == null) {
            return List.copyOf(segments);
        }
        List<String> resolved = new ArrayList<>(bound);
        resolved.addAll(segments.subList(1, segments.size()));
        return List.copyOf(resolved);
    }

    // as: Name
    private static String _renameTarget(SyntaxTree tree, int option) {
        if (!tree.is(option, NodeKind.KEYWORD, "as") || tree.childCount(option) != 1) {
            return null;
        }
        List<String> target = staticSegments(tree, tree.child(option, 0));
        return target != null && target.size() == 1 ? target.get(0) : null;
    }
}
