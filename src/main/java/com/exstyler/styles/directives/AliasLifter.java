package com.exstyler.styles.directives;

import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import com.exstyler.core.StyleContext;
import com.exstyler.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Introduces aliases for fully qualified module references repeated in a module body,
 * when the short name cannot be confused with anything else the body refers to.
 *
 * <p>Quoted regions and nested module definitions are neither counted nor rewritten.
 */
public class AliasLifter {
    private static final Logger logger = LoggerUtil.getLogger(AliasLifter.class);

    public static final int MIN_CHAIN_LENGTH = 3;
    public static final int MIN_OCCURRENCES = 2;

    private final SyntaxTree tree;
    private final Set<String> excluded;
    private final Set<String> standardLibrary;

    /**
     * What a lifting pass changed.
     */
    public static final class Result {
        private final List<LiftCandidate> lifted;
        private final List<String> shortened;

        private Result(List<LiftCandidate> lifted, List<String> shortened) {
            this.lifted = Collections.unmodifiableList(lifted);
            this.shortened = Collections.unmodifiableList(shortened);
        }

        /**
         * Chains that got a new alias.
         */
        public List<LiftCandidate> getLifted() {
            return lifted;
        }

        /**
         * Chains spelled out in full although an alias for them already existed.
         */
        public List<String> getShortened() {
            return shortened;
        }

        public boolean isEmpty() {
            return lifted.isEmpty() && shortened.isEmpty();
        }
    }

    // references found in one body
    private static final class Scan {
        final Map<String, LiftCandidate> chains = new LinkedHashMap<>();
        final Set<String> leadingNames = new HashSet<>();
        // chains with an occurrence where a local alias gives their short name another meaning
        final Set<String> shadowed = new HashSet<>();
    }

    public AliasLifter(SyntaxTree tree, StyleContext context) {
        this.tree = tree;
        this.excluded = context.getAliasLiftingExclude();
        this.standardLibrary = context.getStandardLibraryModules();
    }

    /**
     * Rewrites the alias, require and non-directive parts of {@code buckets}.
     *
     * @param namespaceRoot first segment of the outermost enclosing module's name;
     *                      chains starting with it are left alone. May be null.
     */
    public Result lift(DirectiveBuckets buckets, String namespaceRoot) {
        AliasEnvironment env = AliasEnvironment.of(tree, buckets.get(DirectiveKind.ALIAS));

        Scan scan = new Scan();
        // `alias C.Helper` would resolve through a new `alias A.B.C`
        for (int alias : buckets.get(DirectiveKind.ALIAS)) {
            _recordAliasHead(alias, scan);
        }
        for (int require : buckets.get(DirectiveKind.REQUIRE)) {
            _scan(require, scan);
        }
        for (int statement : buckets.getNonDirectives()) {
            _scan(statement, scan);
        }
        Set<String> submodules = _submoduleNames(buckets.getNonDirectives());

        Map<String, String> replacements = new LinkedHashMap<>();
        List<String> shortened = new ArrayList<>();
        List<LiftCandidate> lifted = new ArrayList<>();

        for (Map.Entry<String, LiftCandidate> entry : scan.chains.entrySet()) {
            LiftCandidate candidate = entry.getValue();
            if (scan.shadowed.contains(entry.getKey())) {
                continue;
            }
            String shortName = candidate.getShortName();
            boolean declared = env.resolve(shortName).map(candidate.getChain()::equals).orElse(false);
            if (declared) {
                replacements.put(entry.getKey(), shortName);
                shortened.add(entry.getKey());
            } else if (_isLiftable(candidate, scan, env, submodules, namespaceRoot)) {
                replacements.put(entry.getKey(), shortName);
                lifted.add(candidate);
            }
        }

        if (replacements.isEmpty()) {
            return new Result(lifted, shortened);
        }

        Set<String> liftedChains = lifted.stream().map(LiftCandidate::dotted).collect(Collectors.toSet());

        List<Integer> aliases = new ArrayList<>(buckets.get(DirectiveKind.ALIAS));
        TreeBuilder builder = new TreeBuilder(tree).atLine(LayoutAssembler.LAST_LINE);
        for (LiftCandidate candidate : lifted) {
            aliases.add(builder.call("alias", builder.aliases(candidate.getChain().toArray(new String[0]))));
            logger.fine("Lifting alias " + candidate);
        }
        buckets.set(DirectiveKind.ALIAS, DirectiveSorter.sort(tree, aliases));

        List<Integer> requires = new ArrayList<>();
        for (int require : buckets.get(DirectiveKind.REQUIRE)) {
            requires.add(_rewrite(require, replacements, liftedChains));
        }
        buckets.set(DirectiveKind.REQUIRE, DirectiveSorter.sort(tree, requires));

        List<Integer> nondirectives = new ArrayList<>();
        for (int statement : buckets.getNonDirectives()) {
            nondirectives.add(_rewrite(statement, replacements, liftedChains));
        }
        buckets.setNonDirectives(nondirectives);

        return new Result(lifted, shortened);
    }

    private boolean _isLiftable(LiftCandidate candidate, Scan scan, AliasEnvironment env,
                                Set<String> submodules, String namespaceRoot) {
        if (candidate.getOccurrences() < MIN_OCCURRENCES) {
            return false;
        }
        String first = candidate.getChain().get(0);
        String shortName = candidate.getShortName();

        // already reachable through an alias, or inside the module's own namespace
        if (env.binds(first) || first.equals(namespaceRoot)) {
            return false;
        }

        if (excluded.contains(shortName)
                || standardLibrary.contains(shortName)
                || env.binds(shortName)
                || submodules.contains(shortName)
                || scan.leadingNames.contains(shortName)
                || shortName.equals(namespaceRoot)) {
            return false;
        }

        for (LiftCandidate other : scan.chains.values()) {
            if (other != candidate && other.getShortName().equals(shortName)) {
                return false;
            }
        }
        return true;
    }

    private void _scan(int node, Scan scan) {
        _scan(node, scan, Map.of());
    }

    /**
     * @param local aliases declared by enclosing blocks, e.g. {@code alias A.B.C} or
     *              {@code alias Q.R, as: C} inside a function
     */
    private void _scan(int node, Scan scan, Map<String, List<String>> local) {
        switch (tree.kind(node)) {
            case QUOTE, MODULE -> {
                // separate scope
            }
            case ALIASES -> _record(node, scan, local);
            case BLOCK -> {
                Map<String, List<String>> scope = new HashMap<>(local);
                for (int statement : tree.children(node)) {
                    _scan(statement, scan, scope);
                    String bound = AliasEnvironment.boundName(tree, statement);
                    if (bound != null) {
                        // null marks a binding whose target cannot be expanded
                        scope.put(bound, _chain(tree.child(statement, 0)));
                    }
                }
            }
            default -> {
                for (int child : tree.children(node)) {
                    _scan(child, scan, local);
                }
            }
        }
    }

    private void _record(int reference, Scan scan, Map<String, List<String>> local) {
        List<String> chain = _chain(reference);
        String head = tree.childCount(reference) > 0 && tree.is(tree.child(reference, 0), NodeKind.NAME)
                ? tree.value(tree.child(reference, 0))
                : null;

        if (head != null && local.containsKey(head)) {
            List<String> bound = local.get(head);
            if (chain == null || bound == null || !head.equals(bound.get(bound.size() - 1))) {
                // renamed locally, e.g. `alias Q.R, as: C`
                scan.leadingNames.add(head);
                return;
            }
            List<String> expanded = new ArrayList<>(bound);
            expanded.addAll(chain.subList(1, chain.size()));
            chain = expanded;
        } else if (head != null) {
            scan.leadingNames.add(head);
        }

        if (chain != null && chain.size() >= MIN_CHAIN_LENGTH) {
            List<String> counted = chain;
            String key = String.join(".", counted);
            scan.chains.computeIfAbsent(key, k -> new LiftCandidate(counted)).countOccurrence();

            String shortName = counted.get(counted.size() - 1);
            if (local.containsKey(shortName) && !counted.equals(local.get(shortName))) {
                scan.shadowed.add(key);
            }
        }
    }

    private void _recordAliasHead(int alias, Scan scan) {
        if (tree.childCount(alias) == 0) {
            return;
        }
        int target = tree.child(alias, 0);
        if (tree.is(target, NodeKind.ALIASES) && tree.childCount(target) > 0
                && tree.is(tree.child(target, 0), NodeKind.NAME)) {
            scan.leadingNames.add(tree.value(tree.child(target, 0)));
        }
    }

    // alias A.B.C as a statement
    private List<String> _localAlias(int statement) {
        if (!tree.is(statement, NodeKind.CALL, "alias") || tree.childCount(statement) != 1) {
            return null;
        }
        List<String> chain = _chain(tree.child(statement, 0));
        return chain != null && chain.size() > 1 ? chain : null;
    }

    /**
     * First and last name segments of modules defined directly in the body.
     */
    private Set<String> _submoduleNames(List<Integer> statements) {
        Set<String> names = new HashSet<>();
        for (int statement : statements) {
            if (!tree.is(statement, NodeKind.MODULE)) {
                continue;
            }
            int name = tree.child(statement, 0);
            if (!tree.is(name, NodeKind.ALIASES)) {
                continue;
            }
            for (int segment : tree.children(name)) {
                if (tree.is(segment, NodeKind.NAME)) {
                    names.add(tree.value(segment));
                }
            }
        }
        return names;
    }

    private int _rewrite(int node, Map<String, String> replacements, Set<String> liftedChains) {
        NodeKind kind = tree.kind(node);
        if (kind == NodeKind.QUOTE || kind == NodeKind.MODULE || tree.is(node, NodeKind.CALL, "alias")) {
            return node;
        }
        if (kind == NodeKind.ALIASES) {
            List<String> chain = _chain(node);
            String shortName = chain == null ? null : replacements.get(String.join(".", chain));
            if (shortName == null) {
                return node;
            }
            return new TreeBuilder(tree).atLine(tree.line(node)).aliases(shortName);
        }

        boolean block = tree.is(node, NodeKind.BLOCK);
        List<Integer> children = tree.children(node);
        List<Integer> rewritten = new ArrayList<>(children.size());
        boolean changed = false;
        for (int child : children) {
            if (block && _isLiftedAlias(child, liftedChains)) {
                changed = true;
                continue;
            }
            int replacement = _rewrite(child, replacements, liftedChains);
            rewritten.add(replacement);
            changed |= replacement != child;
        }
        return changed ? tree.withChildren(node, rewritten) : node;
    }

    // alias A.B.C inside a function body, made redundant by the lifted alias
    private boolean _isLiftedAlias(int statement, Set<String> liftedChains) {
        List<String> chain = _localAlias(statement);
        return chain != null && liftedChains.contains(String.join(".", chain));
    }

    /**
     * Segments of a reference made of static names only, or {@code null}.
     */
    private List<String> _chain(int reference) {
        if (!tree.is(reference, NodeKind.ALIASES) || tree.childCount(reference) == 0) {
            return null;
        }
        List<String> chain = new ArrayList<>();
        for (int segment : tree.children(reference)) {
            if (!tree.is(segment, NodeKind.NAME)) {
                return null;
            }
            chain.add(tree.value(segment));
        }
        return chain;
    }
}
