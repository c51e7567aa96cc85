package com.exstyler.styles.directives;

import com.exstyler.api.Refactoring;
import com.exstyler.api.StyleResult;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeCursor;
import com.exstyler.core.StyleContext;
import com.exstyler.util.LoggerUtil;

import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Rewrites one block so that its directives form a sorted preamble ahead of the
 * remaining statements.
 */
class DirectiveOrganizer {
    private static final Logger logger = LoggerUtil.getLogger(DirectiveOrganizer.class);

    private final StyleContext context;

    DirectiveOrganizer(StyleContext context) {
        this.context = context;
    }

    /**
     * @param block         cursor on the block to organize
     * @param moduledoc     documentation to add when the block has none
     * @param liftAliases   whether to introduce aliases for repeated references
     * @param namespaceRoot first segment of the outermost module name, or null
     * @return where traversal resumes: past the preamble, or into the block when no
     *         directive is left
     */
    StyleResult organize(TreeCursor block, OptionalInt moduledoc, boolean liftAliases, String namespaceRoot) {
        SyntaxTree tree = block.tree();
        List<Integer> statements = block.children();
        String before = tree.render(block.node());

        ModuleAttributeLifter attributes = new ModuleAttributeLifter(tree, statements, !block.isRoot());
        AliasEnvironment env = new AliasEnvironment();
        DirectiveBuckets buckets = new DirectiveBuckets();

        for (int statement : statements) {
            DirectiveClassifier.Classification classification = DirectiveClassifier.classify(tree, statement);
            switch (classification.getCategory()) {
                case DIRECTIVE -> {
                    DirectiveKind kind = classification.getKind();
                    if (kind.isAttribute()) {
                        // hoisted above the aliases, so resolve against the aliases seen so far
                        int expanded = env.expand(tree, statement);
                        buckets.add(kind, attributes.liftReferences(expanded, false));
                    } else {
                        int lifted = attributes.liftReferences(statement, kind == DirectiveKind.USE);
                        for (int directive : MultiTargetExpander.expand(tree, lifted)) {
                            if (kind == DirectiveKind.IMPORT || kind == DirectiveKind.USE) {
                                directive = env.expand(tree, directive);
                            } else if (kind == DirectiveKind.ALIAS) {
                                env.define(tree, directive);
                            }
                            buckets.add(kind, directive);
                        }
                    }
                }
                case ATTRIBUTE_ASSIGNMENT -> {
                    buckets.addNonDirective(statement);
                    attributes.recordAssignment(classification.getAttribute());
                }
                default -> buckets.addNonDirective(statement);
            }
        }

        boolean addedModuledoc = false;
        if (buckets.get(DirectiveKind.MODULEDOC).isEmpty() && moduledoc.isPresent()) {
            buckets.add(DirectiveKind.MODULEDOC, moduledoc.getAsInt());
            addedModuledoc = true;
        }

        for (DirectiveKind kind : DirectiveKind.values()) {
            if (kind.isSorted()) {
                buckets.set(kind, DirectiveSorter.sort(tree, buckets.get(kind)));
            }
        }

        TreeCursor target = block;
        if (attributes.hasLifts()) {
            buckets.setNonDirectives(attributes.rewriteAssignments(buckets.getNonDirectives()));
            target = ModuleAttributeLifter.promote(block, attributes.getBindings());
            logger.fine("Lifted module attributes " + attributes.getLifted() + " out of hoisted directives");
            context.record(new Refactoring(ModuleDirectivesStyle.ATTRIBUTE_LIFTED,
                    tree.line(block.node()), tree.line(block.node()),
                    "Bound " + String.join(", ", attributes.getLifted()) + " before the module"));
        }

        if (liftAliases) {
            AliasLifter.Result result = new AliasLifter(tree, context).lift(buckets, namespaceRoot);
            for (LiftCandidate candidate : result.getLifted()) {
                context.record(new Refactoring(ModuleDirectivesStyle.ALIAS_LIFTED,
                        tree.line(block.node()), tree.line(block.node()),
                        "Aliased " + candidate.dotted() + " (" + candidate.getOccurrences() + " references)"));
            }
            for (String chain : result.getShortened()) {
                context.record(new Refactoring(ModuleDirectivesStyle.ALIAS_LIFTED,
                        tree.line(block.node()), tree.line(block.node()),
                        "Shortened " + chain + " to its existing alias"));
            }
        }

        List<Integer> directives = buckets.directives();
        List<Integer> nondirectives = buckets.getNonDirectives();
        LayoutAssembler.fixLineNumbers(tree, directives, nondirectives.isEmpty() ? -1 : nondirectives.get(0));

        StyleResult result;
        if (directives.isEmpty()) {
            result = StyleResult.cont(target.replaceChildren(nondirectives));
        } else {
            TreeCursor last = target.replaceChildren(directives).down().rightmost();
            result = StyleResult.skip(last.insertSiblingsAfter(nondirectives));
        }

        if (addedModuledoc) {
            int line = tree.line(moduledoc.getAsInt());
            context.record(new Refactoring(ModuleDirectivesStyle.MODULEDOC_ADDED, line, line,
                    "Added @moduledoc false"));
        }
        if (!before.equals(tree.render(target.node()))) {
            context.record(new Refactoring(ModuleDirectivesStyle.DIRECTIVES_ORGANIZED,
                    _firstLine(tree, directives), _lastLine(tree, directives),
                    "Organized " + directives.size() + " directives"));
        }
        return result;
    }

    private static int _firstLine(SyntaxTree tree, List<Integer> directives) {
        return directives.isEmpty() ? SyntaxTree.UNKNOWN_LINE : tree.line(directives.get(0));
    }

    private static int _lastLine(SyntaxTree tree, List<Integer> directives) {
        return directives.isEmpty() ? SyntaxTree.UNKNOWN_LINE : tree.line(directives.get(directives.size() - 1));
    }
}
