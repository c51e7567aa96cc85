package com.exstyler.styles.directives;

import com.exstyler.api.Refactoring;
import com.exstyler.api.Style;
import com.exstyler.api.StyleResult;
import com.exstyler.ast.NodeKind;
import com.exstyler.ast.SyntaxTree;
import com.exstyler.ast.TreeBuilder;
import com.exstyler.ast.TreeCursor;
import com.exstyler.core.StyleContext;
import com.exstyler.util.LoggerUtil;

import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Lays out module directives in a fixed order:
 *
 * <ol>
 *   <li>{@code @shortdoc}</li>
 *   <li>{@code @moduledoc} (added as {@code @moduledoc false} when missing)</li>
 *   <li>{@code @behaviour}</li>
 *   <li>{@code use}, in their original order</li>
 *   <li>{@code import}</li>
 *   <li>{@code alias}</li>
 *   <li>{@code require}</li>
 *   <li>everything else, unchanged</li>
 * </ol>
 *
 * Multi-target directives are expanded, sorted categories are deduplicated, repeated
 * deep references get an alias, and {@code @derive} is moved ahead of its struct.
 * Directive blocks inside functions and scripts are organized as well, without
 * documentation or new aliases.
 */
public class ModuleDirectivesStyle implements Style {
    private static final Logger logger = LoggerUtil.getLogger(ModuleDirectivesStyle.class);

    public static final String NAME = "module_directives";

    public static final String DIRECTIVES_ORGANIZED = "DIRECTIVES_ORGANIZED";
    public static final String MODULEDOC_ADDED = "MODULEDOC_ADDED";
    public static final String ALIAS_LIFTED = "ALIAS_LIFTED";
    public static final String ATTRIBUTE_LIFTED = "ATTRIBUTE_LIFTED";
    public static final String DERIVE_MOVED = "DERIVE_MOVED";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StyleResult run(TreeCursor cursor, StyleContext context) {
        SyntaxTree tree = cursor.tree();
        int node = cursor.node();

        if (tree.is(node, NodeKind.MODULE, "defmodule")) {
            return _styleModule(cursor, context);
        }
        if (DirectiveClassifier.isDirectiveCall(tree, node)) {
            // skips function heads like `def import(foo)` and other non-statement positions
            TreeCursor block = cursor.up();
            if (block != null && block.kind() == NodeKind.BLOCK) {
                return new DirectiveOrganizer(context).organize(block, OptionalInt.empty(), false, null);
            }
            return StyleResult.cont(cursor);
        }
        if (DeriveRelocator.isDerive(tree, node)) {
            StyleResult result = DeriveRelocator.relocate(cursor);
            if (result.isSkip()) {
                int line = tree.line(node);
                context.record(new Refactoring(DERIVE_MOVED, line, line, "Moved @derive before the struct definition"));
            }
            return result;
        }
        return StyleResult.cont(cursor);
    }

    private StyleResult _styleModule(TreeCursor module, StyleContext context) {
        SyntaxTree tree = module.tree();
        TreeCursor body = module.down(1);
        if (body == null || body.kind() != NodeKind.BLOCK || TreeBuilder.KEYWORD_BODY.equals(tree.value(body.node()))) {
            return StyleResult.skip(module);
        }

        OptionalInt moduledoc = LayoutAssembler.moduledoc(tree, module.node(), context.getModuledocSkipSuffixes());
        List<Integer> children = body.children();

        if (children.isEmpty()) {
            if (moduledoc.isPresent()) {
                body.replaceChildren(List.of(moduledoc.getAsInt()));
                int line = tree.line(moduledoc.getAsInt());
                context.record(new Refactoring(MODULEDOC_ADDED, line, line, "Added @moduledoc false"));
            }
            return StyleResult.skip(module);
        }

        DirectiveOrganizer organizer = new DirectiveOrganizer(context);
        if (children.size() == 1) {
            if (tree.is(children.get(0), NodeKind.ATTRIBUTE, "moduledoc")) {
                return StyleResult.skip(module);
            }
            if (moduledoc.isPresent()) {
                return organizer.organize(body, moduledoc, false, null);
            }
            return StyleResult.cont(body);
        }

        // a lone statement next to its @moduledoc counts as an only child
        long statements = children.stream().filter(child -> !tree.is(child, NodeKind.ATTRIBUTE, "moduledoc")).count();
        logger.fine("Organizing directives of " + tree.render(tree.child(module.node(), 0)));
        return organizer.organize(body, moduledoc, statements >= 2, _namespaceRoot(module));
    }

    /**
     * First name segment of the outermost module enclosing {@code module}.
     */
    private static String _namespaceRoot(TreeCursor module) {
        SyntaxTree tree = module.tree();
        TreeCursor outermost = module;
        TreeCursor enclosing = module.findAncestor(id -> tree.is(id, NodeKind.MODULE));
        while (enclosing != null) {
            outermost = enclosing;
            enclosing = enclosing.findAncestor(id -> tree.is(id, NodeKind.MODULE));
        }
        int name = tree.child(outermost.node(), 0);
        if (!tree.is(name, NodeKind.ALIASES) || tree.childCount(name) == 0
                || !tree.is(tree.child(name, 0), NodeKind.NAME)) {
            return null;
        }
        return tree.value(tree.child(name, 0));
    }
}
