package org.mdacademic.compiler.backend.link;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.TreeWalker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Linking pass: fills in the display text of every {@code @label} reference.
 * <p>
 * A reference no rule can resolve is rendered as {@code ??label} and reported as
 * {@link CompilerErrorCode#UNKNOWN_REFERENCE}, as an error in strict mode and as a warning otherwise.
 */
public final class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private final LinkingRegistry registry;
    private final DiagnosticsEngine diagnostics;
    private final boolean strict;

    /**
     * Constructs a new reference resolver.
     * @param registry The registry of linking rules to apply.
     * @param diagnostics The engine for reporting unknown references.
     * @param strict Whether unknown references are errors.
     */
    public ReferenceResolver(LinkingRegistry registry, DiagnosticsEngine diagnostics, boolean strict) {
        this.registry = registry;
        this.diagnostics = diagnostics;
        this.strict = strict;
    }

    /**
     * Resolves all references in the document.
     * @param document The document.
     * @param context The labels and bibliography to resolve against.
     * @return A document in which no reference is left unresolved.
     */
    public Document resolve(Document document, LinkingContext context) {
        return document.withBlocks(TreeWalker.transformBlocks(document.blocks(), node -> link(node, context)));
    }

    private AstNode link(AstNode node, LinkingContext context) {
        if (!(node instanceof Reference reference) || !reference.isUnresolved()) {
            return node;
        }
        for (ILinkingRule rule : registry.rules()) {
            Optional<Inline> linked = rule.apply(reference, context);
            if (linked.isPresent()) {
                return linked.get();
            }
        }
        diagnostics.report(strict, CompilerErrorCode.UNKNOWN_REFERENCE,
                "Unknown reference '@" + reference.label() + "'.", reference.label());
        LOG.debug("Unresolved @{}", reference.label());
        return reference.withResolved("??" + reference.label());
    }
}
