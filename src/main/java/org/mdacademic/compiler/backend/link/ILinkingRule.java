package org.mdacademic.compiler.backend.link;

import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Reference;

import java.util.Optional;

/**
 * Linking rule that can resolve a bare {@code @label} reference.
 */
public interface ILinkingRule {

    /**
     * Attempts to resolve a reference.
     *
     * @param reference The unresolved reference.
     * @param context   The labels and bibliography known to the document.
     * @return The replacement node, or empty if this rule does not apply.
     */
    Optional<Inline> apply(Reference reference, LinkingContext context);
}
