package org.mdacademic.compiler.backend.link.features;

import org.mdacademic.compiler.backend.link.ILinkingRule;
import org.mdacademic.compiler.backend.link.LinkingContext;
import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.CitationStyle;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Reference;

import java.util.List;
import java.util.Optional;

/**
 * Turns a bare {@code @key} that names a bibliography entry, not a label, into a textual citation.
 */
public class BibliographyLinkingRule implements ILinkingRule {

    @Override
    public Optional<Inline> apply(Reference reference, LinkingContext context) {
        if (!context.bibliography().containsKey(reference.label())) {
            return Optional.empty();
        }
        return Optional.of(new Citation(List.of(reference.label()), CitationStyle.TEXTUAL, null, null));
    }
}
