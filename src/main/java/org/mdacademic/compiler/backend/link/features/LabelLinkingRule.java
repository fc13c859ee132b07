package org.mdacademic.compiler.backend.link.features;

import org.mdacademic.compiler.backend.link.ILinkingRule;
import org.mdacademic.compiler.backend.link.LinkingContext;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Reference;

import java.util.Optional;

/**
 * Resolves a reference to a label defined in the document to the label's display text.
 */
public class LabelLinkingRule implements ILinkingRule {

    @Override
    public Optional<Inline> apply(Reference reference, LinkingContext context) {
        return context.labels().resolve(reference.label())
                .map(info -> reference.withResolved(info.displayText()));
    }
}
