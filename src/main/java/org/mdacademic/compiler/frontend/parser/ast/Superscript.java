package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Superscript text, written {@code ^text^}.
 *
 * @param content The nested inlines.
 */
public record Superscript(List<Inline> content) implements Inline {

    public Superscript {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Superscript(AstNode.narrow(newChildren, Inline.class));
    }
}
