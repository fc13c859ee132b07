package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscript text, written {@code ~text~}.
 *
 * @param content The nested inlines.
 */
public record Subscript(List<Inline> content) implements Inline {

    public Subscript {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Subscript(AstNode.narrow(newChildren, Inline.class));
    }
}
