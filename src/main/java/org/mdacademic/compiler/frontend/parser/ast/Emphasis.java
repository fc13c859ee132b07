package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Emphasized (italic) text.
 *
 * @param content The nested inlines.
 */
public record Emphasis(List<Inline> content) implements Inline {

    public Emphasis {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Emphasis(AstNode.narrow(newChildren, Inline.class));
    }
}
