package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Strong (bold) text.
 *
 * @param content The nested inlines.
 */
public record Strong(List<Inline> content) implements Inline {

    public Strong {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Strong(AstNode.narrow(newChildren, Inline.class));
    }
}
