package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A description (definition) list.
 *
 * @param items The term/definition pairs.
 */
public record DescriptionList(List<DescriptionItem> items) implements Block {

    public DescriptionList {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(items);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new DescriptionList(AstNode.narrow(newChildren, DescriptionItem.class));
    }
}
