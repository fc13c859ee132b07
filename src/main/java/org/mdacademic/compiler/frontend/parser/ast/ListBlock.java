package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered or unordered list.
 *
 * @param ordered Whether items are numbered.
 * @param start The number of the first item of an ordered list; null for unordered lists.
 * @param items The items.
 */
public record ListBlock(boolean ordered, Integer start, List<ListItem> items) implements Block {

    public ListBlock {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(items);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ListBlock(ordered, start, AstNode.narrow(newChildren, ListItem.class));
    }
}
