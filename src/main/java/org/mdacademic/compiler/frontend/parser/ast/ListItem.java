package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One item of a {@link ListBlock}.
 *
 * @param blocks The item content.
 * @param checked For task list items, whether the box is ticked; null for plain items.
 */
public record ListItem(List<Block> blocks, Boolean checked) implements AstNode {

    public ListItem {
        blocks = List.copyOf(blocks);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(blocks);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ListItem(AstNode.narrow(newChildren, Block.class), checked);
    }
}
