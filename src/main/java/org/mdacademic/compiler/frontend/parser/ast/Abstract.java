package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The document abstract, written as a {@code ::: abstract} fence.
 *
 * @param blocks The nested blocks.
 */
public record Abstract(List<Block> blocks) implements Block {

    public Abstract {
        blocks = List.copyOf(blocks);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(blocks);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Abstract(AstNode.narrow(newChildren, Block.class));
    }
}
