package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A block quote; its lines are re-parsed as blocks with the {@code >} prefix removed.
 *
 * @param blocks The nested blocks.
 */
public record BlockQuote(List<Block> blocks) implements Block {

    public BlockQuote {
        blocks = List.copyOf(blocks);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(blocks);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new BlockQuote(AstNode.narrow(newChildren, Block.class));
    }
}
