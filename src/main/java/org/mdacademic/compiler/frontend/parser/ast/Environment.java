package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A fenced environment: {@code ::: kind {#label} ... :::}.
 *
 * @param kind The environment kind.
 * @param label The label. May be null.
 * @param blocks The content.
 * @param caption The caption of a figure or table environment. May be null.
 */
public record Environment(EnvironmentKind kind, String label, List<Block> blocks, List<Inline> caption) implements Block {

    public Environment {
        blocks = List.copyOf(blocks);
        caption = caption == null ? null : List.copyOf(caption);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(blocks);
        if (caption != null) {
            children.addAll(caption);
        }
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int split = blocks.size();
        List<Block> newBlocks = AstNode.narrow(newChildren.subList(0, split), Block.class);
        List<Inline> newCaption = caption == null ? null
                : AstNode.narrow(newChildren.subList(split, newChildren.size()), Inline.class);
        return new Environment(kind, label, newBlocks, newCaption);
    }
}
