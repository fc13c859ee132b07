package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A term and its definition in a {@link DescriptionList}.
 *
 * @param term The term inlines.
 * @param definition The definition, parsed as blocks.
 */
public record DescriptionItem(List<Inline> term, List<Block> definition) implements AstNode {

    public DescriptionItem {
        term = List.copyOf(term);
        definition = List.copyOf(definition);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(term);
        children.addAll(definition);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int split = term.size();
        return new DescriptionItem(
                AstNode.narrow(newChildren.subList(0, split), Inline.class),
                AstNode.narrow(newChildren.subList(split, newChildren.size()), Block.class));
    }
}
