package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Struck-through text, written {@code ~~text~~}.
 *
 * @param content The nested inlines.
 */
public record Strikethrough(List<Inline> content) implements Inline {

    public Strikethrough {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Strikethrough(AstNode.narrow(newChildren, Inline.class));
    }
}
