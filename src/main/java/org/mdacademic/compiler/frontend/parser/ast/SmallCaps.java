package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Small capitals, written {@code [text]{.smallcaps}}.
 *
 * @param content The nested inlines.
 */
public record SmallCaps(List<Inline> content) implements Inline {

    public SmallCaps {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new SmallCaps(AstNode.narrow(newChildren, Inline.class));
    }
}
