package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An inline footnote whose body is written in place: {@code ^[body]}.
 *
 * @param content The nested inlines.
 */
public record Footnote(List<Inline> content) implements Inline {

    public Footnote {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Footnote(AstNode.narrow(newChildren, Inline.class));
    }
}
