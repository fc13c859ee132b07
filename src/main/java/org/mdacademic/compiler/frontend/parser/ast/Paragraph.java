package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A paragraph of inline content.
 *
 * @param content The inlines.
 */
public record Paragraph(List<Inline> content) implements Block {

    public Paragraph {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Paragraph(AstNode.narrow(newChildren, Inline.class));
    }
}
