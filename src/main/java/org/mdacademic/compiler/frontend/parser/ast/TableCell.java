package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One table cell.
 *
 * @param content The cell inlines.
 */
public record TableCell(List<Inline> content) implements AstNode {

    public TableCell {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new TableCell(AstNode.narrow(newChildren, Inline.class));
    }
}
