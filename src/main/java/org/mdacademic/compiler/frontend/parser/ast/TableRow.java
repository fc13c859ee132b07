package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One table row.
 *
 * @param cells The cells, one per column.
 */
public record TableRow(List<TableCell> cells) implements AstNode {

    public TableRow {
        cells = List.copyOf(cells);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(cells);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new TableRow(AstNode.narrow(newChildren, TableCell.class));
    }
}
