package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A pipe table.
 *
 * @param header The header row.
 * @param alignments One alignment per column.
 * @param rows The data rows, each as wide as the header.
 * @param label The label from a {@code Table:} trailer. May be null.
 * @param caption The caption from a {@code Table:} or {@code Caption:} trailer. May be null.
 */
public record Table(TableRow header, List<Alignment> alignments, List<TableRow> rows, String label, List<Inline> caption)
        implements Block {

    public Table {
        alignments = List.copyOf(alignments);
        rows = List.copyOf(rows);
        caption = caption == null ? null : List.copyOf(caption);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(header);
        children.addAll(rows);
        if (caption != null) {
            children.addAll(caption);
        }
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        TableRow newHeader = (TableRow) newChildren.get(0);
        int rowsEnd = 1 + rows.size();
        List<TableRow> newRows = AstNode.narrow(newChildren.subList(1, rowsEnd), TableRow.class);
        List<Inline> newCaption = caption == null ? null
                : AstNode.narrow(newChildren.subList(rowsEnd, newChildren.size()), Inline.class);
        return new Table(newHeader, alignments, newRows, label, newCaption);
    }
}
