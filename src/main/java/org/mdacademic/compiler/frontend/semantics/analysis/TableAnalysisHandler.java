package org.mdacademic.compiler.frontend.semantics.analysis;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Table;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

/**
 * Defines labels from a table's caption trailer as "Table n".
 */
public class TableAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, LabelRegistry registry, NumberingResult numbering) {
        Table table = (Table) node;
        if (table.label() == null) {
            return;
        }
        Integer number = numbering.envNumbers().get(table.label());
        registry.define(table.label(), number != null ? "Table " + number : "Table");
    }
}
