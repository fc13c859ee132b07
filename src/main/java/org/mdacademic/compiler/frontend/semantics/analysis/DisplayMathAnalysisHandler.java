package org.mdacademic.compiler.frontend.semantics.analysis;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

/**
 * Defines equation labels as "(n)".
 */
public class DisplayMathAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, LabelRegistry registry, NumberingResult numbering) {
        DisplayMath math = (DisplayMath) node;
        if (math.label() == null) {
            return;
        }
        Integer number = numbering.envNumbers().get(math.label());
        registry.define(math.label(), "(" + (number != null ? number.toString() : "?") + ")");
    }
}
