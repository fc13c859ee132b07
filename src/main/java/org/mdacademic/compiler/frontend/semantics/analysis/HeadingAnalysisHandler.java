package org.mdacademic.compiler.frontend.semantics.analysis;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Heading;
import org.mdacademic.compiler.frontend.parser.ast.Inlines;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

/**
 * Defines heading labels as "Section n". Unnumbered headings are referenced by their text.
 */
public class HeadingAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, LabelRegistry registry, NumberingResult numbering) {
        Heading heading = (Heading) node;
        if (heading.label() == null) {
            return;
        }
        String number = numbering.sectionNumbers().get(heading.label());
        String display = number != null ? "Section " + number : Inlines.plainText(heading.content());
        registry.define(heading.label(), display.isEmpty() ? "Section" : display);
    }
}
