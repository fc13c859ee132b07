package org.mdacademic.compiler.frontend.semantics.analysis;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Environment;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

/**
 * Defines environment labels as the kind's display name followed by its number, e.g. "Theorem 2".
 * Unnumbered kinds render as the bare name.
 */
public class EnvironmentAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, LabelRegistry registry, NumberingResult numbering) {
        Environment environment = (Environment) node;
        if (environment.label() == null) {
            return;
        }
        String name = environment.kind().displayName();
        Integer number = environment.kind().isNumbered() ? numbering.envNumbers().get(environment.label()) : null;
        registry.define(environment.label(), number != null ? name + " " + number : name);
    }
}
