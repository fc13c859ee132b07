package org.mdacademic.compiler.frontend.semantics.analysis;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

/**
 * Interface for specialized handlers in label analysis.
 * Each handler is responsible for one type of labelable AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node.
     * @param node The node to analyze.
     * @param registry The registry receiving the node's label.
     * @param numbering The numbers assigned by the numbering pass.
     */
    void analyze(AstNode node, LabelRegistry registry, NumberingResult numbering);
}
