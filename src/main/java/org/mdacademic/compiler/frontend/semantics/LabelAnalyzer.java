package org.mdacademic.compiler.frontend.semantics;

import org.mdacademic.compiler.frontend.TreeWalker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Environment;
import org.mdacademic.compiler.frontend.parser.ast.Heading;
import org.mdacademic.compiler.frontend.parser.ast.Table;
import org.mdacademic.compiler.frontend.semantics.analysis.DisplayMathAnalysisHandler;
import org.mdacademic.compiler.frontend.semantics.analysis.EnvironmentAnalysisHandler;
import org.mdacademic.compiler.frontend.semantics.analysis.HeadingAnalysisHandler;
import org.mdacademic.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.mdacademic.compiler.frontend.semantics.analysis.TableAnalysisHandler;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Populates a {@link LabelRegistry} from a numbered document. It traverses the blocks in document
 * order and dispatches every labelable node to its analysis handler.
 */
public class LabelAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LabelAnalyzer.class);

    private final LabelRegistry registry;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new label analyzer.
     * @param registry The registry to populate.
     */
    public LabelAnalyzer(LabelRegistry registry) {
        this.registry = registry;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(Heading.class, new HeadingAnalysisHandler());
        handlers.put(DisplayMath.class, new DisplayMathAnalysisHandler());
        handlers.put(Environment.class, new EnvironmentAnalysisHandler());
        handlers.put(Table.class, new TableAnalysisHandler());
    }

    /**
     * Defines the label of every labeled node in the document.
     * @param document The document.
     * @param numbering The numbers assigned to the document's labeled items.
     */
    public void analyze(Document document, NumberingResult numbering) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> dispatch = new HashMap<>();
        handlers.forEach((type, handler) -> dispatch.put(type, node -> handler.analyze(node, registry, numbering)));
        new TreeWalker(dispatch).walk(document.blocks());
        LOG.debug("{} label(s) defined", registry.asMap().size());
    }
}
