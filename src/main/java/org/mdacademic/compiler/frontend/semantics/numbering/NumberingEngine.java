package org.mdacademic.compiler.frontend.semantics.numbering;

import org.mdacademic.compiler.frontend.parser.ast.AppendixMarker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Environment;
import org.mdacademic.compiler.frontend.parser.ast.EnvironmentType;
import org.mdacademic.compiler.frontend.parser.ast.Heading;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns section, equation, environment and table numbers in a single depth-first walk over the
 * blocks in document order.
 * <p>
 * Every numbered heading, display equation and numbered environment advances its counter whether or
 * not it is labeled; only labeled items are recorded. A table directly inside a table environment
 * shares the environment's number instead of advancing the table counter a second time.
 */
public class NumberingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(NumberingEngine.class);

    /**
     * Numbers a document.
     * @param document The document, after macro expansion.
     * @return The numbers of all labeled items.
     */
    public NumberingResult number(Document document) {
        Walk walk = new Walk();
        for (AstNode block : document.blocks()) {
            walk.visit(block, null);
        }
        LOG.debug("{} labeled section(s), {} labeled item(s)", walk.sectionNumbers.size(), walk.envNumbers.size());
        return new NumberingResult(walk.sectionNumbers, walk.envNumbers);
    }

    private static final class Walk {
        private final NumberingState state = new NumberingState();
        private final Map<String, String> sectionNumbers = new LinkedHashMap<>();
        private final Map<String, Integer> envNumbers = new LinkedHashMap<>();

        /**
         * @param node The node.
         * @param tableEnvironment The number of the enclosing table environment, or null outside one.
         */
        void visit(AstNode node, Integer tableEnvironment) {
            Integer enclosingTable = tableEnvironment;
            if (node instanceof Heading heading) {
                if (heading.numbered()) {
                    String number = state.nextSection(heading.level());
                    record(sectionNumbers, heading.label(), number);
                }
            } else if (node instanceof DisplayMath math) {
                record(envNumbers, math.label(), state.next(NumberingCounter.EQUATION));
            } else if (node instanceof Environment environment) {
                Optional<NumberingCounter> counter = environment.kind().isNumbered()
                        ? NumberingCounter.forEnvironment(environment.kind().type())
                        : Optional.empty();
                if (counter.isPresent()) {
                    int number = state.next(counter.get());
                    record(envNumbers, environment.label(), number);
                    if (environment.kind().type() == EnvironmentType.TABLE) {
                        enclosingTable = number;
                    }
                }
            } else if (node instanceof Table table) {
                int number = tableEnvironment != null ? tableEnvironment : state.next(NumberingCounter.TABLE);
                record(envNumbers, table.label(), number);
            } else if (node instanceof AppendixMarker) {
                state.enterAppendix();
            }

            for (AstNode child : node.getChildren()) {
                if (!(child instanceof Inline)) {
                    visit(child, enclosingTable);
                }
            }
        }

        private static <V> void record(Map<String, V> numbers, String label, V value) {
            if (label != null) {
                numbers.putIfAbsent(label, value);
            }
        }
    }
}
