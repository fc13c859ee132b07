package org.mdacademic.compiler.frontend.semantics.numbering;

import org.mdacademic.compiler.frontend.parser.ast.EnvironmentType;

import java.util.Optional;

/**
 * The independent counters of the numbering pass. Some environment types share a counter.
 */
public enum NumberingCounter {
    EQUATION,
    FIGURE,
    TABLE,
    THEOREM,
    LEMMA,
    DEFINITION,
    EXAMPLE,
    ALGORITHM,
    CONJECTURE,
    AXIOM,
    EXERCISE,
    SOLUTION;

    /**
     * Maps an environment type to the counter it advances.
     * @param type The environment type.
     * @return The counter, or empty for unnumbered types.
     */
    public static Optional<NumberingCounter> forEnvironment(EnvironmentType type) {
        switch (type) {
            case THEOREM:
            case PROPOSITION:
            case COROLLARY:
                return Optional.of(THEOREM);
            case LEMMA:
                return Optional.of(LEMMA);
            case DEFINITION:
                return Optional.of(DEFINITION);
            case EXAMPLE:
            case REMARK:
                return Optional.of(EXAMPLE);
            case FIGURE:
                return Optional.of(FIGURE);
            case TABLE:
                return Optional.of(TABLE);
            case ALGORITHM:
                return Optional.of(ALGORITHM);
            case CONJECTURE:
                return Optional.of(CONJECTURE);
            case AXIOM:
                return Optional.of(AXIOM);
            case EXERCISE:
                return Optional.of(EXERCISE);
            case SOLUTION:
                return Optional.of(SOLUTION);
            default:
                return Optional.empty();
        }
    }
}
