package org.mdacademic.compiler.frontend.parser;

import java.util.List;
import java.util.Optional;

/**
 * The base interface for all block recognizers.
 * Each recognizer is responsible for one block type and either claims the lines at the cursor or
 * declines without side effects.
 */
public interface IBlockRecognizer {

    /**
     * Attempts to recognize a block at the first of the given lines.
     *
     * @param lines The remaining source lines; the first one is not blank.
     * @param context The parsing context, for recursion and diagnostics.
     * @return The block and the number of lines it consumed, or empty if this recognizer does not apply.
     */
    Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context);
}
