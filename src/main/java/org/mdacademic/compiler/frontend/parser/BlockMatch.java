package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.frontend.parser.ast.Block;

/**
 * The result of a successful block recognition.
 *
 * @param block The recognized block.
 * @param consumed How many source lines the block used; always at least 1.
 */
public record BlockMatch(Block block, int consumed) {

    public BlockMatch {
        if (consumed < 1) {
            throw new IllegalArgumentException("A block must consume at least one line");
        }
    }
}
