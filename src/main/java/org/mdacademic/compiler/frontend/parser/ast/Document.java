package org.mdacademic.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a parsed document.
 *
 * @param metadata The front matter.
 * @param blocks The top-level blocks, in source order.
 */
public record Document(Metadata metadata, List<Block> blocks) {

    public Document {
        blocks = List.copyOf(blocks);
    }

    /**
     * @param newBlocks The rewritten blocks.
     * @return A document with the same metadata and new blocks.
     */
    public Document withBlocks(List<Block> newBlocks) {
        return new Document(metadata, newBlocks);
    }
}
