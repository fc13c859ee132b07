package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.parser.ast.Block;
import org.mdacademic.compiler.frontend.parser.ast.Inline;

import java.util.List;

/**
 * An interface that encapsulates the services a block recognizer needs while parsing.
 * It gives recognizers recursive access to the parser without coupling them to its implementation.
 */
public interface BlockParsingContext {

    /**
     * Parses text as a sequence of blocks, used for container contents.
     * @param text The inner text, container prefixes already removed.
     * @return The blocks.
     */
    List<Block> parseBlocks(String text);

    /**
     * Parses text as inline content.
     * @param text The text.
     * @return The inlines.
     */
    List<Inline> parseInlines(String text);

    /**
     * Checks whether a line would start a block other than a paragraph, which ends a running paragraph.
     * @param line The source line.
     * @return {@code true} if the line interrupts a paragraph.
     */
    boolean interruptsParagraph(String line);

    /**
     * Gets the diagnostics engine for reporting warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();
}
