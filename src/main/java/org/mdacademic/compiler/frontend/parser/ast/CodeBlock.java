package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A fenced code block.
 *
 * @param language The language tag after the opening fence. May be null.
 * @param code The verbatim content, lines joined with {@code \n}.
 */
public record CodeBlock(String language, String code) implements Block {
}
