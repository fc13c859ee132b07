package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A block of raw HTML passed through verbatim.
 *
 * @param html The markup.
 */
public record HtmlBlock(String html) implements Block {
}
