package org.mdacademic.compiler.frontend.parser.ast;

/**
 * An inline HTML tag or comment passed through verbatim.
 *
 * @param html The raw markup.
 */
public record RawHtml(String html) implements Inline {
}
