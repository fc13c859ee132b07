package org.mdacademic.compiler.frontend.parser.ast;

/**
 * Inline math, written {@code $...$}.
 *
 * @param latex The raw LaTeX between the delimiters.
 */
public record InlineMath(String latex) implements Inline {
}
