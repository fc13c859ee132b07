package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A display equation, written between {@code $$} delimiters.
 *
 * @param latex The raw LaTeX.
 * @param label The label written after the closing delimiter. May be null.
 */
public record DisplayMath(String latex, String label) implements Block {
}
