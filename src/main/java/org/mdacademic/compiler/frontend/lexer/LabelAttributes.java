package org.mdacademic.compiler.frontend.lexer;

/**
 * The contents of a {@code {...}} attribute block after a heading, equation, environment or caption.
 *
 * @param id The label from {@code #id}. May be null.
 * @param numbered False if the block contains {@code .unnumbered} or {@code -}.
 */
public record LabelAttributes(String id, boolean numbered) {
}
