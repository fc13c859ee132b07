package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A run of plain text.
 *
 * @param text The literal text, escapes already removed.
 */
public record Text(String text) implements Inline {
}
