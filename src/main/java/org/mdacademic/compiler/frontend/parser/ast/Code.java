package org.mdacademic.compiler.frontend.parser.ast;

/**
 * An inline code span.
 *
 * @param code The verbatim code.
 */
public record Code(String code) implements Inline {
}
