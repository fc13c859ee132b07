package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A line break inside a paragraph that renders as a space.
 */
public record SoftBreak() implements Inline {
}
