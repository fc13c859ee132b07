package org.mdacademic.compiler.frontend.parser.ast;

/**
 * An explicit page break.
 */
public record PageBreak() implements Block {
}
