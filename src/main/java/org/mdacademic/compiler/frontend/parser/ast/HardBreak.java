package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A forced line break: two trailing spaces or a trailing backslash before a newline.
 */
public record HardBreak() implements Inline {
}
