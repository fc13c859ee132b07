package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A horizontal rule.
 */
public record ThematicBreak() implements Block {
}
