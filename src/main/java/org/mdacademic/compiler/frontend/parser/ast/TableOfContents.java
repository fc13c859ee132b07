package org.mdacademic.compiler.frontend.parser.ast;

/**
 * Placeholder for a generated table of contents, written {@code [[toc]]}.
 */
public record TableOfContents() implements Block {
}
