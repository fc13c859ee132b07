package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A reference to a footnote defined elsewhere, written {@code [^id]}.
 *
 * @param id The footnote id.
 */
public record FootnoteReference(String id) implements Inline {
}
