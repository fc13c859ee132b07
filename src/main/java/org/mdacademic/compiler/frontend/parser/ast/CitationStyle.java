package org.mdacademic.compiler.frontend.parser.ast;

/**
 * How a citation is rendered.
 */
public enum CitationStyle {
    /** {@code [@key]}: author and year in parentheses. */
    PARENTHETICAL,
    /** {@code @key}: author name in the running text. */
    TEXTUAL,
    /** {@code @key-}: author name only. */
    AUTHOR_ONLY,
    /** {@code [-@key]}: year only. */
    YEAR_ONLY
}
