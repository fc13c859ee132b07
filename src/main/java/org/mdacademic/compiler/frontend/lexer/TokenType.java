package org.mdacademic.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Line-level tokens.
    /** An ATX heading; value is the level, text the content. */
    HEADING,
    /** A horizontal rule. */
    THEMATIC_BREAK,
    /** One of the page break markers. */
    PAGE_BREAK,
    /** One of the appendix markers. */
    APPENDIX_MARKER,
    /** The table of contents placeholder. */
    TABLE_OF_CONTENTS,
    /** An opening code fence; text is the fence, value the language or null. */
    CODE_FENCE,
    /** A {@code $$} display math delimiter at the start of a line. */
    MATH_FENCE,
    /** An environment opener; text is the keyword, value the label or null. */
    ENVIRONMENT_OPEN,
    /** A list item marker; value is a {@link ListMarker}, the remainder is the item text. */
    LIST_MARKER,
    /** A footnote definition; text is the id, the remainder is the body. */
    FOOTNOTE_DEFINITION,
    /** A {@code Table:} or {@code Caption:} trailer; the remainder is the caption. */
    TABLE_CAPTION,

    // Inline tokens.
    /** Math between {@code $} or {@code $$}; text is the LaTeX. */
    INLINE_MATH,
    /** Strong emphasis; text is the inner source. */
    STRONG,
    /** Emphasis; text is the inner source. */
    EMPHASIS,
    /** Strikethrough; text is the inner source. */
    STRIKETHROUGH,
    /** Subscript; text is the inner source. */
    SUBSCRIPT,
    /** Superscript; text is the inner source. */
    SUPERSCRIPT,
    /** A code span; text is the code. */
    CODE,
    /** A bracketed citation; value is a {@link CitationToken}. */
    CITATION,
    /** An inline footnote; text is the body source. */
    INLINE_FOOTNOTE,
    /** A footnote reference; text is the id. */
    FOOTNOTE_REFERENCE,
    /** A bare {@code @label} reference; text is the label. */
    REFERENCE,
    /** An author-only citation {@code @key-}; text is the key. */
    AUTHOR_CITATION,
    /** A label annotation; text is the id or null, value a {@link LabelAttributes}. */
    LABEL,
    /** A link; text is the link text source, value a {@link LinkTarget}. */
    LINK,
    /** An image; text is the alt text, value a {@link LinkTarget}. */
    IMAGE,
    /** Bracketed text with a {@code {.smallcaps}} attribute; text is the inner source. */
    SMALL_CAPS,
    /** An autolink; text is the URL. */
    AUTOLINK,
    /** An inline HTML tag or comment; text is the markup. */
    RAW_HTML
}
