package org.mdacademic.compiler.api;

/**
 * Defines unique, testable error codes for all conditions that can occur during compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Front Matter & Parser
    /** The front matter block was opened with {@code +++} but never closed. */
    FRONT_MATTER_UNCLOSED,
    /** The front matter is not valid TOML, or a key holds a value of the wrong type. */
    FRONT_MATTER_INVALID,
    /** A fenced code block, display math block or environment reached the end of input unclosed. */
    UNCLOSED_BLOCK,
    /** A label was attached to a block that cannot carry one and was dropped. */
    IGNORED_LABEL,
    // endregion

    // region Macro Expansion
    /** Macro expansion did not reach a fixed point within the iteration limit. */
    MACRO_EXPANSION_LIMIT,
    // endregion

    // region Resolution
    /** The same label was declared twice anywhere in the document. */
    DUPLICATE_LABEL,
    /** A reference names a label that no block declares. */
    UNKNOWN_REFERENCE,
    /** A citation key is not present in the bibliography. */
    UNKNOWN_CITATION,
    /** A footnote reference names an id that has no definition. */
    UNDEFINED_FOOTNOTE,
    /** A footnote id was defined twice. */
    DUPLICATE_FOOTNOTE,
    // endregion

    // region Bibliography
    /** The bibliography file could not be read. */
    BIBLIOGRAPHY_UNREADABLE,
    /** The bibliography file could not be parsed. */
    BIBLIOGRAPHY_INVALID,
    // endregion

    // region General
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
