package org.mdacademic.compiler.diagnostics;

import org.mdacademic.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during parsing or resolution.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code classifying the condition.
 * @param message The diagnostic message.
 * @param subject The label, key or footnote id the diagnostic is about. May be null.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String subject
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, code, message);
    }
}
