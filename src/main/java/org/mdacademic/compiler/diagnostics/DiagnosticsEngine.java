package org.mdacademic.compiler.diagnostics;

import org.mdacademic.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while a document is compiled.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, resolver passes).
 * One engine belongs to one compilation call; it is not shared between documents.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param subject The label, key or id concerned. May be null.
     */
    public void reportError(CompilerErrorCode code, String message, String subject) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, subject));
    }

    /**
     * Reports a warning.
     *
     * @param code    The error code.
     * @param message The warning message.
     * @param subject The label, key or id concerned. May be null.
     */
    public void reportWarning(CompilerErrorCode code, String message, String subject) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, subject));
    }

    /**
     * Reports an error or a warning depending on {@code fatal}.
     *
     * @param fatal   Whether the condition should fail compilation.
     * @param code    The error code.
     * @param message The message.
     * @param subject The label, key or id concerned. May be null.
     */
    public void report(boolean fatal, CompilerErrorCode code, String message, String subject) {
        if (fatal) {
            reportError(code, message, subject);
        } else {
            reportWarning(code, message, subject);
        }
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The first reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
