package org.mdacademic.compiler.diagnostics;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    /**
     * Verifies that warnings alone do not count as errors and that the first error is remembered.
     */
    @Test
    @Tag("unit")
    void testErrorsAndWarnings() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        diagnostics.reportWarning(CompilerErrorCode.UNKNOWN_CITATION, "Unknown citation key 'a'.", "a");
        boolean afterWarning = diagnostics.hasErrors();
        diagnostics.report(true, CompilerErrorCode.UNKNOWN_REFERENCE, "Unknown reference '@x'.", "x");
        diagnostics.report(true, CompilerErrorCode.DUPLICATE_LABEL, "Label 'y' is already defined.", "y");

        // Assert
        assertThat(afterWarning).isFalse();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.firstError()).map(Diagnostic::subject).contains("x");
        assertThat(diagnostics.summary()).isEqualTo(
                "[WARNING] UNKNOWN_CITATION: Unknown citation key 'a'.\n"
                + "[ERROR] UNKNOWN_REFERENCE: Unknown reference '@x'.\n"
                + "[ERROR] DUPLICATE_LABEL: Label 'y' is already defined.");
    }
}
