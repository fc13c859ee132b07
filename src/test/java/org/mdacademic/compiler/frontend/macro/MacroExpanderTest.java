package org.mdacademic.compiler.frontend.macro;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.InlineMath;
import org.mdacademic.compiler.frontend.parser.ast.Macro;
import org.mdacademic.compiler.frontend.parser.ast.Metadata;
import org.mdacademic.compiler.frontend.parser.ast.Paragraph;
import org.mdacademic.compiler.frontend.parser.ast.Text;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link MacroExpander}.
 */
public class MacroExpanderTest {

    private DiagnosticsEngine diagnostics;
    private MacroExpander expander;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        Map<String, Macro> macros = new LinkedHashMap<>();
        macros.put("R", Macro.fromTemplate("\\mathbb{R}"));
        macros.put("norm", Macro.fromTemplate("\\left\\| #1 \\right\\|"));
        macros.put("pair", Macro.fromTemplate("(#1, #2)"));
        expander = new MacroExpander(macros, 10, diagnostics);
    }

    /**
     * Verifies that a parameterless macro is replaced but does not match the prefix of a longer command.
     */
    @Test
    @Tag("unit")
    void testNameBoundary() {
        // Act
        String result = expander.expand("f: \\R \\Rightarrow \\R^2");

        // Assert
        assertThat(result).isEqualTo("f: \\mathbb{R} \\Rightarrow \\mathbb{R}^2");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies argument substitution, including whitespace between groups and nested braces.
     */
    @Test
    @Tag("unit")
    void testArguments() {
        // Act
        String single = expander.expand("\\norm{x}");
        String spaced = expander.expand("\\pair {a} {b_{1}}");
        String nested = expander.expand("\\pair{\\R}{\\norm{v}}");

        // Assert
        assertThat(single).isEqualTo("\\left\\| x \\right\\|");
        assertThat(spaced).isEqualTo("(a, b_{1})");
        assertThat(nested).isEqualTo("(\\mathbb{R}, \\left\\| v \\right\\|)");
    }

    /**
     * Verifies that expanding an already expanded fragment changes nothing.
     */
    @Test
    @Tag("unit")
    void testExpansionIsIdempotent() {
        // Arrange
        String once = expander.expand("\\norm{\\R^n} + \\pair{1}{2}");

        // Act
        String twice = expander.expand(once);

        // Assert
        assertThat(twice).isEqualTo(once);
    }

    /**
     * Verifies that an invocation missing its argument groups is left as written.
     */
    @Test
    @Tag("unit")
    void testMalformedInvocationIsKept() {
        // Act
        String result = expander.expand("\\norm x + \\pair{a}");

        // Assert
        assertThat(result).isEqualTo("\\norm x + \\pair{a}");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that a self-referential macro stops at the pass bound with a warning instead of looping.
     */
    @Test
    @Tag("unit")
    void testExpansionLimit() {
        // Arrange
        MacroExpander looping = new MacroExpander(Map.of("a", Macro.fromTemplate("\\a\\a")), 3, diagnostics);

        // Act
        String result = looping.expand("\\a");

        // Assert
        assertThat(result).isEqualTo("\\a".repeat(8));
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).extracting(d -> d.code())
                .containsExactly(CompilerErrorCode.MACRO_EXPANSION_LIMIT);
    }

    /**
     * Verifies that only inline and display math are rewritten and that labels survive.
     */
    @Test
    @Tag("unit")
    void testDocumentExpansionTouchesMathOnly() {
        // Arrange
        Document document = new Document(Metadata.empty(), List.of(
                new Paragraph(List.of(new Text("\\R stays "), new InlineMath("\\R"))),
                new DisplayMath("\\R^n", "eq:space")));

        // Act
        Document result = expander.expand(document);

        // Assert
        assertThat(result.blocks()).containsExactly(
                new Paragraph(List.of(new Text("\\R stays "), new InlineMath("\\mathbb{R}"))),
                new DisplayMath("\\mathbb{R}^n", "eq:space"));
    }

    /**
     * Verifies that a document is returned as is when no macros are declared.
     */
    @Test
    @Tag("unit")
    void testNoMacros() {
        // Arrange
        Document document = new Document(Metadata.empty(), List.of(new DisplayMath("\\R", null)));

        // Act
        Document result = new MacroExpander(Map.of(), 10, diagnostics).expand(document);

        // Assert
        assertThat(result).isSameAs(document);
    }
}
