package org.mdacademic.compiler.backend.notes;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.parser.Parser;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Text;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link FootnoteCollector}.
 */
public class FootnoteCollectorTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private static Document parse(String source) throws ParseException {
        return new Parser(new DiagnosticsEngine()).parse(source);
    }

    /**
     * Verifies that inline footnotes get sequential generated ids and named definitions keep their own.
     */
    @Test
    @Tag("unit")
    void testCollectsInlineAndNamedFootnotes() throws ParseException {
        // Arrange
        Document document = parse("One^[First.] two[^src] three^[Second.]\n\n[^src]: The source.");

        // Act
        Map<String, List<Inline>> footnotes = new FootnoteCollector(diagnostics, false).collect(document);

        // Assert
        assertThat(footnotes).containsOnlyKeys("fn-1", "fn-2", "src");
        assertThat(footnotes.keySet()).containsExactly("fn-1", "fn-2", "src");
        assertThat(footnotes.get("fn-2")).containsExactly(new Text("Second."));
        assertThat(footnotes.get("src")).containsExactly(new Text("The source."));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that a generated id skips a name the author already used.
     */
    @Test
    @Tag("unit")
    void testGeneratedIdsAvoidTakenNames() throws ParseException {
        // Arrange
        Document document = parse("[^fn-1]: Named first.\n\nThen^[Inline.]");

        // Act
        Map<String, List<Inline>> footnotes = new FootnoteCollector(diagnostics, false).collect(document);

        // Assert
        assertThat(footnotes.keySet()).containsExactly("fn-1", "fn-2");
        assertThat(footnotes.get("fn-2")).containsExactly(new Text("Inline."));
    }

    /**
     * Verifies that a named definition appearing after an inline footnote keeps its id, and the inline
     * footnote moves on to the next free generated id.
     */
    @Test
    @Tag("unit")
    void testLaterNamedDefinitionKeepsItsId() throws ParseException {
        // Arrange
        Document document = parse("Then^[Inline.]\n\n[^fn-1]: Named later.");

        // Act
        Map<String, List<Inline>> footnotes = new FootnoteCollector(diagnostics, false).collect(document);

        // Assert
        assertThat(footnotes.keySet()).containsExactly("fn-2", "fn-1");
        assertThat(footnotes.get("fn-1")).containsExactly(new Text("Named later."));
        assertThat(footnotes.get("fn-2")).containsExactly(new Text("Inline."));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that a second definition of the same name is ignored with a warning.
     */
    @Test
    @Tag("unit")
    void testDuplicateDefinitionKeepsFirst() throws ParseException {
        // Arrange
        Document document = parse("[^a]: First.\n\n[^a]: Second.");

        // Act
        Map<String, List<Inline>> footnotes = new FootnoteCollector(diagnostics, true).collect(document);

        // Assert
        assertThat(footnotes.get("a")).containsExactly(new Text("First."));
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.DUPLICATE_FOOTNOTE);
    }

    /**
     * Verifies that a reference without a definition is a warning when lenient and an error when strict.
     */
    @Test
    @Tag("unit")
    void testUndefinedReference() throws ParseException {
        // Arrange
        Document document = parse("Text[^missing] and again[^missing].");
        DiagnosticsEngine strictDiagnostics = new DiagnosticsEngine();

        // Act
        new FootnoteCollector(diagnostics, false).collect(document);
        new FootnoteCollector(strictDiagnostics, true).collect(document);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNDEFINED_FOOTNOTE);
        assertThat(strictDiagnostics.hasErrors()).isTrue();
    }
}
