package org.mdacademic.compiler.backend.link;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.CitationStyle;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Metadata;
import org.mdacademic.compiler.frontend.parser.ast.Paragraph;
import org.mdacademic.compiler.frontend.parser.ast.Reference;
import org.mdacademic.compiler.frontend.parser.ast.Strong;
import org.mdacademic.compiler.frontend.parser.ast.Text;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link ReferenceResolver} and the default linking rules.
 */
public class ReferenceResolverTest {

    private DiagnosticsEngine diagnostics;
    private LinkingContext context;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        LabelRegistry labels = new LabelRegistry(diagnostics);
        labels.define("sec:intro", "Section 1");
        labels.define("both", "Theorem 2");
        context = new LinkingContext(labels, Map.of(
                "knuth1984", BibEntry.of("knuth1984", "book"),
                "both", BibEntry.of("both", "article")));
    }

    private static Document paragraph(Inline... inlines) {
        return new Document(Metadata.empty(), List.of(new Paragraph(List.of(inlines))));
    }

    private Document resolve(Document document, boolean strict) {
        return new ReferenceResolver(LinkingRegistry.initializeWithDefaults(), diagnostics, strict).resolve(document, context);
    }

    /**
     * Verifies that a reference to a defined label takes the label's display text, also when nested.
     */
    @Test
    @Tag("unit")
    void testResolvesLabel() {
        // Act
        Document result = resolve(paragraph(new Text("See "), new Strong(List.of(Reference.to("sec:intro")))), false);

        // Assert
        assertThat(result).isEqualTo(paragraph(new Text("See "), new Strong(List.of(new Reference("sec:intro", "Section 1")))));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that a reference naming a bibliography key becomes a textual citation.
     */
    @Test
    @Tag("unit")
    void testFallsBackToBibliography() {
        // Act
        Document result = resolve(paragraph(Reference.to("knuth1984"), new Text(" shows")), false);

        // Assert
        assertThat(result).isEqualTo(paragraph(
                new Citation(List.of("knuth1984"), CitationStyle.TEXTUAL, null, null), new Text(" shows")));
    }

    /**
     * Verifies that a label wins over a bibliography key of the same name.
     */
    @Test
    @Tag("unit")
    void testLabelTakesPrecedence() {
        // Act
        Document result = resolve(paragraph(Reference.to("both")), false);

        // Assert
        assertThat(result).isEqualTo(paragraph(new Reference("both", "Theorem 2")));
    }

    /**
     * Verifies that an unknown reference renders as a placeholder with a warning in lenient mode.
     */
    @Test
    @Tag("unit")
    void testUnknownReferenceLenient() {
        // Act
        Document result = resolve(paragraph(Reference.to("sec:missing")), false);

        // Assert
        assertThat(result).isEqualTo(paragraph(new Reference("sec:missing", "??sec:missing")));
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNKNOWN_REFERENCE);
        assertThat(diagnostics.getDiagnostics().get(0).message()).isEqualTo("Unknown reference '@sec:missing'.");
    }

    /**
     * Verifies that an unknown reference is an error in strict mode.
     */
    @Test
    @Tag("unit")
    void testUnknownReferenceStrict() {
        // Act
        resolve(paragraph(Reference.to("sec:missing")), true);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.firstError()).map(Diagnostic::code).contains(CompilerErrorCode.UNKNOWN_REFERENCE);
    }

    /**
     * Verifies that references already carrying text are left alone.
     */
    @Test
    @Tag("unit")
    void testResolvedReferencesAreKept() {
        // Arrange
        Document document = paragraph(new Reference("sec:intro", "custom"));

        // Act
        Document result = resolve(document, true);

        // Assert
        assertThat(result).isEqualTo(document);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }
}
