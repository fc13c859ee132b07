package org.mdacademic.compiler;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.BibliographyParser;
import org.mdacademic.compiler.api.CompilationException;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.LabelInfo;
import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.api.ResolutionException;
import org.mdacademic.compiler.api.ResolveConfig;
import org.mdacademic.compiler.api.ResolvedDocument;
import org.mdacademic.compiler.bibliography.BibliographyLoader;
import org.mdacademic.compiler.diagnostics.CompilerLogger;
import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.CitationStyle;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.parser.ast.Environment;
import org.mdacademic.compiler.frontend.parser.ast.Paragraph;
import org.mdacademic.compiler.frontend.parser.ast.Reference;
import org.mdacademic.compiler.frontend.parser.ast.Text;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for the {@link Compiler}, from source text to a resolved document.
 */
@ExtendWith(MockitoExtension.class)
public class CompilerTest {

    private static final String PAPER = """
            +++
            title = "A Paper"
            authors = ["Ada"]
            bibliography = "refs.bib"

            [macros]
            R = '\\mathbb{R}'
            +++

            # Introduction {#sec:intro}

            We work in $\\R^n$ as in [@knuth1984, p. 3].^[A remark.]

            $$ f: \\R \\to \\R $$ {#eq:f}

            ::: theorem {#thm:main}
            By @eq:f and @sec:intro, see @knuth1984.
            :::
            """;

    @TempDir
    Path tempDir;

    @Mock
    private BibliographyParser bibliographyParser;

    private Compiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler(new BibliographyLoader(bibliographyParser));
    }

    /**
     * Verifies the full pipeline: bibliography loading, macro expansion, numbering, labels,
     * footnotes, references and citations.
     */
    @Test
    @Tag("unit")
    void testCompilesPaper() throws IOException, CompilationException {
        // Arrange
        Files.writeString(tempDir.resolve("refs.bib"), "@book{knuth1984}", StandardCharsets.UTF_8);
        when(bibliographyParser.parse(anyString())).thenReturn(Map.of("knuth1984", BibEntry.of("knuth1984", "book")));

        // Act
        ResolvedDocument result = compiler.compile(PAPER, ResolveConfig.lenient(tempDir));

        // Assert
        verify(bibliographyParser).parse("@book{knuth1984}");
        assertThat(result.labels()).containsExactly(
                entry("sec:intro", new LabelInfo("Section 1", "sec-intro")),
                entry("eq:f", new LabelInfo("(1)", "eq-f")),
                entry("thm:main", new LabelInfo("Theorem 1", "thm-main")));
        assertThat(result.sectionNumbers()).containsExactly(entry("sec:intro", "1"));
        assertThat(result.envNumbers()).containsExactly(entry("eq:f", 1), entry("thm:main", 1));
        assertThat(result.footnotes()).containsExactly(entry("fn-1", List.of(new Text("A remark."))));
        assertThat(result.citationOrder()).containsExactly("knuth1984");
        assertThat(result.unknownCitations()).isEmpty();
        assertThat(result.citations()).containsOnlyKeys("knuth1984");
        assertThat(result.diagnostics()).isEmpty();

        assertThat(result.document().blocks().get(2)).isEqualTo(new DisplayMath("f: \\mathbb{R} \\to \\mathbb{R}", "eq:f"));
        Environment theorem = (Environment) result.document().blocks().get(3);
        assertThat(((Paragraph) theorem.blocks().get(0)).content()).containsExactly(
                new Text("By "), new Reference("eq:f", "(1)"), new Text(" and "),
                new Reference("sec:intro", "Section 1"), new Text(", see "),
                new Citation(List.of("knuth1984"), CitationStyle.TEXTUAL, null, null), new Text("."));
    }

    /**
     * Verifies that lenient resolution turns problems into warnings and placeholders.
     */
    @Test
    @Tag("unit")
    void testLenientWarnings() throws CompilationException {
        // Act
        ResolvedDocument result = compiler.compile("See @nowhere and [@ghost] and[^none].", ResolveConfig.lenient(tempDir));

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactlyInAnyOrder(
                CompilerErrorCode.UNDEFINED_FOOTNOTE, CompilerErrorCode.UNKNOWN_REFERENCE, CompilerErrorCode.UNKNOWN_CITATION);
        assertThat(result.unknownCitations()).containsExactly("ghost");
        assertThat(((Paragraph) result.document().blocks().get(0)).content()).contains(new Reference("nowhere", "??nowhere"));
    }

    /**
     * Verifies that strict citation checking aborts resolution with the citation error code.
     */
    @Test
    @Tag("unit")
    void testStrictCitations() {
        // Arrange
        ResolveConfig config = ResolveConfig.lenient(tempDir).withStrictness(true, false);

        // Act
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> compiler.compile("As [@ghost] says.", config));

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_CITATION);
        assertThat(e.getMessage()).contains("ghost");
    }

    /**
     * Verifies that strict reference checking aborts resolution on an unknown label.
     */
    @Test
    @Tag("unit")
    void testStrictReferences() {
        // Arrange
        ResolveConfig config = ResolveConfig.lenient(tempDir).withStrictness(false, true);

        // Act
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> compiler.compile("See @sec:missing.", config));

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_REFERENCE);
    }

    /**
     * Verifies that duplicate labels are fatal even in lenient mode.
     */
    @Test
    @Tag("unit")
    void testDuplicateLabelIsFatal() {
        // Act
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> compiler.compile("# A {#x}\n# B {#x}", ResolveConfig.lenient(tempDir)));

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.DUPLICATE_LABEL);
    }

    /**
     * Verifies that a missing bibliography file fails resolution before the parser is consulted.
     */
    @Test
    @Tag("unit")
    void testMissingBibliography() {
        // Act
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> compiler.compile("+++\nbibliography = \"absent.bib\"\n+++\nText", ResolveConfig.lenient(tempDir)));

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.BIBLIOGRAPHY_UNREADABLE);
    }

    /**
     * Verifies that malformed front matter surfaces as a parse error.
     */
    @Test
    @Tag("unit")
    void testParseError() {
        // Act
        ParseException e = assertThrows(ParseException.class, () -> compiler.parse("+++\ntitle = \"x\"\n"));

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.FRONT_MATTER_UNCLOSED);
    }

    /**
     * Verifies that compiling a file resolves the bibliography next to it by default.
     */
    @Test
    @Tag("unit")
    void testCompileFileUsesItsDirectory() throws IOException, CompilationException {
        // Arrange
        Path dir = Files.createDirectories(tempDir.resolve("paper"));
        Files.writeString(dir.resolve("refs.bib"), "@book{knuth1984}", StandardCharsets.UTF_8);
        Path source = Files.writeString(dir.resolve("paper.md"), PAPER, StandardCharsets.UTF_8);
        when(bibliographyParser.parse(anyString())).thenReturn(Map.of("knuth1984", BibEntry.of("knuth1984", "book")));

        // Act
        ResolvedDocument result = compiler.compile(source, ResolveConfig.lenient(Path.of(".")));

        // Assert
        assertThat(result.unknownCitations()).isEmpty();
        assertThat(result.document().metadata().title()).isEqualTo("A Paper");
    }

    /**
     * Verifies that a compiler instance can be reused without state leaking between documents.
     */
    @Test
    @Tag("unit")
    void testCompilerIsReusable() throws CompilationException {
        // Act
        ResolvedDocument first = compiler.compile("# One {#a}", ResolveConfig.lenient(tempDir));
        ResolvedDocument second = compiler.compile("# Two {#a}", ResolveConfig.lenient(tempDir));

        // Assert
        assertThat(first.labels()).containsOnlyKeys("a");
        assertThat(second.labels().get("a").displayText()).isEqualTo("Section 1");
    }

    /**
     * Verifies that references inside inline and named footnote bodies are resolved in the footnote
     * table, including a bibliography key that becomes a textual citation.
     */
    @Test
    @Tag("unit")
    void testFootnoteBodiesAreResolved() throws CompilationException {
        // Arrange
        String source = "# A {#a}\n\nText.^[See @a.] More.[^n]\n\n[^n]: As @knuth1984 shows.";
        Map<String, BibEntry> bibliography = Map.of("knuth1984", BibEntry.of("knuth1984", "book"));

        // Act
        ResolvedDocument result = compiler.resolve(compiler.parse(source), bibliography, ResolveConfig.lenient(tempDir));

        // Assert
        assertThat(result.footnotes().get("fn-1")).containsExactly(
                new Text("See "), new Reference("a", "Section 1"), new Text("."));
        assertThat(result.footnotes().get("n")).containsExactly(
                new Text("As "), new Citation(List.of("knuth1984"), CitationStyle.TEXTUAL, null, null), new Text(" shows."));
        assertThat(result.diagnostics()).isEmpty();
    }

    /**
     * Verifies that verbosity is held per compiler: silencing one instance does not silence another.
     */
    @Test
    @Tag("unit")
    void testVerbosityIsPerInstance() throws CompilationException {
        // Arrange
        Logger compilerLog = (Logger) LoggerFactory.getLogger(Compiler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        compilerLog.addAppender(appender);
        Compiler quiet = new Compiler(new BibliographyLoader(bibliographyParser));
        compiler.setVerbosity(CompilerLogger.WARN);
        quiet.setVerbosity(CompilerLogger.ERROR);

        // Act
        try {
            quiet.compile("See @nowhere.", ResolveConfig.lenient(tempDir));
            compiler.compile("See @elsewhere.", ResolveConfig.lenient(tempDir));
        } finally {
            compilerLog.detachAppender(appender);
        }

        // Assert
        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsOnly(Level.WARN);
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.contains("@elsewhere"))
                .noneMatch(message -> message.contains("@nowhere"));
    }
}
