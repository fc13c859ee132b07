package org.mdacademic.compiler;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.ICompiler;
import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.api.ResolutionException;
import org.mdacademic.compiler.api.ResolveConfig;
import org.mdacademic.compiler.api.ResolvedDocument;
import org.mdacademic.compiler.backend.link.LinkingContext;
import org.mdacademic.compiler.backend.link.LinkingRegistry;
import org.mdacademic.compiler.backend.link.ReferenceResolver;
import org.mdacademic.compiler.backend.notes.CitationValidator;
import org.mdacademic.compiler.backend.notes.FootnoteCollector;
import org.mdacademic.compiler.bibliography.BibTexParser;
import org.mdacademic.compiler.bibliography.BibliographyLoader;
import org.mdacademic.compiler.diagnostics.CompilerLogger;
import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.macro.MacroExpander;
import org.mdacademic.compiler.frontend.parser.Parser;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.semantics.LabelAnalyzer;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingEngine;
import org.mdacademic.compiler.frontend.semantics.numbering.NumberingResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text to a
 * resolved document.
 * <p>
 * Every call works on its own {@link DiagnosticsEngine}, so one instance may compile any number of
 * documents. Warnings are returned with the result; the first error aborts the phase that raised it.
 * Verbosity belongs to the instance.
 */
public class Compiler implements ICompiler {

    private final BibliographyLoader bibliographyLoader;
    private final CompilerLogger log = new CompilerLogger(Compiler.class);

    /**
     * Constructs a compiler that reads BibTeX bibliographies.
     */
    public Compiler() {
        this(new BibliographyLoader(new BibTexParser()));
    }

    /**
     * Constructs a compiler with a custom bibliography loader.
     * @param bibliographyLoader The loader for the front matter's bibliography file.
     */
    public Compiler(BibliographyLoader bibliographyLoader) {
        this.bibliographyLoader = bibliographyLoader;
    }

    @Override
    public Document parse(String source) throws ParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Document document = new Parser(diagnostics).parse(source);
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            log.warn("Parser: " + diagnostic);
        }
        return document;
    }

    @Override
    public ResolvedDocument resolve(Document document, ResolveConfig config) throws ResolutionException {
        // Phase 1: Bibliography
        log.debug("Phase 1: loading bibliography");
        Map<String, BibEntry> bibliography = bibliographyLoader.load(config.basePath(), document.metadata().bibliography());
        return resolve(document, bibliography, config);
    }

    @Override
    public ResolvedDocument resolve(Document document, Map<String, BibEntry> bibliography, ResolveConfig config)
            throws ResolutionException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 2: Macro expansion (math only)
        log.debug("Phase 2: expanding macros");
        MacroExpander expander = new MacroExpander(document.metadata().macros(), config.maxMacroIterations(), diagnostics);
        Document expanded = expander.expand(document);

        // Phase 3: Numbering
        log.debug("Phase 3: numbering");
        NumberingResult numbering = new NumberingEngine().number(expanded);

        // Phase 4: Label registry
        log.debug("Phase 4: building label registry");
        LabelRegistry labels = new LabelRegistry(diagnostics);
        new LabelAnalyzer(labels).analyze(expanded, numbering);
        failOnErrors(diagnostics);

        // Phase 5: Reference resolution (footnote bodies included)
        log.debug("Phase 5: resolving references");
        ReferenceResolver resolver = new ReferenceResolver(LinkingRegistry.initializeWithDefaults(), diagnostics,
                config.strictReferences());
        Document linked = resolver.resolve(expanded, new LinkingContext(labels, bibliography));
        failOnErrors(diagnostics);

        // Phase 6: Footnotes, collected from the linked tree
        log.debug("Phase 6: collecting footnotes");
        Map<String, List<Inline>> footnotes = new FootnoteCollector(diagnostics, config.strictReferences()).collect(linked);
        failOnErrors(diagnostics);

        // Phase 7: Citation validation
        log.debug("Phase 7: validating citations");
        Set<String> unknownCitations = new CitationValidator(diagnostics, config.strictCitations()).validate(linked, bibliography);
        failOnErrors(diagnostics);

        List<Diagnostic> warnings = new ArrayList<>(diagnostics.getDiagnostics());
        for (Diagnostic warning : warnings) {
            log.warn(warning.toString());
        }
        log.info("Compiler: resolved " + labels.asMap().size() + " label(s), "
                + footnotes.size() + " footnote(s), " + warnings.size() + " warning(s)");

        return new ResolvedDocument(
                linked,
                labels.asMap(),
                bibliography,
                footnotes,
                numbering.sectionNumbers(),
                numbering.envNumbers(),
                CitationValidator.citationOrder(linked),
                unknownCitations,
                warnings);
    }

    @Override
    public void setVerbosity(int level) {
        log.setLevel(level);
    }

    private static void failOnErrors(DiagnosticsEngine diagnostics) throws ResolutionException {
        if (diagnostics.hasErrors()) {
            CompilerErrorCode code = diagnostics.firstError().map(Diagnostic::code).orElse(CompilerErrorCode.UNKNOWN_ERROR);
            throw new ResolutionException(code, diagnostics.summary());
        }
    }
}
