package org.mdacademic.compiler.backend.notes;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.TreeWalker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.Document;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Checks the citation keys of a document against the bibliography.
 */
public class CitationValidator {

    private final DiagnosticsEngine diagnostics;
    private final boolean strict;

    /**
     * @param diagnostics The engine for reporting unknown keys.
     * @param strict Whether unknown keys are errors.
     */
    public CitationValidator(DiagnosticsEngine diagnostics, boolean strict) {
        this.diagnostics = diagnostics;
        this.strict = strict;
    }

    /**
     * Reports every cited key that the bibliography lacks, once per key.
     * @param document The document after reference resolution.
     * @param bibliography The bibliography by key.
     * @return The unknown keys, sorted.
     */
    public SortedSet<String> validate(Document document, Map<String, BibEntry> bibliography) {
        SortedSet<String> unknown = new TreeSet<>();
        for (String key : citedKeys(document)) {
            if (!bibliography.containsKey(key)) {
                unknown.add(key);
                diagnostics.report(strict, CompilerErrorCode.UNKNOWN_CITATION,
                        "Unknown citation key '" + key + "'.", key);
            }
        }
        return unknown;
    }

    /**
     * @param document The document.
     * @return Every cited key, deduplicated and sorted.
     */
    public static SortedSet<String> citedKeys(Document document) {
        return new TreeSet<>(citationOrder(document));
    }

    /**
     * @param document The document.
     * @return Every cited key in order of first appearance.
     */
    public static List<String> citationOrder(Document document) {
        Set<String> keys = new LinkedHashSet<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(Citation.class, node -> keys.addAll(((Citation) node).keys()));
        new TreeWalker(handlers).walk(document.blocks());
        return new ArrayList<>(keys);
    }
}
