package org.mdacademic.compiler.api;

import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Inline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The output of resolution: a document in which every reference carries its display text, together
 * with everything a renderer needs to lay it out.
 *
 * @param document The resolved document.
 * @param labels Every defined label, in definition order.
 * @param citations The full bibliography, by key.
 * @param footnotes Footnote bodies by id, in document order.
 * @param sectionNumbers Dotted section numbers by heading label.
 * @param envNumbers Counter values by label of an equation, environment or table.
 * @param citationOrder Cited keys in order of first appearance.
 * @param unknownCitations Cited keys missing from the bibliography, sorted.
 * @param diagnostics Warnings collected while resolving.
 */
public record ResolvedDocument(
        Document document,
        Map<String, LabelInfo> labels,
        Map<String, BibEntry> citations,
        Map<String, List<Inline>> footnotes,
        Map<String, String> sectionNumbers,
        Map<String, Integer> envNumbers,
        List<String> citationOrder,
        Set<String> unknownCitations,
        List<Diagnostic> diagnostics
) {
    public ResolvedDocument {
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        citations = Collections.unmodifiableMap(new LinkedHashMap<>(citations));
        footnotes = Collections.unmodifiableMap(new LinkedHashMap<>(footnotes));
        sectionNumbers = Collections.unmodifiableMap(new LinkedHashMap<>(sectionNumbers));
        envNumbers = Collections.unmodifiableMap(new LinkedHashMap<>(envNumbers));
        citationOrder = List.copyOf(citationOrder);
        unknownCitations = Collections.unmodifiableSet(new LinkedHashSet<>(unknownCitations));
        diagnostics = List.copyOf(diagnostics);
    }
}
