package org.mdacademic.compiler.backend.notes;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.TreeWalker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.Footnote;
import org.mdacademic.compiler.frontend.parser.ast.FootnoteDefinition;
import org.mdacademic.compiler.frontend.parser.ast.FootnoteReference;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Gathers footnote bodies in document order.
 * <p>
 * Inline footnotes {@code ^[...]} receive the ids {@code fn-1}, {@code fn-2}, ... in order of
 * appearance, skipping any id a named definition uses anywhere in the document; named definitions {@code [^id]: ...} are stored under their own id. A second definition
 * of an id is ignored with a {@link CompilerErrorCode#DUPLICATE_FOOTNOTE} warning. References to ids
 * that are never defined are reported as {@link CompilerErrorCode#UNDEFINED_FOOTNOTE}.
 */
public class FootnoteCollector {

    private static final Logger LOG = LoggerFactory.getLogger(FootnoteCollector.class);

    private final DiagnosticsEngine diagnostics;
    private final boolean strict;

    /**
     * Constructs a new footnote collector.
     * @param diagnostics The engine for reporting duplicate and undefined footnotes.
     * @param strict Whether undefined footnote references are errors.
     */
    public FootnoteCollector(DiagnosticsEngine diagnostics, boolean strict) {
        this.diagnostics = diagnostics;
        this.strict = strict;
    }

    /**
     * Collects all footnotes of a document.
     * @param document The document.
     * @return Footnote bodies by id, in document order.
     */
    public Map<String, List<Inline>> collect(Document document) {
        Map<String, List<Inline>> footnotes = new LinkedHashMap<>();
        Set<String> referenced = new LinkedHashSet<>();
        Set<String> named = namedIds(document);
        int[] counter = {0};

        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(Footnote.class, node -> {
            String id;
            do {
                id = "fn-" + (++counter[0]);
            } while (named.contains(id) || footnotes.containsKey(id));
            footnotes.put(id, ((Footnote) node).content());
        });
        handlers.put(FootnoteDefinition.class, node -> {
            FootnoteDefinition definition = (FootnoteDefinition) node;
            if (footnotes.containsKey(definition.id())) {
                diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_FOOTNOTE,
                        "Footnote '" + definition.id() + "' is defined more than once; keeping the first definition.",
                        definition.id());
            } else {
                footnotes.put(definition.id(), definition.content());
            }
        });
        handlers.put(FootnoteReference.class, node -> referenced.add(((FootnoteReference) node).id()));
        new TreeWalker(handlers).walk(document.blocks());

        for (String id : referenced) {
            if (!footnotes.containsKey(id)) {
                diagnostics.report(strict, CompilerErrorCode.UNDEFINED_FOOTNOTE,
                        "Footnote '" + id + "' is referenced but never defined.", id);
            }
        }
        LOG.debug("{} footnote(s)", footnotes.size());
        return footnotes;
    }

    private static Set<String> namedIds(Document document) {
        Set<String> ids = new HashSet<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(FootnoteDefinition.class, node -> ids.add(((FootnoteDefinition) node).id()));
        new TreeWalker(handlers).walk(document.blocks());
        return ids;
    }
}
