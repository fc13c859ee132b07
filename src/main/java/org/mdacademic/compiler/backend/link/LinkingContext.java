package org.mdacademic.compiler.backend.link;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.frontend.semantics.LabelRegistry;

import java.util.Map;

/**
 * What the linking rules resolve references against.
 *
 * @param labels The document's labels.
 * @param bibliography The loaded bibliography by key.
 */
public record LinkingContext(LabelRegistry labels, Map<String, BibEntry> bibliography) {
}
