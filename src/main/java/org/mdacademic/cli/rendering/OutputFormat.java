package org.mdacademic.cli.rendering;

import org.mdacademic.compiler.api.DocumentRenderer;

/**
 * Output formats of the {@code compile} command.
 */
public enum OutputFormat {
    /** A human-readable overview of labels, footnotes, citations and warnings. */
    SUMMARY,
    /** The complete resolved document as JSON. */
    JSON;

    /**
     * @return A renderer producing this format.
     */
    public DocumentRenderer createRenderer() {
        return this == JSON ? new JsonDocumentRenderer() : new SummaryRenderer();
    }
}
