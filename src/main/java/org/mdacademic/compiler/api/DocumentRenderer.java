package org.mdacademic.compiler.api;

/**
 * A consumer of fully resolved documents. Implementations read the document and its side tables
 * and must not modify them.
 */
public interface DocumentRenderer {

    /**
     * Renders the document to the given target.
     *
     * @param document The resolved document.
     * @param out The output target.
     * @throws RenderException if the output cannot be produced or written.
     */
    void render(ResolvedDocument document, Appendable out) throws RenderException;
}
