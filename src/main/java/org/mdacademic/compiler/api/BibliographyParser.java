package org.mdacademic.compiler.api;

import java.util.Map;

/**
 * Turns the text of a bibliography file into entries keyed by citation key.
 */
public interface BibliographyParser {

    /**
     * Parses bibliography source text.
     *
     * @param source The full file content.
     * @return The entries by key, in file order.
     * @throws ResolutionException if the text cannot be parsed.
     */
    Map<String, BibEntry> parse(String source) throws ResolutionException;
}
