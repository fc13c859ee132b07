package org.mdacademic.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A citation of one or more bibliography entries.
 *
 * @param keys The cited keys, in source order. Never empty.
 * @param style The citation style.
 * @param prefix Text before the first key inside the brackets, e.g. "see". May be null.
 * @param locator The locator, e.g. "p. 42". May be null.
 */
public record Citation(List<String> keys, CitationStyle style, String prefix, String locator) implements Inline {

    public Citation {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("A citation needs at least one key");
        }
    }
}
