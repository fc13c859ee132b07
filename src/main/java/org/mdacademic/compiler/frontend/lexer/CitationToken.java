package org.mdacademic.compiler.frontend.lexer;

import java.util.List;

/**
 * The parsed content of a bracketed citation.
 *
 * @param keys The keys, in order.
 * @param prefix Text before the first key. May be null.
 * @param locator The first locator given. May be null.
 * @param suppressAuthor Whether the first key was written {@code -@key}.
 */
public record CitationToken(List<String> keys, String prefix, String locator, boolean suppressAuthor) {
}
