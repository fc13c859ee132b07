package org.mdacademic.compiler.frontend.parser.ast;

/**
 * An image, written {@code ![alt](url "title")}.
 *
 * @param url The image location.
 * @param alt The alternative text.
 * @param title The optional title. May be null.
 */
public record Image(String url, String alt, String title) implements Inline {
}
