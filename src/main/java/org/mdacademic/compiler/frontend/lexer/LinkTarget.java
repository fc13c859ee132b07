package org.mdacademic.compiler.frontend.lexer;

/**
 * The destination part of a link or image.
 *
 * @param url The URL.
 * @param title The title. May be null.
 */
public record LinkTarget(String url, String title) {
}
