package org.mdacademic.compiler.frontend.lexer;

/**
 * Represents a single token recognized by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The principal text of the token (content, keyword or id, depending on the type).
 * @param value The processed value of the token (e.g., the heading level). May be null.
 * @param rest The unconsumed input following the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        String rest
) {
    /**
     * @param input The input the token was recognized from.
     * @return How many characters of {@code input} the token consumed.
     */
    public int consumed(String input) {
        return input.length() - rest.length();
    }
}
