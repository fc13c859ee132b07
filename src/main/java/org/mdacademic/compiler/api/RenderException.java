package org.mdacademic.compiler.api;

/**
 * Thrown by a {@link DocumentRenderer} when the output format fails.
 * <p>
 * Not a {@link CompilationException}, so callers can tell a broken document
 * from a broken output channel.
 */
public class RenderException extends Exception {

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
