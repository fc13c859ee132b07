package org.mdacademic.compiler.api;

/**
 * An exception that is thrown when a document cannot be compiled.
 * <p>
 * It is part of the public API and is the common supertype of {@link ParseException}
 * and {@link ResolutionException}. Both mean "the document has a problem", as opposed to
 * {@link RenderException}, which means the output format failed.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(CompilerErrorCode.UNKNOWN_ERROR, message, null);
    }

    /**
     * Constructs a new compilation exception with the specified error code and detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Constructs a new compilation exception with the specified error code, detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The error code classifying this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}
