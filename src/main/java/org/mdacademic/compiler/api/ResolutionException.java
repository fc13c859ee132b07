package org.mdacademic.compiler.api;

/**
 * Thrown when a parsed document cannot be resolved: a duplicate label, an unreadable bibliography,
 * or an unknown reference or citation under strict configuration.
 */
public class ResolutionException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public ResolutionException(CompilerErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ResolutionException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
