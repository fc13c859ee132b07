package org.mdacademic.compiler.api;

/**
 * Thrown when the source cannot be parsed. Only malformed front matter reaches this point;
 * block and inline syntax always has a literal-text fallback.
 */
public class ParseException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public ParseException(CompilerErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The underlying parser failure.
     */
    public ParseException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
