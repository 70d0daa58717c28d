package org.scriptweaver.compiler.api;

/**
 * An exception that is thrown when a fatal error stops the compilation of a visual script.
 * <p>
 * It is part of the public API; no partial {@link CompiledSystem} exists once it has been thrown.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The code identifying the kind of failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}
