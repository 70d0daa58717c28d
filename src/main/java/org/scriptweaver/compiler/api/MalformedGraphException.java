package org.scriptweaver.compiler.api;

/**
 * Thrown when the graph handed to the compiler is structurally invalid, e.g. a connection
 * points at a node that does not exist.
 */
public class MalformedGraphException extends CompilationException {

    private final String connectionId;

    /**
     * @param errorCode The specific validation failure.
     * @param connectionId The offending connection, or {@code null} if the failure is not tied to one.
     * @param message The detail message.
     */
    public MalformedGraphException(CompilerErrorCode errorCode, String connectionId, String message) {
        super(errorCode, message);
        this.connectionId = connectionId;
    }

    /**
     * @return The id of the offending connection, or {@code null}.
     */
    public String getConnectionId() {
        return connectionId;
    }
}
