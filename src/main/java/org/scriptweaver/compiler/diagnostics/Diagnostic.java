package org.scriptweaver.compiler.diagnostics;

/**
 * Represents a single non-fatal diagnostic (warning, notice) raised while
 * compiling a visual script.
 *
 * @param type The severity of the diagnostic.
 * @param code The machine-readable kind of the diagnostic.
 * @param message The human-readable message.
 * @param nodeId The id of the node the diagnostic refers to.
 * @param port The port involved, or {@code null} if the diagnostic concerns the whole node.
 */
public record Diagnostic(
        Type type,
        Code code,
        String message,
        String nodeId,
        String port
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** A condition the output was adjusted for. */
        WARNING,
        /** An informational notice. */
        INFO
    }

    /**
     * The kind of condition that was detected.
     */
    public enum Code {
        /** An input port had no connection, or its producer was not bound; a default literal was used. */
        UNRESOLVED_INPUT,
        /** The node type is not known to this compiler version; a placeholder was emitted. */
        UNKNOWN_NODE_TYPE
    }

    @Override
    public String toString() {
        String location = port == null ? nodeId : nodeId + "." + port;
        return String.format("[%s] %s %s: %s", type, code, location, message);
    }
}
