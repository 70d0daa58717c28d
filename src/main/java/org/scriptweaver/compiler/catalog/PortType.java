package org.scriptweaver.compiler.catalog;

/**
 * Advisory value type of a port. Types are not verified across connections; they only decide
 * which literal stands in for an unconnected input.
 */
public enum PortType {
    NUMBER,
    BOOLEAN,
    ENTITY,
    COMPONENT,
    COLLECTION,
    ANY;

    /**
     * Returns the literal emitted when an input of this type cannot be resolved.
     *
     * @param nodeId The consuming node.
     * @param port   The input port.
     * @return The default literal.
     */
    public String defaultLiteral(String nodeId, String port) {
        return switch (this) {
            case NUMBER -> "0.0";
            case BOOLEAN -> "false";
            default -> "unresolved!(\"" + nodeId + "." + port + "\")";
        };
    }
}
