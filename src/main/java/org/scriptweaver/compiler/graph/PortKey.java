package org.scriptweaver.compiler.graph;

/**
 * Identifies a port on a node. A {@code null} handle denotes the node's plain output.
 *
 * @param nodeId The node id.
 * @param handle The port name, or {@code null}.
 */
public record PortKey(String nodeId, String handle) {

    /**
     * @param nodeId The node id.
     * @return The key of the node's plain output.
     */
    public static PortKey plain(String nodeId) {
        return new PortKey(nodeId, null);
    }

    /**
     * Renders the key the way graph editors name synthetic handles, e.g. {@code if1_then}.
     * @return The synthetic handle name.
     */
    public String syntheticName() {
        return handle == null ? nodeId : nodeId + "_" + handle;
    }

    @Override
    public String toString() {
        return syntheticName();
    }
}
