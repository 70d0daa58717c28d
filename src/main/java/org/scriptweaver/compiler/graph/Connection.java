package org.scriptweaver.compiler.graph;

/**
 * A directed edge from an output port of one node to an input port of another.
 *
 * @param id           The connection id.
 * @param source       The producing node.
 * @param sourceHandle The output port on the producer.
 * @param target       The consuming node.
 * @param targetHandle The input port on the consumer.
 */
public record Connection(String id, String source, String sourceHandle, String target, String targetHandle) {

    /**
     * @return The key of the producing output port.
     */
    public PortKey sourcePort() {
        return new PortKey(source, sourceHandle);
    }

    /**
     * @return The key of the consuming input port.
     */
    public PortKey targetPort() {
        return new PortKey(target, targetHandle);
    }
}
