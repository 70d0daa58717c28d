package org.scriptweaver.compiler.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup structure over the connections of a graph.
 * <p>
 * The forward index maps an output port to every connection leaving it, in declaration order.
 * The reverse index maps an input port to the connection feeding it; if an input has several
 * connections the first declared one wins.
 */
public final class ConnectionIndex {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionIndex.class);

    private final Map<PortKey, List<Connection>> byOutput = new LinkedHashMap<>();
    private final Map<String, List<Connection>> bySource = new HashMap<>();
    private final Map<PortKey, Connection> byInput = new HashMap<>();

    /**
     * @param connections The connections to index, in declaration order.
     */
    public ConnectionIndex(List<Connection> connections) {
        for (Connection c : connections) {
            byOutput.computeIfAbsent(c.sourcePort(), k -> new ArrayList<>()).add(c);
            bySource.computeIfAbsent(c.source(), k -> new ArrayList<>()).add(c);
            Connection previous = byInput.putIfAbsent(c.targetPort(), c);
            if (previous != null) {
                LOG.debug("Input {} has several connections, keeping '{}' and ignoring '{}'",
                        c.targetPort(), previous.id(), c.id());
            }
        }
    }

    /**
     * @param graph The graph whose connections are indexed.
     * @return A new index.
     */
    public static ConnectionIndex of(ScriptGraph graph) {
        return new ConnectionIndex(graph.allConnections());
    }

    /**
     * Returns all connections leaving the given output port.
     *
     * @param sourceNodeId The producer.
     * @param sourceHandle The output port, e.g. {@code then} for the synthetic {@code <id>_then} handle.
     * @return The connections in declaration order, possibly empty.
     */
    public List<Connection> outgoing(String sourceNodeId, String sourceHandle) {
        List<Connection> list = byOutput.get(new PortKey(sourceNodeId, sourceHandle));
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * Returns all connections leaving any port of the given node.
     *
     * @param sourceNodeId The producer.
     * @return The connections in declaration order, possibly empty.
     */
    public List<Connection> outgoingFrom(String sourceNodeId) {
        List<Connection> list = bySource.get(sourceNodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * Finds the connection feeding the given input port.
     *
     * @param targetNodeId The consumer.
     * @param targetHandle The input port.
     * @return The connection, if the input is connected.
     */
    public Optional<Connection> incoming(String targetNodeId, String targetHandle) {
        return Optional.ofNullable(byInput.get(new PortKey(targetNodeId, targetHandle)));
    }
}
