package org.scriptweaver.compiler.graph;

import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.api.MalformedGraphException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, read-only view of a {@link VisualScript}.
 * <p>
 * Construction fails if node ids are not unique or if any connection references a node that
 * is not part of the script, so consumers never have to deal with dangling ids.
 */
public final class ScriptGraph {

    private final String name;
    private final Map<String, Node> nodesById;
    private final List<Node> nodes;
    private final List<Connection> connections;

    private ScriptGraph(String name, Map<String, Node> nodesById, List<Node> nodes, List<Connection> connections) {
        this.name = name;
        this.nodesById = nodesById;
        this.nodes = nodes;
        this.connections = connections;
    }

    /**
     * Validates the script and builds the graph view.
     *
     * @param script The script to wrap.
     * @return The validated graph.
     * @throws MalformedGraphException if a node id is duplicated or a connection references a missing node.
     */
    public static ScriptGraph of(VisualScript script) throws MalformedGraphException {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : script.nodes()) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new MalformedGraphException(CompilerErrorCode.DUPLICATE_NODE_ID, null,
                        "Duplicate node id '" + node.id() + "' in script '" + script.name() + "'");
            }
        }
        for (Connection c : script.connections()) {
            if (!byId.containsKey(c.source())) {
                throw new MalformedGraphException(CompilerErrorCode.MALFORMED_GRAPH, c.id(),
                        "Connection '" + c.id() + "' references missing source node '" + c.source() + "'");
            }
            if (!byId.containsKey(c.target())) {
                throw new MalformedGraphException(CompilerErrorCode.MALFORMED_GRAPH, c.id(),
                        "Connection '" + c.id() + "' references missing target node '" + c.target() + "'");
            }
        }
        return new ScriptGraph(script.name(), byId, script.nodes(), script.connections());
    }

    /**
     * @return The script name.
     */
    public String name() {
        return name;
    }

    /**
     * @param id The node id.
     * @return The node, if it is part of the graph.
     */
    public Optional<Node> nodeById(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * Returns a node that is known to exist, e.g. the endpoint of a validated connection.
     *
     * @param id The node id.
     * @return The node.
     * @throws IllegalArgumentException if no such node exists.
     */
    public Node requireNode(String id) {
        Node node = nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    /**
     * @return All nodes in authoring order.
     */
    public List<Node> allNodes() {
        return nodes;
    }

    /**
     * @return All connections in authoring order.
     */
    public List<Connection> allConnections() {
        return connections;
    }
}
