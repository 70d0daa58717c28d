package org.scriptweaver.compiler.graph;

import java.util.List;

/**
 * A user-authored node graph describing per-frame behavior.
 * Node and connection order is authoring order and carries no meaning beyond tie-breaking.
 *
 * @param id          The script id.
 * @param name        The script name.
 * @param nodes       The nodes.
 * @param connections The connections between node ports.
 */
public record VisualScript(String id, String name, List<Node> nodes, List<Connection> connections) {

    public VisualScript {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
