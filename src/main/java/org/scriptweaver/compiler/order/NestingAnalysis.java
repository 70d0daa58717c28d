package org.scriptweaver.compiler.order;

import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.api.CycleDetectedException;
import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.graph.Connection;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.ScriptGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a graph into top-level nodes and nodes nested in the bodies of branch/loop nodes,
 * and derives the ordering constraints among the top-level nodes.
 * <p>
 * A node is nested when it is the target of a body connection, i.e. a connection leaving one of
 * the {@link org.scriptweaver.compiler.catalog.NodeDefinition#bodyHandles() body handles} of its
 * source. A dependency that touches a nested node is lifted to the outermost top-level container(s)
 * of that node.
 */
public final class NestingAnalysis {

    private final ScriptGraph graph;
    private final NodeCatalog catalog;
    private final Map<String, List<String>> containersOf = new LinkedHashMap<>();
    private final Map<String, Set<String>> rootsCache = new HashMap<>();
    private final List<Node> topLevel = new ArrayList<>();
    private final List<OrderingEdge> edges = new ArrayList<>();

    private NestingAnalysis(ScriptGraph graph, NodeCatalog catalog) {
        this.graph = graph;
        this.catalog = catalog;
    }

    /**
     * Analyzes the graph.
     *
     * @param graph   The validated graph.
     * @param catalog The node catalog providing body handles.
     * @return The analysis result.
     * @throws CycleDetectedException if a container is nested inside its own body.
     */
    public static NestingAnalysis analyze(ScriptGraph graph, NodeCatalog catalog) throws CycleDetectedException {
        NestingAnalysis analysis = new NestingAnalysis(graph, catalog);
        analysis.run();
        return analysis;
    }

    private void run() throws CycleDetectedException {
        for (Connection c : graph.allConnections()) {
            if (isBodyConnection(c)) {
                containersOf.computeIfAbsent(c.target(), k -> new ArrayList<>()).add(c.source());
            }
        }
        for (Node node : graph.allNodes()) {
            if (!containersOf.containsKey(node.id())) {
                topLevel.add(node);
            }
        }
        // every nested node must hang below some top-level container
        for (String nestedId : containersOf.keySet()) {
            topLevelOwners(nestedId);
        }
        for (Connection c : graph.allConnections()) {
            if (isBodyConnection(c)) continue;
            for (String from : topLevelOwners(c.source())) {
                for (String to : topLevelOwners(c.target())) {
                    if (!from.equals(to)) {
                        edges.add(new OrderingEdge(from, to));
                    }
                }
            }
        }
    }

    /**
     * @param c A connection of the analyzed graph.
     * @return {@code true} if the connection leaves a body handle of its source; connections from
     *         the plain output never do.
     */
    public boolean isBodyConnection(Connection c) {
        return c.sourceHandle() != null
                && catalog.bodyHandles(graph.requireNode(c.source()).type()).contains(c.sourceHandle());
    }

    /**
     * @param nodeId The node id.
     * @return {@code true} if the node only appears inside a branch/loop body.
     */
    public boolean isNested(String nodeId) {
        return containersOf.containsKey(nodeId);
    }

    /**
     * @return The top-level nodes in authoring order.
     */
    public List<Node> topLevelNodes() {
        return List.copyOf(topLevel);
    }

    /**
     * @return The ordering constraints among top-level nodes, in connection order.
     */
    public List<OrderingEdge> orderingEdges() {
        return List.copyOf(edges);
    }

    private Set<String> topLevelOwners(String nodeId) throws CycleDetectedException {
        if (!isNested(nodeId)) {
            return Set.of(nodeId);
        }
        return roots(nodeId, new LinkedHashSet<>());
    }

    private Set<String> roots(String nodeId, LinkedHashSet<String> path) throws CycleDetectedException {
        Set<String> cached = rootsCache.get(nodeId);
        if (cached != null) return cached;
        if (!path.add(nodeId)) {
            throw new CycleDetectedException(CompilerErrorCode.NESTING_CYCLE, new ArrayList<>(path),
                    "Node '" + nodeId + "' is nested inside its own body: " + path);
        }
        Set<String> result = new LinkedHashSet<>();
        for (String container : containersOf.get(nodeId)) {
            if (isNested(container)) {
                result.addAll(roots(container, path));
            } else {
                result.add(container);
            }
        }
        path.remove(nodeId);
        rootsCache.put(nodeId, result);
        return result;
    }
}
