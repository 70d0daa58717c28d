package org.scriptweaver.compiler.order;

import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.api.CycleDetectedException;
import org.scriptweaver.compiler.graph.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders nodes by their dependencies using Kahn's algorithm.
 * <p>
 * The queue is seeded with the zero in-degree nodes in the order the nodes were given, and
 * nodes becoming ready are appended in edge order, so authoring order is the only tie-break.
 * Edges whose endpoints are not among the given nodes, and self-edges, are ignored.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {}

    /**
     * Sorts the nodes so that for every edge {@code from -> to} the {@code from} node comes first.
     *
     * @param nodes The nodes to sort, in authoring order.
     * @param edges The ordering constraints among them.
     * @return The nodes in dependency order; always the same size as {@code nodes}.
     * @throws CycleDetectedException if the edges form a cycle; lists every node left with a nonzero in-degree.
     */
    public static List<Node> sort(List<Node> nodes, List<OrderingEdge> edges) throws CycleDetectedException {
        Map<String, Node> byId = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (Node node : nodes) {
            byId.put(node.id(), node);
            inDegree.put(node.id(), 0);
            successors.put(node.id(), new ArrayList<>());
        }

        for (OrderingEdge edge : edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to()) || edge.from().equals(edge.to())) {
                continue;
            }
            successors.get(edge.from()).add(edge.to());
            inDegree.merge(edge.to(), 1, Integer::sum);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        List<Node> sorted = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            sorted.add(byId.get(id));
            for (String next : successors.get(id)) {
                int degree = inDegree.merge(next, -1, Integer::sum);
                if (degree == 0) {
                    queue.add(next);
                }
            }
        }

        if (sorted.size() < byId.size()) {
            List<String> unresolved = new ArrayList<>();
            inDegree.forEach((id, degree) -> {
                if (degree > 0) unresolved.add(id);
            });
            throw new CycleDetectedException(CompilerErrorCode.CYCLE_DETECTED, unresolved,
                    "Dependency cycle detected, unresolved nodes: " + unresolved);
        }
        return sorted;
    }
}
