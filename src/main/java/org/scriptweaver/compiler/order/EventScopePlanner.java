package org.scriptweaver.compiler.order;

import org.scriptweaver.compiler.graph.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns a topological order into an emission schedule in which every scope-opening event
 * (e.g. a collision event iterating over collision pairs) is directly followed by all of its
 * dependents, so the scope can be closed after the last of them.
 * <p>
 * For an event {@code E}, the nodes after it are partitioned into its descendants, the
 * non-descendants that some descendant depends on (hoisted in front of {@code E}), and the rest
 * (emitted after the scope). Relative order inside each group is preserved, so the schedule is
 * still a valid topological order. Events nested in a scope are planned recursively. Another
 * event feeding a descendant of {@code E} is moved into the scope of {@code E} with its own
 * descendants, so both loops enclose the shared dependents.
 */
public final class EventScopePlanner {

    private final Map<String, List<String>> successors = new HashMap<>();
    private final Map<String, Set<String>> reachableCache = new HashMap<>();
    private final Predicate<Node> opensScope;

    private EventScopePlanner(List<OrderingEdge> edges, Predicate<Node> opensScope) {
        this.opensScope = opensScope;
        for (OrderingEdge e : edges) {
            successors.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e.to());
        }
    }

    /**
     * Builds the emission schedule.
     *
     * @param order      Top-level nodes in topological order.
     * @param edges      The ordering constraints the order was computed from.
     * @param opensScope Tells which nodes open an event scope.
     * @return The schedule, containing every node of {@code order} exactly once.
     */
    public static List<ScheduledNode> plan(List<Node> order, List<OrderingEdge> edges, Predicate<Node> opensScope) {
        return new EventScopePlanner(edges, opensScope).arrange(order);
    }

    private List<ScheduledNode> arrange(List<Node> segment) {
        List<ScheduledNode> result = new ArrayList<>();
        List<Node> remaining = new ArrayList<>(segment);
        while (!remaining.isEmpty()) {
            Node head = remaining.remove(0);
            if (!opensScope.test(head)) {
                result.add(new ScheduledNode(head, 0));
                continue;
            }

            Set<String> insideIds = scopeMembers(head, remaining);
            List<Node> inside = new ArrayList<>();
            for (Node n : remaining) {
                if (insideIds.contains(n.id())) {
                    inside.add(n);
                }
            }
            List<Node> hoisted = new ArrayList<>();
            List<Node> after = new ArrayList<>();
            for (Node n : remaining) {
                if (insideIds.contains(n.id())) continue;
                if (!Collections.disjoint(reachable(n.id()), insideIds)) {
                    hoisted.add(n);
                } else {
                    after.add(n);
                }
            }

            result.addAll(arrange(hoisted));
            List<ScheduledNode> body = arrange(inside);
            if (body.isEmpty()) {
                result.add(new ScheduledNode(head, 1));
            } else {
                result.add(new ScheduledNode(head, 0));
                int last = body.size() - 1;
                body.set(last, body.get(last).closingOneMore());
                result.addAll(body);
            }
            remaining = after;
        }
        return result;
    }

    /**
     * Collects the nodes of {@code remaining} that must be emitted inside the scope of {@code head}:
     * its descendants, plus every other scope-opening node feeding one of them together with that
     * node's own descendants. The scope of such a node nests inside the scope of {@code head}.
     */
    private Set<String> scopeMembers(Node head, List<Node> remaining) {
        Set<String> members = new HashSet<>();
        Set<String> descendants = reachable(head.id());
        for (Node n : remaining) {
            if (descendants.contains(n.id())) {
                members.add(n.id());
            }
        }
        boolean grown = true;
        while (grown) {
            grown = false;
            for (Node n : remaining) {
                if (members.contains(n.id()) || !opensScope.test(n)) continue;
                Set<String> fromEvent = reachable(n.id());
                if (Collections.disjoint(fromEvent, members)) continue;
                members.add(n.id());
                for (Node m : remaining) {
                    if (fromEvent.contains(m.id())) {
                        members.add(m.id());
                    }
                }
                grown = true;
            }
        }
        return members;
    }

    private Set<String> reachable(String id) {
        Set<String> cached = reachableCache.get(id);
        if (cached != null) return cached;
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(successors.getOrDefault(id, List.of()));
        while (!work.isEmpty()) {
            String next = work.poll();
            if (seen.add(next)) {
                work.addAll(successors.getOrDefault(next, List.of()));
            }
        }
        reachableCache.put(id, seen);
        return seen;
    }
}
