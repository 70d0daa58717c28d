package org.scriptweaver.compiler.order;

import org.scriptweaver.compiler.graph.Node;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

public class EventScopePlannerTest {

    private static final Predicate<Node> IS_EVENT = n -> n.type().equals("scope");

    private static List<String> render(List<ScheduledNode> schedule) {
        return schedule.stream().map(s -> s.node().id() + ":" + s.closingScopes()).toList();
    }

    @Test
    @Tag("unit")
    void plainOrderIsUnchanged() {
        List<Node> order = List.of(Node.of("a", "x"), Node.of("b", "x"));

        assertThat(render(EventScopePlanner.plan(order, List.of(new OrderingEdge("a", "b")), IS_EVENT)))
                .containsExactly("a:0", "b:0");
    }

    @Test
    @Tag("unit")
    void dependentsFollowTheEventAndCloseItsScope() {
        List<Node> order = List.of(Node.of("e", "scope"), Node.of("free", "x"), Node.of("d1", "x"), Node.of("d2", "x"));
        List<OrderingEdge> edges = List.of(new OrderingEdge("e", "d1"), new OrderingEdge("d1", "d2"));

        assertThat(render(EventScopePlanner.plan(order, edges, IS_EVENT)))
                .containsExactly("e:0", "d1:0", "d2:1", "free:0");
    }

    @Test
    @Tag("unit")
    void prerequisitesOfDependentsAreHoisted() {
        List<Node> order = List.of(Node.of("e", "scope"), Node.of("pre", "x"), Node.of("d", "x"));
        List<OrderingEdge> edges = List.of(new OrderingEdge("e", "d"), new OrderingEdge("pre", "d"));

        assertThat(render(EventScopePlanner.plan(order, edges, IS_EVENT)))
                .containsExactly("pre:0", "e:0", "d:1");
    }

    @Test
    @Tag("unit")
    void nestedEventsCloseInnermostFirst() {
        List<Node> order = List.of(Node.of("outer", "scope"), Node.of("inner", "scope"), Node.of("leaf", "x"));
        List<OrderingEdge> edges = List.of(new OrderingEdge("outer", "inner"), new OrderingEdge("inner", "leaf"));

        assertThat(render(EventScopePlanner.plan(order, edges, IS_EVENT)))
                .containsExactly("outer:0", "inner:0", "leaf:2");
    }

    @Test
    @Tag("unit")
    void eventWithoutDependentsClosesItself() {
        List<Node> order = List.of(Node.of("e", "scope"), Node.of("a", "x"));

        assertThat(render(EventScopePlanner.plan(order, List.of(), IS_EVENT)))
                .containsExactly("e:1", "a:0");
    }

    @Test
    @Tag("unit")
    void eventFeedingAnotherEventsDependentIsNestedNotHoisted() {
        List<Node> order = List.of(Node.of("e1", "scope"), Node.of("e2", "scope"), Node.of("x", "x"), Node.of("free", "x"));
        List<OrderingEdge> edges = List.of(new OrderingEdge("e1", "x"), new OrderingEdge("e2", "x"));

        assertThat(render(EventScopePlanner.plan(order, edges, IS_EVENT)))
                .containsExactly("e1:0", "e2:0", "x:2", "free:0");
    }

    @Test
    @Tag("unit")
    void nestedEventBringsItsOwnDependentsIntoTheOuterScope() {
        List<Node> order = List.of(Node.of("e1", "scope"), Node.of("e2", "scope"), Node.of("y", "x"), Node.of("x", "x"), Node.of("z", "x"));
        List<OrderingEdge> edges = List.of(new OrderingEdge("e1", "x"), new OrderingEdge("e2", "y"),
                new OrderingEdge("y", "x"), new OrderingEdge("e2", "z"));

        assertThat(render(EventScopePlanner.plan(order, edges, IS_EVENT)))
                .containsExactly("e1:0", "e2:0", "y:0", "x:0", "z:2");
    }
}
