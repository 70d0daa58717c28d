package org.scriptweaver.compiler.graph;

import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.api.MalformedGraphException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.scriptweaver.compiler.ScriptFixtures.node;
import static org.scriptweaver.compiler.ScriptFixtures.script;
import static org.scriptweaver.compiler.ScriptFixtures.wire;

public class ScriptGraphTest {

    @Test
    @Tag("unit")
    void exposesNodesAndConnectionsInAuthoringOrder() throws Exception {
        ScriptGraph graph = ScriptGraph.of(script("movement",
                List.of(node("b", "math/add"), node("a", "math/add")),
                List.of(wire("a", "result", "b", "a"))));

        assertThat(graph.name()).isEqualTo("movement");
        assertThat(graph.allNodes()).extracting(Node::id).containsExactly("b", "a");
        assertThat(graph.allConnections()).hasSize(1);
        assertThat(graph.nodeById("a")).isPresent();
        assertThat(graph.nodeById("missing")).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingSourceIsReportedWithConnectionId() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class, () -> ScriptGraph.of(script(
                List.of(node("b", "math/add")),
                List.of(wire("nowhere", "result", "b", "a")))));

        assertEquals(CompilerErrorCode.MALFORMED_GRAPH, ex.getErrorCode());
        assertEquals("nowhere.result->b.a", ex.getConnectionId());
        assertThat(ex.getMessage()).contains("missing source node 'nowhere'");
    }

    @Test
    @Tag("unit")
    void duplicateNodeIdIsRejected() {
        MalformedGraphException ex = assertThrows(MalformedGraphException.class, () -> ScriptGraph.of(script(
                List.of(node("a", "math/add"), node("a", "math/multiply")),
                List.of())));

        assertEquals(CompilerErrorCode.DUPLICATE_NODE_ID, ex.getErrorCode());
    }

    @Test
    @Tag("unit")
    void requireNodeFailsLoudlyForUnknownId() throws Exception {
        ScriptGraph graph = ScriptGraph.of(script(List.of(node("a", "math/add")), List.of()));

        assertThrows(IllegalArgumentException.class, () -> graph.requireNode("zzz"));
    }

    @Test
    @Tag("unit")
    void nodeDataIsReadOnlyAndTyped() {
        Node n = node("n", "query/get_entities", Map.of("components", List.of("Health", 3, "Transform"), "label", "Enemies"));

        assertThat(n.stringListData("components")).contains(List.of("Health", "Transform"));
        assertThat(n.stringData("componentType")).isEmpty();
        assertThat(n.displayName()).isEqualTo("Enemies");
        assertThrows(UnsupportedOperationException.class, () -> n.data().put("x", 1));
    }
}
