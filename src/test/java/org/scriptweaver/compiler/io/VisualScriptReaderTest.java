package org.scriptweaver.compiler.io;

import org.scriptweaver.compiler.Compiler;
import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.graph.Connection;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.VisualScript;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VisualScriptReaderTest {

    private final VisualScriptReader reader = new VisualScriptReader();

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(VisualScriptReaderTest.class.getResource("/scripts/" + name).toURI());
    }

    @Test
    @Tag("unit")
    void readsNodesConnectionsAndData() throws Exception {
        VisualScript script = reader.read(fixture("collision-damage.json"));

        assertEquals("script-7", script.id());
        assertEquals("collision damage", script.name());
        assertThat(script.nodes()).extracting(Node::id).containsExactly("hit", "health", "damage", "store");
        assertThat(script.nodes().get(0).displayName()).isEqualTo("On Collision");
        assertThat(script.nodes().get(1).stringData("componentType")).contains("Health");
        assertThat(script.connections().get(0))
                .isEqualTo(new Connection("c1", "hit", "a", "health", "entity"));
    }

    @Test
    @Tag("unit")
    void readsComponentLists() throws Exception {
        VisualScript script = reader.read(fixture("movement.json"));

        Node query = script.nodes().get(1);
        assertThat(query.stringListData("components")).contains(List.of("Transform", "Velocity"));
        assertThat(script.nodes().get(0).data()).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingFileIsAnIoError() {
        CompilationException ex = assertThrows(CompilationException.class,
                () -> reader.read(Path.of("does", "not", "exist.json")));

        assertEquals(CompilerErrorCode.IO_ERROR_READING_SCRIPT, ex.getErrorCode());
    }

    @Test
    @Tag("unit")
    void nodeWithoutIdIsRejected() {
        CompilationException ex = assertThrows(CompilationException.class, () -> reader.read(fixture("not-a-script.json")));

        assertEquals(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT, ex.getErrorCode());
        assertThat(ex.getMessage()).contains("Node #0");
    }

    @Test
    @Tag("unit")
    void brokenJsonIsRejected() {
        CompilationException ex = assertThrows(CompilationException.class, () -> reader.fromJson("{ \"nodes\": [ "));

        assertEquals(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT, ex.getErrorCode());
    }

    @Test
    @Tag("unit")
    void connectionWithoutIdGetsPositionalId() throws Exception {
        VisualScript script = reader.fromJson("""
                { "name": "s",
                  "nodes": [ { "id": "a", "type": "math/add" }, { "id": "b", "type": "math/add" } ],
                  "connections": [ { "source": "a", "sourceHandle": "result", "target": "b", "targetHandle": "a" } ] }
                """);

        assertEquals("connection-0", script.connections().get(0).id());
    }

    @Test
    @Tag("unit")
    void connectionWithoutSourceHandleReadsAndCompiles() throws Exception {
        VisualScript script = reader.fromJson("""
                { "name": "s",
                  "nodes": [ { "id": "u", "type": "event/update" }, { "id": "m", "type": "math/multiply" } ],
                  "connections": [ { "id": "c1", "source": "u", "target": "m", "targetHandle": "a" } ] }
                """);

        assertThat(script.connections().get(0).sourceHandle()).isNull();
        CompiledSystem compiled = new Compiler().compile(script);
        assertThat(compiled.code()).contains("let result_m = dt * 0.0;");
    }
}
