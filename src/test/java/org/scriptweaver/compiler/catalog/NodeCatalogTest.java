package org.scriptweaver.compiler.catalog;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class NodeCatalogTest {

    private final NodeCatalog catalog = NodeCatalog.standard();

    @Test
    @Tag("unit")
    void portTypesDriveDefaultLiterals() {
        assertEquals("0.0", catalog.inputType(NodeCatalog.MATH_MULTIPLY, "b").defaultLiteral("m", "b"));
        assertEquals("false", catalog.inputType(NodeCatalog.FLOW_IF, "condition").defaultLiteral("i", "condition"));
        assertEquals("unresolved!(\"g.entity\")", catalog.inputType(NodeCatalog.COMPONENT_GET, "entity").defaultLiteral("g", "entity"));
    }

    @Test
    @Tag("unit")
    void undeclaredPortsAndUnknownTypesAreAny() {
        assertEquals(PortType.ANY, catalog.inputType(NodeCatalog.MATH_ADD, "c"));
        assertEquals(PortType.ANY, catalog.inputType("ai/behavior_tree", "a"));
        assertThat(catalog.find("ai/behavior_tree")).isEmpty();
    }

    @Test
    @Tag("unit")
    void containersDeclareTheirBodyHandles() {
        assertThat(catalog.bodyHandles(NodeCatalog.FLOW_IF)).containsExactly("then", "else");
        assertThat(catalog.bodyHandles(NodeCatalog.FLOW_FOREACH)).containsExactly("body");
        assertThat(catalog.bodyHandles(NodeCatalog.MATH_ADD)).isEmpty();
        assertThat(catalog.find(NodeCatalog.FLOW_IF).orElseThrow().isContainer()).isTrue();
    }

    @Test
    @Tag("unit")
    void onlyCollisionOpensAnEventScope() {
        List<String> openers = catalog.definitions().stream()
                .filter(NodeDefinition::opensEventScope)
                .map(NodeDefinition::type)
                .toList();

        assertThat(openers).containsExactly(NodeCatalog.EVENT_COLLISION);
        assertThat(catalog.opensEventScope("unknown/type")).isFalse();
    }

    @Test
    @Tag("unit")
    void capabilitiesOfExternalSubsystems() {
        assertThat(catalog.find(NodeCatalog.PHYSICS_RAYCAST).flatMap(NodeDefinition::capabilityName)).contains("physics");
        assertThat(catalog.find(NodeCatalog.AUDIO_PLAY).flatMap(NodeDefinition::capabilityName)).contains("audio");
        assertThat(catalog.find(NodeCatalog.MATH_ADD).flatMap(NodeDefinition::capabilityName)).isEmpty();
    }

    @Test
    @Tag("unit")
    void registerReplacesDefinition() {
        NodeCatalog custom = NodeCatalog.standard();
        custom.register(new NodeDefinition(NodeCatalog.AUDIO_PLAY, "audio",
                List.of(new PortDefinition("clip", PortType.NUMBER)), List.of(), List.of(), false, "sound"));

        assertEquals(PortType.NUMBER, custom.inputType(NodeCatalog.AUDIO_PLAY, "clip"));
        assertThat(custom.find(NodeCatalog.AUDIO_PLAY).flatMap(NodeDefinition::capabilityName)).contains("sound");
    }
}
