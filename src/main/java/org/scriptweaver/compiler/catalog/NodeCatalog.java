package org.scriptweaver.compiler.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the node types known to this compiler version.
 * <p>
 * Unknown types are not an error here; callers decide how to degrade.
 */
public final class NodeCatalog {

    public static final String EVENT_UPDATE = "event/update";
    public static final String EVENT_COLLISION = "event/collision";
    public static final String QUERY_GET_ENTITIES = "query/get_entities";
    public static final String COMPONENT_GET = "component/get";
    public static final String COMPONENT_SET = "component/set";
    public static final String MATH_ADD = "math/add";
    public static final String MATH_SUBTRACT = "math/subtract";
    public static final String MATH_MULTIPLY = "math/multiply";
    public static final String MATH_DIVIDE = "math/divide";
    public static final String FLOW_IF = "flow/if";
    public static final String FLOW_FOREACH = "flow/foreach";
    public static final String PHYSICS_RAYCAST = "physics/raycast";
    public static final String AUDIO_PLAY = "audio/play";

    private final Map<String, NodeDefinition> byType = new LinkedHashMap<>();

    /**
     * Registers a node type, replacing any previous definition of the same type.
     * @param definition The definition.
     */
    public void register(NodeDefinition definition) {
        byType.put(definition.type(), definition);
    }

    /**
     * @param type The node type.
     * @return The definition, if the type is known.
     */
    public Optional<NodeDefinition> find(String type) {
        return Optional.ofNullable(byType.get(type));
    }

    /**
     * Resolves the advisory type of an input port. Undeclared ports are {@link PortType#ANY}.
     *
     * @param nodeType The node type.
     * @param port     The input port.
     * @return The port type.
     */
    public PortType inputType(String nodeType, String port) {
        return find(nodeType)
                .flatMap(d -> d.input(port))
                .map(PortDefinition::type)
                .orElse(PortType.ANY);
    }

    /**
     * @param nodeType The node type.
     * @return The nested body handles of the type, empty for non-containers and unknown types.
     */
    public List<String> bodyHandles(String nodeType) {
        return find(nodeType).map(NodeDefinition::bodyHandles).orElse(List.of());
    }

    /**
     * @param nodeType The node type.
     * @return {@code true} if nodes of this type open an enclosing event scope.
     */
    public boolean opensEventScope(String nodeType) {
        return find(nodeType).map(NodeDefinition::opensEventScope).orElse(false);
    }

    /**
     * @return All definitions in registration order.
     */
    public Collection<NodeDefinition> definitions() {
        return Collections.unmodifiableCollection(byType.values());
    }

    /**
     * Creates a catalog with the built-in node types.
     * @return A new catalog.
     */
    public static NodeCatalog standard() {
        NodeCatalog c = new NodeCatalog();
        c.register(new NodeDefinition(EVENT_UPDATE, "event",
                List.of(), List.of(port("dt", PortType.NUMBER)), List.of(), false, null));
        c.register(new NodeDefinition(EVENT_COLLISION, "event",
                List.of(), List.of(port("a", PortType.ENTITY), port("b", PortType.ENTITY)), List.of(), true, "physics"));
        c.register(new NodeDefinition(QUERY_GET_ENTITIES, "query",
                List.of(), List.of(port("entities", PortType.COLLECTION)), List.of(), false, null));
        c.register(new NodeDefinition(COMPONENT_GET, "component",
                List.of(port("entity", PortType.ENTITY)), List.of(port("component", PortType.COMPONENT)), List.of(), false, null));
        c.register(new NodeDefinition(COMPONENT_SET, "component",
                List.of(port("entity", PortType.ENTITY), port("component", PortType.COMPONENT)), List.of(), List.of(), false, null));
        for (String math : List.of(MATH_ADD, MATH_SUBTRACT, MATH_MULTIPLY, MATH_DIVIDE)) {
            c.register(new NodeDefinition(math, "math",
                    List.of(port("a", PortType.NUMBER), port("b", PortType.NUMBER)), List.of(port("result", PortType.NUMBER)), List.of(), false, null));
        }
        c.register(new NodeDefinition(FLOW_IF, "flow",
                List.of(port("condition", PortType.BOOLEAN)), List.of(), List.of("then", "else"), false, null));
        c.register(new NodeDefinition(FLOW_FOREACH, "flow",
                List.of(port("array", PortType.COLLECTION)), List.of(port("item", PortType.ANY)), List.of("body"), false, null));
        c.register(new NodeDefinition(PHYSICS_RAYCAST, "physics",
                List.of(port("origin", PortType.ANY), port("direction", PortType.ANY), port("max_distance", PortType.NUMBER)),
                List.of(port("hit", PortType.ANY)), List.of(), false, "physics"));
        c.register(new NodeDefinition(AUDIO_PLAY, "audio",
                List.of(port("clip", PortType.ANY)), List.of(), List.of(), false, "audio"));
        return c;
    }

    private static PortDefinition port(String name, PortType type) {
        return new PortDefinition(name, type);
    }
}
