package org.scriptweaver.compiler.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One unit of a visual script.
 *
 * @param id   Unique id within the script.
 * @param type Dot- or slash-namespaced kind, e.g. {@code flow/if}.
 * @param data Node specific configuration, e.g. a component kind. Never null.
 */
public record Node(String id, String type, Map<String, Object> data) {

    public Node {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Creates a node without configuration.
     * @param id The node id.
     * @param type The node type.
     * @return A new node.
     */
    public static Node of(String id, String type) {
        return new Node(id, type, Map.of());
    }

    /**
     * Returns a string configuration value.
     * @param key The data key.
     * @return The value if present and textual.
     */
    public Optional<String> stringData(String key) {
        Object value = data.get(key);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Returns a list-of-strings configuration value, skipping entries that are not strings.
     * @param key The data key.
     * @return The value if present and a list.
     */
    public Optional<List<String>> stringListData(String key) {
        Object value = data.get(key);
        if (value instanceof List<?> list) {
            return Optional.of(list.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .toList());
        }
        return Optional.empty();
    }

    /**
     * @return The editor label if one is set, otherwise the node type.
     */
    public String displayName() {
        return stringData("label").orElse(type);
    }
}
