package org.scriptweaver.compiler.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Static description of a node type.
 *
 * @param type           The node type, e.g. {@code math/add}.
 * @param category       The editor category, e.g. {@code math}.
 * @param inputs         Declared input ports.
 * @param outputs        Declared value outputs.
 * @param bodyHandles    Output handles whose targets form nested bodies, e.g. {@code then}.
 * @param opensEventScope Whether the node opens an iteration scope that encloses its dependents.
 * @param capability     External capability the node needs, or {@code null}.
 */
public record NodeDefinition(
        String type,
        String category,
        List<PortDefinition> inputs,
        List<PortDefinition> outputs,
        List<String> bodyHandles,
        boolean opensEventScope,
        String capability
) {
    public NodeDefinition {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        bodyHandles = List.copyOf(bodyHandles);
    }

    /**
     * @param name The port name.
     * @return The input port definition, if declared.
     */
    public Optional<PortDefinition> input(String name) {
        return inputs.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * @return {@code true} if the node owns nested bodies.
     */
    public boolean isContainer() {
        return !bodyHandles.isEmpty();
    }

    /**
     * @return The external capability, if any.
     */
    public Optional<String> capabilityName() {
        return Optional.ofNullable(capability);
    }
}
