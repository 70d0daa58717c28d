package org.scriptweaver.compiler.emit;

import org.scriptweaver.compiler.graph.PortKey;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps node outputs to the identifiers bound for them in the emitted code.
 * <p>
 * Nodes with a single value bind their plain output; nodes producing several values (e.g. the
 * two entities of a collision pair) bind one symbol per output handle.
 */
public class SymbolTable {

    private final Map<PortKey, String> symbols = new HashMap<>();

    /**
     * Binds the plain output of a node.
     * @param nodeId The producer.
     * @param symbol The identifier.
     */
    public void bind(String nodeId, String symbol) {
        symbols.put(PortKey.plain(nodeId), symbol);
    }

    /**
     * Binds a named output of a node.
     * @param nodeId The producer.
     * @param handle The output handle.
     * @param symbol The identifier.
     */
    public void bind(String nodeId, String handle, String symbol) {
        symbols.put(new PortKey(nodeId, handle), symbol);
    }

    /**
     * Looks up the symbol for an output, preferring a binding for the exact handle and falling
     * back to the node's plain output.
     *
     * @param nodeId The producer.
     * @param handle The output handle, may be {@code null}.
     * @return The bound identifier, if the producer has been compiled.
     */
    public Optional<String> lookup(String nodeId, String handle) {
        if (handle != null) {
            String named = symbols.get(new PortKey(nodeId, handle));
            if (named != null) return Optional.of(named);
        }
        return Optional.ofNullable(symbols.get(PortKey.plain(nodeId)));
    }

    /**
     * @return The number of bindings.
     */
    public int size() {
        return symbols.size();
    }
}
