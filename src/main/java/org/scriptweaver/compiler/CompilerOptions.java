package org.scriptweaver.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable compiler settings, read from the {@code compiler} block of the configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * compiler {
 *   indent = "    "               # text written per indentation level
 *   subgraph-order = TOPOLOGICAL  # or DECLARATION
 *   verbosity = 2                 # 0=ERROR .. 4=TRACE
 * }
 * </pre>
 *
 * @param indent        The indentation unit.
 * @param subgraphOrder How the nodes of a branch or loop body are ordered.
 * @param verbosity     The compiler log verbosity.
 */
public record CompilerOptions(String indent, SubgraphOrder subgraphOrder, int verbosity) {

    private static final String COMPILER_PATH = "compiler";

    /**
     * Ordering of the nodes connected to a body handle.
     */
    public enum SubgraphOrder {
        /** Sort the body nodes by their dependencies among each other. */
        TOPOLOGICAL,
        /** Keep the order in which the body connections were declared. */
        DECLARATION
    }

    /**
     * Reads the options from a configuration containing a {@code compiler} block.
     *
     * @param config The configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a value is missing or invalid.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config c = config.getConfig(COMPILER_PATH);
        return new CompilerOptions(
                c.getString("indent"),
                c.getEnum(SubgraphOrder.class, "subgraph-order"),
                c.getInt("verbosity"));
    }

    /**
     * @return The options from the bundled {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
