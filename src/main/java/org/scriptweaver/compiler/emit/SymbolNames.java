package org.scriptweaver.compiler.emit;

import java.util.regex.Pattern;

/**
 * Derives identifiers for the emitted code from node ids.
 */
public final class SymbolNames {

    public static final String QUERY = "query_";
    public static final String COMPONENT = "comp_";
    public static final String RESULT = "result_";
    public static final String ITEM = "item_";
    public static final String HIT = "hit_";
    public static final String ENTITY_A = "entity_a_";
    public static final String ENTITY_B = "entity_b_";

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");

    private SymbolNames() {}

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with an underscore.
     *
     * @param nodeId The raw node id.
     * @return The sanitized id.
     */
    public static String sanitize(String nodeId) {
        return UNSAFE.matcher(nodeId).replaceAll("_");
    }

    /**
     * @param prefix A role prefix such as {@link #RESULT}.
     * @param nodeId The raw node id.
     * @return The identifier for the node's output in that role.
     */
    public static String of(String prefix, String nodeId) {
        return prefix + sanitize(nodeId);
    }
}
