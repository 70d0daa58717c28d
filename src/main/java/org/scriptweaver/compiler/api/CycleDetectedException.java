package org.scriptweaver.compiler.api;

import java.util.List;

/**
 * Thrown when nodes cannot be ordered because their dependencies form a cycle.
 */
public class CycleDetectedException extends CompilationException {

    private final List<String> unresolvedNodeIds;

    /**
     * @param errorCode {@link CompilerErrorCode#CYCLE_DETECTED} or {@link CompilerErrorCode#NESTING_CYCLE}.
     * @param unresolvedNodeIds Ids of nodes whose dependencies could not be satisfied, never empty.
     * @param message The detail message.
     */
    public CycleDetectedException(CompilerErrorCode errorCode, List<String> unresolvedNodeIds, String message) {
        super(errorCode, message);
        this.unresolvedNodeIds = List.copyOf(unresolvedNodeIds);
    }

    /**
     * @return The ids of the nodes that still had unresolved dependencies, in authoring order.
     */
    public List<String> getUnresolvedNodeIds() {
        return unresolvedNodeIds;
    }
}
