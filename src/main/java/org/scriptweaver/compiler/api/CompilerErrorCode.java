package org.scriptweaver.compiler.api;

/**
 * Defines unique, testable error codes for all fatal errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Graph Validation Errors
    /** A connection references a node id that is not part of the graph. */
    MALFORMED_GRAPH,
    /** Two nodes share the same id. */
    DUPLICATE_NODE_ID,
    // endregion

    // region Ordering Errors
    /** The top-level nodes (or the nodes of a nested body) do not sort topologically. */
    CYCLE_DETECTED,
    /** A branch or loop node is nested, directly or indirectly, inside its own body. */
    NESTING_CYCLE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a script. */
    IO_ERROR_READING_SCRIPT,
    /** A script document is not valid JSON or lacks required fields. */
    INVALID_SCRIPT_DOCUMENT,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
