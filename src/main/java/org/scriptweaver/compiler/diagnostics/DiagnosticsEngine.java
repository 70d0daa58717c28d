package org.scriptweaver.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the non-fatal diagnostics of a single compilation.
 * <p>
 * Fatal conditions are never recorded here; they abort compilation with a
 * {@link org.scriptweaver.compiler.api.CompilationException}.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final CompilerLogger log;

    /**
     * Creates an engine logging at {@link CompilerLogger#INFO}.
     */
    public DiagnosticsEngine() {
        this(new CompilerLogger(CompilerLogger.INFO));
    }

    /**
     * @param log The logger of the running compilation.
     */
    public DiagnosticsEngine(CompilerLogger log) {
        this.log = log;
    }

    /**
     * Reports that an input could not be resolved and a default literal was substituted.
     *
     * @param nodeId  The consuming node.
     * @param port    The unresolved input port.
     * @param literal The literal emitted in place of the input.
     */
    public void reportUnresolvedInput(String nodeId, String port, String literal) {
        String message = "Input is not connected to a compiled output, using " + literal;
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, Diagnostic.Code.UNRESOLVED_INPUT, message, nodeId, port));
        log.warn("Node '" + nodeId + "' input '" + port + "': " + message);
    }

    /**
     * Reports a node type that has no registered compiler.
     *
     * @param nodeId   The node id.
     * @param nodeType The unrecognized type.
     */
    public void reportUnknownNodeType(String nodeId, String nodeType) {
        String message = "Node type '" + nodeType + "' is not supported, emitted a placeholder";
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, Diagnostic.Code.UNKNOWN_NODE_TYPE, message, nodeId, null));
        log.info("Node '" + nodeId + "': " + message);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
