package org.scriptweaver.compiler.api;

import org.scriptweaver.compiler.graph.VisualScript;

/**
 * Defines the public interface of the visual script compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given visual script into a system body.
     *
     * @param script The script to compile. It is not modified.
     * @return A {@link CompiledSystem} with the emitted code, its dependencies and any diagnostics.
     * @throws CompilationException if the graph is malformed or cannot be ordered.
     */
    CompiledSystem compile(VisualScript script) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);
}
