package org.scriptweaver.compiler.api;

import org.scriptweaver.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The result of compiling one visual script.
 *
 * @param name The script name.
 * @param code The emitted procedure body, without any surrounding declarations.
 * @param dependencies Component kinds and capability names the body needs, in first-seen order.
 * @param diagnostics Non-fatal conditions raised during compilation.
 */
public record CompiledSystem(
        String name,
        String code,
        List<String> dependencies,
        List<Diagnostic> diagnostics
) {
    public CompiledSystem {
        dependencies = List.copyOf(dependencies);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Counts the diagnostics of the given kind.
     *
     * @param code The diagnostic kind.
     * @return The number of matching diagnostics.
     */
    public long diagnosticCount(Diagnostic.Code code) {
        return diagnostics.stream().filter(d -> d.code() == code).count();
    }
}
