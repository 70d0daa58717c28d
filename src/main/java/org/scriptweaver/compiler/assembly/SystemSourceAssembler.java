package org.scriptweaver.compiler.assembly;

import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.emit.CodeEmitter;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Wraps a compiled body into the system declaration the runtime expects:
 * <pre>
 * pub struct PlayerMovementSystem {
 *     // System state
 * }
 *
 * impl System for PlayerMovementSystem {
 *     fn execute(&amp;mut self, world: &amp;mut World, physics: &amp;mut PhysicsWorld, dt: f32) {
 *         ...body...
 *     }
 * }
 * </pre>
 * The compiler itself never emits this envelope.
 */
public final class SystemSourceAssembler {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s\\-_]+");
    private static final String FALLBACK_NAME = "Unnamed";

    private final String indentUnit;

    /**
     * @param indentUnit The indentation unit, the same one the body was emitted with.
     */
    public SystemSourceAssembler(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Builds the complete system source.
     *
     * @param system The compiled system.
     * @return The source text.
     */
    public String assemble(CompiledSystem system) {
        String typeName = toSystemName(system.name());
        CodeEmitter out = new CodeEmitter(indentUnit);
        out.emit("pub struct " + typeName + " {");
        out.indent();
        out.emit("// System state");
        out.dedent();
        out.emit("}");
        out.blank();
        out.emit("impl System for " + typeName + " {");
        out.indent();
        out.emit("fn execute(&mut self, world: &mut World, physics: &mut PhysicsWorld, dt: f32) {");
        out.indent();
        if (!system.code().isEmpty()) {
            for (String line : system.code().split("\n", -1)) {
                if (line.isEmpty()) {
                    out.blank();
                } else {
                    out.emit(line);
                }
            }
        }
        out.dedent();
        out.emit("}");
        out.dedent();
        out.emit("}");
        return out.finish();
    }

    /**
     * Derives the system type name from a script name: words separated by whitespace, {@code -}
     * or {@code _} are capitalised and joined, then {@code System} is appended.
     *
     * @param scriptName The script name, e.g. {@code player-movement}.
     * @return The type name, e.g. {@code PlayerMovementSystem}.
     */
    public static String toSystemName(String scriptName) {
        String base = scriptName == null ? "" : Arrays.stream(WORD_SEPARATOR.split(scriptName.trim()))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1))
                .collect(Collectors.joining());
        return (base.isEmpty() ? FALLBACK_NAME : base) + "System";
    }
}
