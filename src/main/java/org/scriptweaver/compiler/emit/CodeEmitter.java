package org.scriptweaver.compiler.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * Indentation-aware line buffer for the emitted procedure body.
 */
public final class CodeEmitter {

    private final String indentUnit;
    private final List<String> lines = new ArrayList<>();
    private int indentLevel = 0;

    /**
     * @param indentUnit The text written once per indentation level, e.g. four spaces.
     */
    public CodeEmitter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Appends a line at the current indentation level.
     * @param line The line without indentation.
     */
    public void emit(String line) {
        lines.add(indentUnit.repeat(indentLevel) + line);
    }

    /**
     * Appends an empty line. Empty lines carry no indentation.
     */
    public void blank() {
        lines.add("");
    }

    public void indent() {
        indentLevel++;
    }

    /**
     * @throws IllegalStateException if the level would drop below zero.
     */
    public void dedent() {
        if (indentLevel == 0) {
            throw new IllegalStateException("dedent() without matching indent()");
        }
        indentLevel--;
    }

    /**
     * @return The number of lines emitted so far.
     */
    public int lineCount() {
        return lines.size();
    }

    /**
     * Joins the emitted lines.
     *
     * @return The emitted text.
     * @throws IllegalStateException if indent and dedent calls were not balanced.
     */
    public String finish() {
        if (indentLevel != 0) {
            throw new IllegalStateException("Unbalanced indentation at end of emission: level " + indentLevel);
        }
        return String.join("\n", lines);
    }
}
