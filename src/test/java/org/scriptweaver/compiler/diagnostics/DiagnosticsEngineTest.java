package org.scriptweaver.compiler.diagnostics;

import org.scriptweaver.junit.extensions.logging.ExpectLog;
import org.scriptweaver.junit.extensions.logging.LogLevel;
import org.scriptweaver.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(LogWatchExtension.class)
public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CompilerLogger", messagePattern = "Node 'add' input 'b'.*using 0\\.0")
    void unresolvedInputIsAWarning() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportUnresolvedInput("add", "b", "0.0");

        assertTrue(engine.hasWarnings());
        Diagnostic d = engine.getDiagnostics().get(0);
        assertEquals(Diagnostic.Type.WARNING, d.type());
        assertEquals(Diagnostic.Code.UNRESOLVED_INPUT, d.code());
        assertEquals("add", d.nodeId());
        assertEquals("b", d.port());
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.INFO, messagePattern = ".*'vfx/trail'.*")
    void unknownNodeTypeIsANotice() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportUnknownNodeType("t", "vfx/trail");

        assertFalse(engine.hasWarnings());
        assertThat(engine.summary()).isEqualTo(
                "[INFO] UNKNOWN_NODE_TYPE t: Node type 'vfx/trail' is not supported, emitted a placeholder");
    }

    @Test
    @Tag("unit")
    void verbosityIsClampedAndSuppressesLowerLevels() {
        assertEquals(CompilerLogger.TRACE, new CompilerLogger(99).level());
        CompilerLogger quiet = new CompilerLogger(-5);
        assertEquals(CompilerLogger.ERROR, quiet.level());

        DiagnosticsEngine engine = new DiagnosticsEngine(quiet);
        engine.reportUnresolvedInput("quiet", "a", "0.0");

        assertEquals(1, engine.getDiagnostics().size());
    }
}
