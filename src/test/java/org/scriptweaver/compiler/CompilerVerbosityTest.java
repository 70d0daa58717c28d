package org.scriptweaver.compiler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.diagnostics.CompilerLogger;
import org.scriptweaver.compiler.diagnostics.Diagnostic;
import org.scriptweaver.compiler.graph.VisualScript;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.scriptweaver.compiler.ScriptFixtures.node;
import static org.scriptweaver.compiler.ScriptFixtures.script;

public class CompilerVerbosityTest {

    private final Logger compilerLog = (Logger) LoggerFactory.getLogger(CompilerLogger.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        compilerLog.setLevel(Level.TRACE);
        appender.start();
        compilerLog.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        compilerLog.detachAppender(appender);
        appender.stop();
        compilerLog.setLevel(null);
    }

    @Test
    @Tag("unit")
    void compilersWithDifferentVerbosityDoNotAffectEachOther() throws Exception {
        Compiler loud = new Compiler(new CompilerOptions("    ", CompilerOptions.SubgraphOrder.TOPOLOGICAL, CompilerLogger.WARN));
        Compiler quiet = new Compiler(new CompilerOptions("    ", CompilerOptions.SubgraphOrder.TOPOLOGICAL, CompilerLogger.ERROR));
        VisualScript s = script(List.of(node("mul", NodeCatalog.MATH_MULTIPLY)), List.of());
        int rounds = 20;

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<CompiledSystem>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < rounds; i++) {
                futures.add(pool.submit((Callable<CompiledSystem>) () -> loud.compile(s)));
                futures.add(pool.submit((Callable<CompiledSystem>) () -> quiet.compile(s)));
            }
            for (Future<CompiledSystem> f : futures) {
                assertEquals(2, f.get().diagnosticCount(Diagnostic.Code.UNRESOLVED_INPUT));
            }
        } finally {
            pool.shutdownNow();
        }

        // two unresolved inputs per compile, logged only by the WARN compiler
        List<ILoggingEvent> warnings = new ArrayList<>(appender.list);
        assertThat(warnings).hasSize(2 * rounds);
        assertThat(warnings).allMatch(e -> e.getLevel() == Level.WARN);
    }

    @Test
    @Tag("unit")
    void verbosityOverrideOnlyAppliesToItsCompiler() throws Exception {
        Compiler overridden = new Compiler();
        overridden.setVerbosity(CompilerLogger.ERROR);
        Compiler configured = new Compiler();
        VisualScript s = script(List.of(node("mul", NodeCatalog.MATH_MULTIPLY)), List.of());

        overridden.compile(s);
        assertThat(appender.list).isEmpty();

        configured.compile(s);
        assertThat(appender.list).hasSize(2);
    }
}
