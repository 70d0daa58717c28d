package org.scriptweaver.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger of a single compilation, filtering by an integer verbosity before handing messages to SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * Every compile call creates its own instance, so compilers with different verbosities never
 * affect each other.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private final int level;

    /**
     * @param level The verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     */
    public CompilerLogger(int level) {
        this.level = Math.max(ERROR, Math.min(TRACE, level));
    }

    /**
     * @return The verbosity of this logger.
     */
    public int level() { return level; }

    public void error(String msg) {
        if (level >= ERROR) logger.error(msg);
    }

    public void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    public void info(String msg) {
        if (level >= INFO) logger.info(msg);
    }

    public void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    public void trace(String msg) {
        if (level >= TRACE) logger.trace(msg);
    }
}
