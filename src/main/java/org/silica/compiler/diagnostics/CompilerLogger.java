package org.silica.compiler.diagnostics;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the compiler's integer verbosity levels onto the logging backend.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * Compiler components log through their own SLF4J loggers; this class only
 * adjusts the threshold of the {@code org.silica.compiler} logger hierarchy.
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

    private static final String COMPILER_LOGGER = "org.silica.compiler";
    private static volatile int level = INFO;

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level. Values outside the known range are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
        Logger logger = LoggerFactory.getLogger(COMPILER_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(toLogback(level));
        }
    }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() {
        return level;
    }

    private static Level toLogback(int verbosity) {
        return switch (verbosity) {
            case ERROR -> Level.ERROR;
            case WARN -> Level.WARN;
            case INFO -> Level.INFO;
            case DEBUG -> Level.DEBUG;
            default -> Level.TRACE;
        };
    }
}
