package org.mdacademic.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiler's own logger with an integer verbosity.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * Each compiler owns one instance, so verbosity set on one compiler never changes another's output.
 * Messages that pass the verbosity check are forwarded to SLF4J, where the logging backend applies
 * its own levels on top.
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

    private final Logger logger;
    private volatile int level = INFO;

    /**
     * @param owner The class whose name the messages are logged under.
     */
    public CompilerLogger(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(owner);
    }

    /**
     * Sets the verbosity of this logger.
     * @param newLevel The new level, clamped to the valid range.
     */
    public void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    /**
     * Logs a warning message.
     * @param msg The message to log.
     */
    public void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    /**
     * Logs an informational message.
     * @param msg The message to log.
     */
    public void info(String msg) {
        if (level >= INFO) logger.info(msg);
    }

    /**
     * Logs a debug message.
     * @param msg The message to log.
     */
    public void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }
}
