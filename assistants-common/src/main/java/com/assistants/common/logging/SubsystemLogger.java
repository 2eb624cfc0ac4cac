package com.assistants.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("scheduler/poller");
 * log.info("Tick finished", Map.of("due", 3));
 * SubsystemLogger child = log.child("lease");
 * child.debug("Lock refreshed");
 * </pre>
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";
    private static volatile LogLevel minimumLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        // Subsystem doubles as the SLF4J logger name for per-subsystem control in
        // logback.xml
        this.logger = LoggerFactory.getLogger("assistants." + subsystem.replace('/', '.'));
    }

    /**
     * Create a subsystem logger.
     */
    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    /**
     * Cap the verbosity of every subsystem logger (typically from
     * {@code logging.level}). Logback levels still apply on top.
     */
    public static void setMinimumLevel(LogLevel level) {
        minimumLevel = level != null ? level : LogLevel.TRACE;
    }

    public static LogLevel getMinimumLevel() {
        return minimumLevel;
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message) {
        debug(message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        info(message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        warn(message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta);
    }

    public void error(String message, Throwable t) {
        if (!shouldLog(LogLevel.ERROR))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    /**
     * Check whether a message at the given level passes the configured minimum.
     */
    public boolean shouldLog(LogLevel level) {
        return level.isEnabledFor(minimumLevel);
    }

    public String getSubsystem() {
        return subsystem;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta) {
        if (!shouldLog(level))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
