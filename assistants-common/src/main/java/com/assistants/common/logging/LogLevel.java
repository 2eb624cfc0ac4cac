package com.assistants.common.logging;

import java.util.Map;

/**
 * Log level enumeration used by {@link SubsystemLogger} and the
 * {@code logging.level} config key. Provides normalization of user-supplied
 * level names.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("fatal", ERROR),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    /**
     * Normalize with default fallback of INFO.
     */
    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Numeric priority, lower is more severe. SILENT sorts after everything.
     */
    public int priority() {
        return switch (this) {
            case ERROR -> 1;
            case WARN -> 2;
            case INFO -> 3;
            case DEBUG -> 4;
            case TRACE -> 5;
            case SILENT -> Integer.MAX_VALUE;
        };
    }

    /**
     * A message at this level is emitted when the configured minimum is at
     * least as verbose.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (minLevel == SILENT || this == SILENT) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
