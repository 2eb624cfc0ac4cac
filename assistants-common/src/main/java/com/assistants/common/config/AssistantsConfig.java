package com.assistants.common.config;

import lombok.Data;

/**
 * Root configuration type, read from {@code <project>/.assistants/config.json}.
 * Only the sections the scheduling runtime consumes are modelled; other keys in
 * the file are ignored.
 */
@Data
public class AssistantsConfig {

    /** Scheduler settings. */
    private SchedulerConfig scheduler;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class SchedulerConfig {
        /** When false no poll loop is started. */
        private boolean enabled = true;
        /** Poll tick interval. */
        private long heartbeatIntervalMs = 30_000;
        /** Lock TTL used when a poller takes an execution lock. */
        private long lockTtlMs = 10 * 60 * 1000;
        /** IANA zone for cron/once schedules without their own zone; null = JVM zone. */
        private String defaultTimezone;
        /** Pin session-less schedules to the first session that runs them. */
        private boolean claimGlobalSchedules = true;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
