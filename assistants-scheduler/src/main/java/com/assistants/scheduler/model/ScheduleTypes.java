package com.assistants.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Enumerations and small value types shared by schedule records.
 * Every enum serializes as its lower-case key.
 */
public final class ScheduleTypes {

    private ScheduleTypes() {
    }

    // =========================================================================
    // Provenance
    // =========================================================================

    public enum CreatedBy {
        USER, AGENT, SYSTEM;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static CreatedBy fromKey(String key) {
            if ("agent".equalsIgnoreCase(key))
                return AGENT;
            if ("system".equalsIgnoreCase(key))
                return SYSTEM;
            return USER;
        }
    }

    // =========================================================================
    // Action
    // =========================================================================

    public enum ActionType {
        COMMAND, MESSAGE;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Anything other than "message" runs as a command. */
        @JsonCreator
        public static ActionType fromKey(String key) {
            if ("message".equalsIgnoreCase(key))
                return MESSAGE;
            return COMMAND;
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public enum ScheduleStatus {
        ACTIVE, PAUSED, COMPLETED, ERROR;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * @return the status, or null for an unknown key (such a record is never
         *         due)
         */
        @JsonCreator
        public static ScheduleStatus fromKey(String key) {
            if (key == null)
                return null;
            for (ScheduleStatus status : values()) {
                if (status.key().equalsIgnoreCase(key.trim()))
                    return status;
            }
            return null;
        }
    }

    // =========================================================================
    // Interval units
    // =========================================================================

    public enum IntervalUnit {
        SECONDS(1000L), MINUTES(60_000L), HOURS(3_600_000L);

        private final long multiplierMs;

        IntervalUnit(long multiplierMs) {
            this.multiplierMs = multiplierMs;
        }

        public long multiplierMs() {
            return multiplierMs;
        }

        /**
         * Convert an amount of this unit to whole milliseconds.
         */
        public long toMillis(double amount) {
            return Math.round(amount * multiplierMs);
        }

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * @return the unit, or null when the key is unknown
         */
        @JsonCreator
        public static IntervalUnit fromKey(String key) {
            if (key == null)
                return null;
            for (IntervalUnit unit : values()) {
                if (unit.key().equalsIgnoreCase(key.trim()))
                    return unit;
            }
            return null;
        }

        /** Missing unit means minutes. */
        public static IntervalUnit orDefault(IntervalUnit unit) {
            return unit != null ? unit : MINUTES;
        }
    }

    // =========================================================================
    // Run result
    // =========================================================================

    /**
     * Outcome of the most recent execution of a schedule.
     */
    public record RunResult(boolean ok, String summary, String error) {

        public static RunResult success(String summary) {
            return new RunResult(true, summary, null);
        }

        public static RunResult failure(String error) {
            return new RunResult(false, null, error);
        }
    }
}
