package com.assistants.scheduler.model;

import com.assistants.scheduler.model.ScheduleTypes.IntervalUnit;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Trigger definition of a schedule. Serialized with a {@code kind}
 * discriminator: {@code once}, {@code cron}, {@code interval} or
 * {@code random}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScheduleSpec.Once.class, name = "once"),
        @JsonSubTypes.Type(value = ScheduleSpec.Cron.class, name = "cron"),
        @JsonSubTypes.Type(value = ScheduleSpec.Interval.class, name = "interval"),
        @JsonSubTypes.Type(value = ScheduleSpec.RandomInterval.class, name = "random")
})
public sealed interface ScheduleSpec
        permits ScheduleSpec.Once, ScheduleSpec.Cron, ScheduleSpec.Interval, ScheduleSpec.RandomInterval {

    /** Discriminator as written to disk. */
    String kind();

    /**
     * Fires once at {@code at}: epoch millis, an ISO timestamp with offset, or a
     * wall-clock date/time read in {@code timezone}.
     */
    record Once(String at, String timezone) implements ScheduleSpec {
        @Override
        public String kind() {
            return "once";
        }
    }

    /**
     * Fires on every minute matching a 5-field cron expression.
     */
    record Cron(String cron, String timezone) implements ScheduleSpec {
        @Override
        public String kind() {
            return "cron";
        }
    }

    /**
     * Fires every {@code interval} units after the previous run.
     */
    record Interval(double interval, IntervalUnit unit) implements ScheduleSpec {
        @Override
        public String kind() {
            return "interval";
        }

        @JsonIgnore
        public IntervalUnit effectiveUnit() {
            return IntervalUnit.orDefault(unit);
        }
    }

    /**
     * Fires after a uniformly random delay in {@code [minInterval, maxInterval]}.
     */
    record RandomInterval(double minInterval, double maxInterval, IntervalUnit unit) implements ScheduleSpec {
        @Override
        public String kind() {
            return "random";
        }

        @JsonIgnore
        public IntervalUnit effectiveUnit() {
            return IntervalUnit.orDefault(unit);
        }
    }
}
