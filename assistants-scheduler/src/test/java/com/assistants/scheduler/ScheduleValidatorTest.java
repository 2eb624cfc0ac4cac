package com.assistants.scheduler;

import com.assistants.scheduler.model.ScheduleSpec;
import com.assistants.scheduler.model.ScheduleTypes.IntervalUnit;
import com.assistants.scheduler.store.ScheduleValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleValidatorTest {

    private static String failure(ScheduleSpec spec) {
        return assertThrows(ScheduleValidationException.class, () -> ScheduleValidator.validateSpec(spec))
                .getMessage();
    }

    @Test
    void validSpecs_pass() {
        assertDoesNotThrow(() -> ScheduleValidator.validateSpec(new ScheduleSpec.Once("2026-02-01T00:00:00Z", null)));
        assertDoesNotThrow(() -> ScheduleValidator.validateSpec(new ScheduleSpec.Cron("*/5 * * * *", "UTC")));
        assertDoesNotThrow(() -> ScheduleValidator.validateSpec(new ScheduleSpec.Interval(1, IntervalUnit.SECONDS)));
        assertDoesNotThrow(() -> ScheduleValidator.validateSpec(new ScheduleSpec.RandomInterval(1, 1, null)));
    }

    @Test
    void interval_rules() {
        assertEquals("every must be a positive number.", failure(new ScheduleSpec.Interval(0, null)));
        assertEquals("every must be a positive number.", failure(new ScheduleSpec.Interval(-3, IntervalUnit.HOURS)));
        assertEquals("minimum interval is 1 second.", failure(new ScheduleSpec.Interval(0.5, IntervalUnit.SECONDS)));
    }

    @Test
    void random_rules() {
        assertEquals("minInterval and maxInterval must be positive numbers.",
                failure(new ScheduleSpec.RandomInterval(0, 5, null)));
        assertEquals("minInterval and maxInterval must be positive numbers.",
                failure(new ScheduleSpec.RandomInterval(5, -1, null)));
        assertEquals("minInterval cannot be greater than maxInterval.",
                failure(new ScheduleSpec.RandomInterval(10, 5, null)));
    }

    @Test
    void timezone_andRequiredText() {
        assertEquals("invalid timezone \"Bad/Zone\".", failure(new ScheduleSpec.Once("2026-02-01T10:00", "Bad/Zone")));
        assertEquals("invalid timezone \"Mars/Base\".", failure(new ScheduleSpec.Cron("0 * * * *", "Mars/Base")));
        assertEquals("at is required.", failure(new ScheduleSpec.Once(" ", null)));
        assertEquals("cron is required.", failure(new ScheduleSpec.Cron(null, null)));
    }

    @Test
    void draft_rules() {
        ScheduleDraft.ScheduleDraftBuilder base = ScheduleDraft.builder()
                .command("/status")
                .schedule(new ScheduleSpec.Cron("*/5 * * * *", null));

        assertDoesNotThrow(() -> ScheduleValidator.validateDraft(base.build()));
        assertThrows(ScheduleValidationException.class,
                () -> ScheduleValidator.validateDraft(base.id("bad id!").build()));
        assertEquals("command is required.", assertThrows(ScheduleValidationException.class,
                () -> ScheduleValidator.validateDraft(base.id(null).command("  ").build())).getMessage());
        assertThrows(ScheduleValidationException.class,
                () -> ScheduleValidator.validateDraft(base.command("/x").schedule(null).build()));
    }
}
