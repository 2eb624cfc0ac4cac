package com.assistants.scheduler;

import com.assistants.scheduler.cron.CronParse;
import com.assistants.scheduler.model.ScheduleSpec;
import com.assistants.scheduler.store.ScheduleIds;
import com.assistants.scheduler.store.ScheduleValidationException;

/**
 * Checks a schedule definition before it is persisted. Messages are phrased for
 * the end user and are shown verbatim by the schedule tool.
 */
public final class ScheduleValidator {

    private ScheduleValidator() {
    }

    static final long MIN_INTERVAL_MS = 1000;

    public static void validateDraft(ScheduleDraft draft) {
        if (draft.getId() != null) {
            ScheduleIds.requireSafe(draft.getId());
        }
        if (draft.getCommand() == null || draft.getCommand().isBlank()) {
            throw new ScheduleValidationException("command is required.");
        }
        if (draft.getSchedule() == null) {
            throw new ScheduleValidationException(
                    "provide at (ISO time), cron, every (fixed interval), or minInterval+maxInterval for random scheduling.");
        }
        validateSpec(draft.getSchedule());
    }

    /**
     * @throws ScheduleValidationException describing the first problem found
     */
    public static void validateSpec(ScheduleSpec spec) {
        if (spec instanceof ScheduleSpec.Once once) {
            requireText(once.at(), "at is required.");
            requireValidZone(once.timezone());
        } else if (spec instanceof ScheduleSpec.Cron cron) {
            requireText(cron.cron(), "cron is required.");
            requireValidZone(cron.timezone());
        } else if (spec instanceof ScheduleSpec.Interval interval) {
            if (!(interval.interval() > 0)) {
                throw new ScheduleValidationException("every must be a positive number.");
            }
            if (interval.interval() * interval.effectiveUnit().multiplierMs() < MIN_INTERVAL_MS) {
                throw new ScheduleValidationException("minimum interval is 1 second.");
            }
        } else if (spec instanceof ScheduleSpec.RandomInterval random) {
            if (!(random.minInterval() > 0) || !(random.maxInterval() > 0)) {
                throw new ScheduleValidationException("minInterval and maxInterval must be positive numbers.");
            }
            if (random.minInterval() > random.maxInterval()) {
                throw new ScheduleValidationException("minInterval cannot be greater than maxInterval.");
            }
        } else {
            throw new ScheduleValidationException("unsupported schedule kind.");
        }
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException(message);
        }
    }

    private static void requireValidZone(String timezone) {
        if (timezone != null && !timezone.isEmpty() && !CronParse.isValidTimeZone(timezone)) {
            throw new ScheduleValidationException("invalid timezone \"" + timezone + "\".");
        }
    }
}
