package com.assistants.scheduler;

import com.assistants.scheduler.cron.CronExpression;
import com.assistants.scheduler.cron.CronParse;
import com.assistants.scheduler.model.ScheduleRecord;
import com.assistants.scheduler.model.ScheduleSpec;

import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Computes when a schedule fires next. Pure apart from the random source used
 * by {@code random} schedules.
 */
public class NextRunComputer {

    private final ZoneId defaultZone;
    private final RandomGenerator random;

    /**
     * Uses the JVM default zone for schedules without a time zone.
     */
    public NextRunComputer() {
        this(ZoneId.systemDefault(), null);
    }

    /**
     * @param defaultZone zone for cron schedules that do not name one
     * @param random      source for random schedules; null uses
     *                    {@link ThreadLocalRandom}
     */
    public NextRunComputer(ZoneId defaultZone, RandomGenerator random) {
        this.defaultZone = defaultZone != null ? defaultZone : ZoneId.systemDefault();
        this.random = random;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    /**
     * Next execution time of {@code record} strictly after {@code fromTime}.
     *
     * @return epoch millis, or empty when it cannot be computed (unparsable
     *         spec, invalid bounds, a one-shot time not in the future)
     */
    public Optional<Long> computeNextRun(ScheduleRecord record, long fromTime) {
        if (record == null || record.getSchedule() == null)
            return Optional.empty();
        return computeNextRun(record.getSchedule(), fromTime);
    }

    public Optional<Long> computeNextRun(ScheduleSpec spec, long fromTime) {
        if (spec instanceof ScheduleSpec.Once once) {
            return nextOnce(once, fromTime);
        }
        if (spec instanceof ScheduleSpec.Cron cron) {
            return nextCron(cron, fromTime);
        }
        if (spec instanceof ScheduleSpec.Interval interval) {
            return nextInterval(interval, fromTime);
        }
        if (spec instanceof ScheduleSpec.RandomInterval randomInterval) {
            return nextRandom(randomInterval, fromTime);
        }
        return Optional.empty();
    }

    private Optional<Long> nextOnce(ScheduleSpec.Once once, long fromTime) {
        // A one-shot zone applies only to wall-clock strings; no zone means UTC.
        ZoneId zone = CronParse.resolveZone(once.timezone()).orElse(null);
        return CronParse.parseScheduledTime(once.at(), zone)
                .filter(at -> at > fromTime);
    }

    private Optional<Long> nextCron(ScheduleSpec.Cron cron, long fromTime) {
        ZoneId zone = CronParse.resolveZone(cron.timezone()).orElse(defaultZone);
        return CronExpression.nextRun(cron.cron(), fromTime, zone);
    }

    private Optional<Long> nextInterval(ScheduleSpec.Interval interval, long fromTime) {
        if (!(interval.interval() > 0))
            return Optional.empty();
        long intervalMs = interval.effectiveUnit().toMillis(interval.interval());
        if (intervalMs <= 0)
            return Optional.empty();
        return plus(fromTime, intervalMs);
    }

    private Optional<Long> nextRandom(ScheduleSpec.RandomInterval spec, long fromTime) {
        double min = spec.minInterval();
        double max = spec.maxInterval();
        if (!(min > 0) || !(max > 0) || min > max)
            return Optional.empty();
        long minMs = spec.effectiveUnit().toMillis(min);
        long maxMs = spec.effectiveUnit().toMillis(max);
        if (minMs <= 0 || maxMs == Long.MAX_VALUE || plus(fromTime, maxMs).isEmpty())
            return Optional.empty();
        RandomGenerator source = random != null ? random : ThreadLocalRandom.current();
        long delay = minMs == maxMs ? minMs : source.nextLong(minMs, maxMs + 1);
        return Optional.of(fromTime + delay);
    }

    /** {@code fromTime + delayMs}, empty when the sum does not fit in a long. */
    private static Optional<Long> plus(long fromTime, long delayMs) {
        try {
            return Optional.of(Math.addExact(fromTime, delayMs));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }
}
