package com.assistants.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed 5-field cron expression: minute, hour, day-of-month, month, weekday.
 *
 * <p>
 * Each field accepts {@code *}, comma lists, {@code a-b} ranges and
 * {@code base/step} where base is {@code *}, a number (meaning number..max) or
 * a range. Weekday is 0 (Sunday) to 6 (Saturday). Day-of-month and weekday must
 * both match.
 * </p>
 *
 * <p>
 * Parts that are not numeric and values outside a field's range contribute
 * nothing; a field left without any value rejects the expression.
 * </p>
 */
@Slf4j
public final class CronExpression {

    /** Roughly one year of minutes; bounds the search for unsatisfiable expressions. */
    public static final int MAX_SEARCH_MINUTES = 366 * 24 * 60;

    private static final long MINUTE_MS = 60_000L;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private enum Field {
        MINUTE(0, 59), HOUR(0, 23), DAY_OF_MONTH(1, 31), MONTH(1, 12), DAY_OF_WEEK(0, 6);

        final int min;
        final int max;

        Field(int min, int max) {
            this.min = min;
            this.max = max;
        }
    }

    private final String source;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;

    private CronExpression(String source, BitSet[] fields) {
        this.source = source;
        this.minutes = fields[0];
        this.hours = fields[1];
        this.daysOfMonth = fields[2];
        this.months = fields[3];
        this.daysOfWeek = fields[4];
    }

    /**
     * Parse a cron expression.
     *
     * @return the expression, or empty when it does not have exactly five fields
     *         or a field has no valid value
     */
    public static Optional<CronExpression> parse(String expression) {
        if (expression == null)
            return Optional.empty();
        String trimmed = expression.trim();
        if (trimmed.isEmpty())
            return Optional.empty();

        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length != 5) {
            log.debug("Rejecting cron expression with {} fields: {}", parts.length, expression);
            return Optional.empty();
        }

        Field[] fields = Field.values();
        BitSet[] parsed = new BitSet[fields.length];
        for (int i = 0; i < fields.length; i++) {
            BitSet values = parseField(parts[i], fields[i]);
            if (values.isEmpty()) {
                log.debug("Rejecting cron expression, no valid {} values: {}", fields[i], expression);
                return Optional.empty();
            }
            parsed[i] = values;
        }
        return Optional.of(new CronExpression(trimmed, parsed));
    }

    /**
     * Whether the wall-clock minute of {@code instant} in {@code zone} matches.
     * Seconds are ignored.
     */
    public boolean matches(Instant instant, ZoneId zone) {
        return matches(ZonedDateTime.ofInstant(instant, zone));
    }

    private boolean matches(ZonedDateTime time) {
        // getValue(): Monday=1..Sunday=7; cron counts Sunday=0
        int weekday = time.getDayOfWeek().getValue() % 7;
        return minutes.get(time.getMinute())
                && hours.get(time.getHour())
                && daysOfMonth.get(time.getDayOfMonth())
                && months.get(time.getMonthValue())
                && daysOfWeek.get(weekday);
    }

    /**
     * First matching minute boundary strictly after {@code fromMs}: the scan
     * starts at the next whole minute and walks forward one minute at a time.
     *
     * @return epoch millis, or empty when nothing matches within
     *         {@link #MAX_SEARCH_MINUTES}
     */
    public Optional<Long> nextAfter(long fromMs, ZoneId zone) {
        long candidate = Math.floorDiv(fromMs, MINUTE_MS) * MINUTE_MS + MINUTE_MS;
        for (int i = 0; i < MAX_SEARCH_MINUTES; i++) {
            if (matches(Instant.ofEpochMilli(candidate), zone)) {
                return Optional.of(candidate);
            }
            candidate += MINUTE_MS;
        }
        log.debug("No run of '{}' within {} minutes of {}", source, MAX_SEARCH_MINUTES, fromMs);
        return Optional.empty();
    }

    /**
     * Convenience: parse and compute the next run in one step.
     */
    public static Optional<Long> nextRun(String expression, long fromMs, ZoneId zone) {
        return parse(expression).flatMap(expr -> expr.nextAfter(fromMs, zone));
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    // =========================================================================
    // Field parsing
    // =========================================================================

    private static BitSet parseField(String text, Field field) {
        BitSet values = new BitSet(field.max + 1);
        for (String part : text.split(",")) {
            addPart(part.trim(), field, values);
        }
        return values;
    }

    private static void addPart(String part, Field field, BitSet values) {
        if (part.isEmpty())
            return;

        int step = 1;
        String base = part;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            String stepText = part.substring(slash + 1);
            if (!NUMBER.matcher(stepText).matches())
                return;
            step = parseSmallInt(stepText);
            if (step <= 0)
                return;
            base = part.substring(0, slash);
        }

        int start;
        int end;
        if ("*".equals(base)) {
            start = field.min;
            end = field.max;
        } else if (base.indexOf('-') > 0) {
            String[] bounds = base.split("-", 2);
            if (!NUMBER.matcher(bounds[0]).matches() || !NUMBER.matcher(bounds[1]).matches())
                return;
            start = parseSmallInt(bounds[0]);
            end = parseSmallInt(bounds[1]);
        } else if (NUMBER.matcher(base).matches()) {
            start = parseSmallInt(base);
            end = slash >= 0 ? field.max : start;
        } else {
            return;
        }

        int last = Math.min(end, field.max);
        for (int value = start; value <= last; value += step) {
            if (value >= field.min) {
                values.set(value);
            }
        }
    }

    /** Digits only; saturates instead of overflowing. */
    private static int parseSmallInt(String digits) {
        if (digits.length() > 4)
            return Integer.MAX_VALUE / 2;
        return Integer.parseInt(digits);
    }
}
