package com.assistants.scheduler.cron;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date/time and time zone parsing for one-shot schedules.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCAL_DATE_TIME_RE = Pattern.compile(
            "^(\\d{4})-(\\d{2})-(\\d{2})(?:[T ](\\d{2}):(\\d{2})(?::(\\d{2}))?)?$");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /** ISO local date-time followed by {@code Z}, {@code +HH:MM} or {@code +HHMM}. */
    private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter(Locale.ROOT);

    /**
     * Whether the string carries an explicit UTC designator or offset.
     */
    static boolean hasTimeZoneOffset(String raw) {
        return ISO_TZ_RE.matcher(raw).find();
    }

    /**
     * Whether {@code timeZone} names a zone the JVM knows (IANA id or fixed
     * offset).
     */
    public static boolean isValidTimeZone(String timeZone) {
        return resolveZone(timeZone).isPresent();
    }

    /**
     * Resolve a zone id, empty for null, blank or unknown names.
     */
    public static Optional<ZoneId> resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank())
            return Optional.empty();
        try {
            return Optional.of(ZoneId.of(timeZone.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse the {@code at} value of a one-shot schedule to epoch milliseconds.
     * <ul>
     * <li>Numeric strings are epoch ms.</li>
     * <li>Strings with {@code Z} or an offset are parsed literally.</li>
     * <li>{@code yyyy-MM-dd[( |T)HH:mm[:ss]]} without offset is wall-clock time
     * in {@code zone}, or UTC when no zone is given.</li>
     * </ul>
     *
     * @return epoch milliseconds, or empty if parsing fails
     */
    public static Optional<Long> parseScheduledTime(String input, ZoneId zone) {
        if (input == null)
            return Optional.empty();
        String raw = input.trim();
        if (raw.isEmpty())
            return Optional.empty();

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? Optional.of(n) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        if (hasTimeZoneOffset(raw)) {
            return parseWithOffset(raw);
        }

        Optional<LocalDateTime> local = parseLocalDateTime(raw);
        if (local.isEmpty())
            return Optional.empty();
        if (zone == null)
            return Optional.of(local.get().toInstant(ZoneOffset.UTC).toEpochMilli());
        return Optional.of(wallClockToEpochMs(local.get(), zone));
    }

    /**
     * Interpret a wall-clock time in {@code zone}: take the same fields as a UTC
     * instant, then subtract the zone's offset at that guessed instant.
     */
    static long wallClockToEpochMs(LocalDateTime local, ZoneId zone) {
        Instant utcGuess = local.toInstant(ZoneOffset.UTC);
        int offsetSeconds = zone.getRules().getOffset(utcGuess).getTotalSeconds();
        return utcGuess.toEpochMilli() - offsetSeconds * 1000L;
    }

    private static Optional<Long> parseWithOffset(String raw) {
        try {
            return Optional.of(OffsetDateTime.parse(raw.toUpperCase(Locale.ROOT), OFFSET_DATE_TIME)
                    .toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDateTime> parseLocalDateTime(String raw) {
        Matcher m = LOCAL_DATE_TIME_RE.matcher(raw);
        if (!m.matches())
            return Optional.empty();
        try {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2));
            int day = Integer.parseInt(m.group(3));
            int hour = m.group(4) != null ? Integer.parseInt(m.group(4)) : 0;
            int minute = m.group(5) != null ? Integer.parseInt(m.group(5)) : 0;
            int second = m.group(6) != null ? Integer.parseInt(m.group(6)) : 0;
            return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
