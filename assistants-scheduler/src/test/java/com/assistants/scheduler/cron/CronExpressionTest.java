package com.assistants.scheduler.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronExpression}.
 */
class CronExpressionTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private static long ms(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    private static long next(String expr, String fromIso, ZoneId zone) {
        Optional<Long> next = CronExpression.nextRun(expr, ms(fromIso), zone);
        assertTrue(next.isPresent(), "expected a next run for " + expr);
        return next.get();
    }

    // =========================================================================
    // parse
    // =========================================================================

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "* * * *",
            "* * * * * *",
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * * 13 *",
            "* * * * 7",
            "a * * * *",
            "*/0 * * * *",
            "*/x * * * *",
            "5-3 * * * *",
            "1,,2 * * * ,",
            "-5 * * * *"
    })
    void parse_invalid_returnsEmpty(String expr) {
        assertTrue(CronExpression.parse(expr).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "* * * * *",
            "*/5 * * * *",
            "0 9 * * 1-5",
            "0,30 8-18/2 1,15 */3 0",
            "  15   10  *  *  * ",
            "10/20 * * * *",
            "0-59/15 * * * *",
            "0,99 * * * *"
    })
    void parse_valid(String expr) {
        assertTrue(CronExpression.parse(expr).isPresent());
    }

    @Test
    void parse_keepsTrimmedSource() {
        assertEquals("*/5 * * * *", CronExpression.parse("  */5 * * * * ").orElseThrow().getSource());
    }

    @Test
    void parse_hugeRange_isClampedToFieldMax() {
        CronExpression expr = CronExpression.parse("0-99999 0 1 1 *").orElseThrow();
        assertTrue(expr.matches(Instant.parse("2026-01-01T00:59:00Z"), UTC));
    }

    // =========================================================================
    // matches
    // =========================================================================

    @Test
    void matches_ignoresSeconds() {
        CronExpression expr = CronExpression.parse("30 12 * * *").orElseThrow();
        assertTrue(expr.matches(Instant.parse("2026-02-01T12:30:45Z"), UTC));
        assertFalse(expr.matches(Instant.parse("2026-02-01T12:31:00Z"), UTC));
    }

    @Test
    void matches_usesWallClockOfZone() {
        CronExpression expr = CronExpression.parse("0 9 * * *").orElseThrow();
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        assertTrue(expr.matches(Instant.parse("2026-02-01T00:00:00Z"), tokyo));
        assertFalse(expr.matches(Instant.parse("2026-02-01T00:00:00Z"), UTC));
    }

    @Test
    void matches_sundayIsZero() {
        // 2026-02-01 is a Sunday
        assertTrue(CronExpression.parse("0 0 * * 0").orElseThrow()
                .matches(Instant.parse("2026-02-01T00:00:00Z"), UTC));
        assertFalse(CronExpression.parse("0 0 * * 6").orElseThrow()
                .matches(Instant.parse("2026-02-01T00:00:00Z"), UTC));
    }

    // =========================================================================
    // nextAfter
    // =========================================================================

    @Test
    void next_everyFiveMinutes() {
        assertEquals(ms("2026-02-01T00:05:00Z"), next("*/5 * * * *", "2026-02-01T00:00:00Z", UTC));
        assertEquals(ms("2026-02-01T00:10:00Z"), next("*/5 * * * *", "2026-02-01T00:05:00Z", UTC));
        assertEquals(ms("2026-02-01T00:05:00Z"), next("*/5 * * * *", "2026-02-01T00:04:59.999Z", UTC));
    }

    @Test
    void next_isStrictlyAfterAMatchingMinute() {
        assertEquals(ms("2026-02-01T00:01:00Z"), next("* * * * *", "2026-02-01T00:00:00Z", UTC));
        assertEquals(ms("2026-02-01T00:01:00Z"), next("* * * * *", "2026-02-01T00:00:30Z", UTC));
    }

    @Test
    void next_weekday() {
        // Sunday 2026-02-01 -> Monday 09:00
        assertEquals(ms("2026-02-02T09:00:00Z"), next("0 9 * * 1", "2026-02-01T00:00:00Z", UTC));
        assertEquals(ms("2026-02-08T00:00:00Z"), next("0 0 * * 0", "2026-02-01T00:00:00Z", UTC));
    }

    @Test
    void next_dayOfMonthAndWeekdayMustBothMatch() {
        // Friday the 13th
        assertEquals(ms("2026-02-13T00:00:00Z"), next("0 0 13 * 5", "2026-02-01T00:00:00Z", UTC));
    }

    @Test
    void next_numberWithStep_startsAtNumber() {
        assertEquals(ms("2026-02-01T00:10:00Z"), next("10/20 * * * *", "2026-02-01T00:00:00Z", UTC));
        assertEquals(ms("2026-02-01T00:30:00Z"), next("10/20 * * * *", "2026-02-01T00:10:00Z", UTC));
        assertEquals(ms("2026-02-01T01:10:00Z"), next("10/20 * * * *", "2026-02-01T00:50:00Z", UTC));
    }

    @Test
    void next_rangeWithStepAndList() {
        assertEquals(ms("2026-02-01T00:15:00Z"), next("0-30/15 * * * *", "2026-02-01T00:00:00Z", UTC));
        assertEquals(ms("2026-02-01T00:30:00Z"), next("0,30 * * * *", "2026-02-01T00:00:00Z", UTC));
    }

    @Test
    void next_inNamedZone() {
        ZoneId newYork = ZoneId.of("America/New_York");
        // 09:00 EST = 14:00 UTC
        assertEquals(ms("2026-02-01T14:00:00Z"), next("0 9 * * *", "2026-02-01T00:00:00Z", newYork));
    }

    @Test
    void next_unsatisfiable_returnsEmpty() {
        assertTrue(CronExpression.nextRun("0 0 31 2 *", ms("2026-02-01T00:00:00Z"), UTC).isEmpty());
    }

    @Test
    void next_invalidExpression_returnsEmpty() {
        assertTrue(CronExpression.nextRun("not a cron", ms("2026-02-01T00:00:00Z"), UTC).isEmpty());
    }

    @Test
    void next_successiveRuns_areEvenlySpaced() {
        CronExpression expr = CronExpression.parse("*/5 * * * *").orElseThrow();
        long previous = expr.nextAfter(ms("2026-02-01T00:02:13Z"), UTC).orElseThrow();
        for (int i = 0; i < 100; i++) {
            long current = expr.nextAfter(previous, UTC).orElseThrow();
            assertEquals(5 * 60_000L, current - previous);
            previous = current;
        }
    }

    @Test
    void next_isAfterFromAndMatches_forSampledInputs() {
        List<String> expressions = List.of(
                "* * * * *", "*/7 * * * *", "0 */3 * * *", "15 10 * * 1-5",
                "0 0 1 * *", "30 6 1,15 * *", "0 12 * * 0", "45 23 * * 6");
        List<ZoneId> zones = List.of(UTC, ZoneId.of("Europe/Berlin"), ZoneId.of("Asia/Kolkata"));
        Random random = new Random(7);
        long base = ms("2026-01-01T00:00:00Z");
        for (String source : expressions) {
            CronExpression expr = CronExpression.parse(source).orElseThrow();
            for (ZoneId zone : zones) {
                for (int i = 0; i < 5; i++) {
                    long from = base + (long) (random.nextDouble() * 365L * 24 * 3_600_000L);
                    long next = expr.nextAfter(from, zone).orElseThrow();
                    assertTrue(next > from, source + " from " + from);
                    assertTrue(expr.matches(Instant.ofEpochMilli(next), zone), source + " at " + next);
                    assertEquals(0, next % 60_000L);
                }
            }
        }
    }
}
