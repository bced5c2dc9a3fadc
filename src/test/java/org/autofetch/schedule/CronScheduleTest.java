package org.autofetch.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronScheduleTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void everyMinuteFiresAtNextWholeMinute() {
        CronSchedule cron = CronSchedule.parse("* * * * *");

        assertEquals(Instant.parse("2025-01-01T12:01:00Z"),
                cron.nextAfter(Instant.parse("2025-01-01T12:00:30Z"), UTC));
    }

    @Test
    void baseOnAnOccurrenceYieldsTheFollowingOne() {
        CronSchedule cron = CronSchedule.parse("*/15 * * * *");

        assertEquals(Instant.parse("2025-01-01T12:30:00Z"),
                cron.nextAfter(Instant.parse("2025-01-01T12:15:00Z"), UTC));
        assertEquals(Instant.parse("2025-01-01T12:15:00Z"),
                cron.nextAfter(Instant.parse("2025-01-01T12:14:59.999Z"), UTC));
    }

    @Test
    void dayOfWeekUsesUnixNumbering() {
        // 2025-01-01 is a Wednesday; 1 = Monday
        CronSchedule cron = CronSchedule.parse("0 3 * * 1");

        assertEquals(Instant.parse("2025-01-06T03:00:00Z"),
                cron.nextAfter(Instant.parse("2025-01-01T00:00:00Z"), UTC));
    }

    @Test
    void sixthFieldIsTrailingSeconds() {
        // 2025-01-01 is a Wednesday: the trailing 0 is second zero, not Sunday
        CronSchedule everyFiveMinutes = CronSchedule.parse("*/5 * * * * 0");
        assertEquals(Instant.parse("2025-01-01T12:05:00Z"),
                everyFiveMinutes.nextAfter(Instant.parse("2025-01-01T12:00:00Z"), UTC));

        CronSchedule halfMinutePastTwo = CronSchedule.parse("0 2 * * * 30");
        assertEquals(Instant.parse("2025-01-02T02:00:30Z"),
                halfMinutePastTwo.nextAfter(Instant.parse("2025-01-01T12:00:00Z"), UTC));

        CronSchedule everyTenSeconds = CronSchedule.parse("* * * * * */10");
        assertEquals(Instant.parse("2025-01-01T12:00:10Z"),
                everyTenSeconds.nextAfter(Instant.parse("2025-01-01T12:00:00Z"), UTC));
    }

    @Test
    void nicknamesAreAccepted() {
        Instant base = Instant.parse("2025-01-01T12:30:00Z");

        assertEquals(Instant.parse("2025-01-02T00:00:00Z"), CronSchedule.parse("@daily").nextAfter(base, UTC));
        assertEquals(Instant.parse("2025-01-02T00:00:00Z"), CronSchedule.parse("@midnight").nextAfter(base, UTC));
        assertEquals(Instant.parse("2025-01-01T13:00:00Z"), CronSchedule.parse("@hourly").nextAfter(base, UTC));
        assertEquals(Instant.parse("2025-01-05T00:00:00Z"), CronSchedule.parse("@weekly").nextAfter(base, UTC));
        assertEquals(Instant.parse("2025-02-01T00:00:00Z"), CronSchedule.parse("@monthly").nextAfter(base, UTC));
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), CronSchedule.parse("@yearly").nextAfter(base, UTC));
        assertEquals("@daily", CronSchedule.parse(" @daily ").pattern());
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("@reboot"));
    }

    @Test
    void evaluatesInTheGivenZone() {
        CronSchedule cron = CronSchedule.parse("0 2 * * *");
        // 11:00 in Sydney (UTC+11 in January)
        Instant base = Instant.parse("2025-01-01T00:00:00Z");

        assertEquals(Instant.parse("2025-01-01T15:00:00Z"),
                cron.nextAfter(base, ZoneId.of("Australia/Sydney")));
    }

    @Test
    void nextIsAlwaysStrictlyAfterBase() {
        List<String> patterns = List.of("* * * * *", "*/5 * * * *", "0 0 * * *", "30 4 1 * *",
                "0 12 * * 0", "15,45 * * * *", "* * * * * *", "0 0 1 1 * 0", "*/5 * * * * 0", "@daily");
        List<Instant> bases = List.of(
                Instant.parse("2025-01-01T00:00:00Z"),
                Instant.parse("2025-02-28T23:59:59.999Z"),
                Instant.parse("2024-02-29T12:00:00Z"),
                Instant.parse("2025-12-31T23:59:00Z"),
                Instant.parse("2025-06-15T04:30:00.000000001Z"));

        for (String pattern : patterns) {
            CronSchedule cron = CronSchedule.parse(pattern);
            for (Instant base : bases) {
                Instant next = cron.nextAfter(base, UTC);
                assertTrue(next.isAfter(base), pattern + " from " + base + " gave " + next);
            }
        }
    }

    @Test
    void normalisesWhitespace() {
        assertEquals("0 3 * * *", CronSchedule.parse("  0  3 * *   * ").pattern());
    }

    @Test
    void rejectsMalformedPatterns() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse(null));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("* * *"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("61 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("* 25 * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("* * * * * * * *"));
    }
}
