package org.autofetch.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogDirectoriesTest {

    @TempDir
    Path base;

    @Test
    void createsYearAndMonthDayDirectories() {
        Path dir = LogDirectories.dayLogDir(base, Instant.parse("2025-03-04T23:30:00Z"), ZoneOffset.UTC);

        assertEquals(base.resolve("2025").resolve("03-04"), dir);
        assertTrue(Files.isDirectory(dir));
    }

    @Test
    void usesTheTimestampsLocalDay() {
        // 23:30 UTC is already the next day in Sydney
        Path dir = LogDirectories.dayLogDir(base, Instant.parse("2025-12-31T23:30:00Z"),
                ZoneId.of("Australia/Sydney"));

        assertEquals(base.resolve("2026").resolve("01-01"), dir);
    }

    @Test
    void isIdempotent() {
        Instant t = Instant.parse("2025-03-04T10:00:00Z");

        Path first = LogDirectories.dayLogDir(base, t, ZoneOffset.UTC);
        Path second = LogDirectories.dayLogDir(base, t, ZoneOffset.UTC);

        assertEquals(first, second);
    }
}
