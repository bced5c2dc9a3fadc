package org.autofetch.worker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public final class LogDirectories {

    private static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy");
    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

    private LogDirectories() {}

    /**
     * {@code <base>/<yyyy>/<MM-dd>} for the calendar day of {@code timestamp} in {@code zone},
     * created if absent. Keyed by the trigger time so a late run still lands on its scheduled day.
     */
    public static Path dayLogDir(Path baseLogDirectory, Instant timestamp, ZoneId zone) {
        ZonedDateTime t = timestamp.atZone(zone);
        Path dir = baseLogDirectory.resolve(YEAR.format(t)).resolve(MONTH_DAY.format(t));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory " + dir, e);
        }
        return dir;
    }
}
