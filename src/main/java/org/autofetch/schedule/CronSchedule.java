package org.autofetch.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed cron pattern. Five fields use UNIX semantics
 * (minute, hour, day-of-month, month, day-of-week); a sixth, trailing field holds the seconds.
 * The nicknames {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly},
 * {@code @daily}, {@code @midnight} and {@code @hourly} are accepted.
 * Occurrences are always computed from a caller-supplied base time.
 */
public final class CronSchedule {

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private static final Map<String, String> NICKNAMES = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private final String pattern;
    private final ExecutionTime executionTime;

    private CronSchedule(String pattern, ExecutionTime executionTime) {
        this.pattern = pattern;
        this.executionTime = executionTime;
    }

    public static CronSchedule parse(String pattern) {
        String expr = pattern == null ? "" : pattern.trim().replaceAll("\\s+", " ");
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("cron pattern is required");
        }
        String fieldsExpr = expr;
        if (expr.startsWith("@")) {
            fieldsExpr = NICKNAMES.get(expr.toLowerCase(Locale.ROOT));
            if (fieldsExpr == null) {
                throw new IllegalArgumentException("Unsupported cron nickname '" + expr + "'");
            }
        }

        String[] fields = fieldsExpr.split(" ");
        CronParser parser;
        String parsed;
        switch (fields.length) {
            case 5 -> {
                parser = UNIX_PARSER;
                parsed = fieldsExpr;
            }
            case 6 -> {
                // the seconds parser expects seconds first
                parser = SECONDS_PARSER;
                parsed = fields[5] + " " + String.join(" ", Arrays.copyOf(fields, 5));
            }
            default -> throw new IllegalArgumentException(
                    "cron pattern '" + pattern + "' must have 5 or 6 fields, found " + fields.length);
        }

        Cron cron;
        try {
            cron = parser.parse(parsed).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron pattern '" + pattern + "': " + e.getMessage(), e);
        }
        return new CronSchedule(expr, ExecutionTime.forCron(cron));
    }

    /**
     * Earliest occurrence strictly after {@code base}, evaluated in the wall-clock time of {@code zone}.
     *
     * @throws IllegalArgumentException if the pattern never fires again
     */
    public Instant nextAfter(Instant base, ZoneId zone) {
        Optional<ZonedDateTime> next = executionTime.nextExecution(base.atZone(zone));
        while (next.isPresent() && !next.get().toInstant().isAfter(base)) {
            next = executionTime.nextExecution(next.get().plusSeconds(1));
        }
        return next.map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new IllegalArgumentException(
                        "cron pattern '" + pattern + "' has no occurrence after " + base));
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CronSchedule other && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
