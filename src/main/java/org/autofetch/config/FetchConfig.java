package org.autofetch.config;

import org.autofetch.schedule.ScheduledJob;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Validated, immutable daemon configuration.
 */
public record FetchConfig(
        Path directory,
        ZoneId zone,
        Duration idleSleep,
        List<ScheduledJob> jobs,
        Worker worker,
        Admin admin
) {

    public static final Duration DEFAULT_IDLE_SLEEP = Duration.ofSeconds(500);

    public FetchConfig {
        jobs = List.copyOf(jobs);
    }

    public record Worker(String javaCommand, List<String> jvmOptions) {
        public Worker {
            jvmOptions = List.copyOf(jvmOptions);
        }

        public static Worker defaults() {
            return new Worker(null, List.of());
        }
    }

    public record Admin(boolean enabled, String host, int port) {
        public static Admin disabled() {
            return new Admin(false, "127.0.0.1", 0);
        }
    }
}
