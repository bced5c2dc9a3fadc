package org.autofetch.daemon;

import org.autofetch.config.FetchConfig;
import org.autofetch.schedule.TriggerQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Run state of the daemon, written only by the control loop thread.
 * <p>
 * The lock directory and time zone are fixed by the first {@link #apply}: workers already
 * running hold locks under that directory. Queue, base directory and log directory are
 * replaced together on every apply.
 */
public class RunState {
    private static final Logger logger = LoggerFactory.getLogger(RunState.class);

    private volatile boolean exiting;

    private TriggerQueue queue;
    private Path baseDirectory;
    private Path logDirectory;
    private Duration idleSleep = FetchConfig.DEFAULT_IDLE_SLEEP;

    private Path lockDirectory;
    private ZoneId zone;

    /**
     * Installs a freshly loaded configuration. Nothing is changed if a directory cannot be created.
     */
    public void apply(FetchConfig config, Instant now) {
        if (zone != null && !zone.equals(config.zone())) {
            logger.warn("Time zone change to {} ignored until restart, keeping {}", config.zone(), zone);
        }
        ZoneId effectiveZone = zone != null ? zone : config.zone();

        Path newLockDirectory = lockDirectory != null ? lockDirectory : config.directory().resolve("lock");
        Path newLogDirectory = config.directory().resolve("log");
        createDirectories(newLockDirectory);
        createDirectories(newLogDirectory);

        TriggerQueue newQueue = new TriggerQueue(config.jobs(), now, effectiveZone);

        this.zone = effectiveZone;
        this.lockDirectory = newLockDirectory;
        this.queue = newQueue;
        this.baseDirectory = config.directory();
        this.logDirectory = newLogDirectory;
        this.idleSleep = config.idleSleep();
    }

    /**
     * Moves to the exiting state. Never reset.
     *
     * @return true on the first call only
     */
    public boolean markExiting() {
        if (exiting) {
            return false;
        }
        exiting = true;
        return true;
    }

    public boolean isExiting() {
        return exiting;
    }

    public TriggerQueue queue() {
        return queue;
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public Path logDirectory() {
        return logDirectory;
    }

    public Path lockDirectory() {
        return lockDirectory;
    }

    public ZoneId zone() {
        return zone;
    }

    public Duration idleSleep() {
        return idleSleep;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }
}
