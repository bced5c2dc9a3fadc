package org.autofetch.daemon;

import org.autofetch.config.ConfigInvalidException;
import org.autofetch.config.FetchConfig;
import org.autofetch.config.utils.LogContext;
import org.autofetch.schedule.QueueEntry;
import org.autofetch.schedule.TriggerQueue;
import org.autofetch.worker.ChildReaper;
import org.autofetch.worker.JobRunner;
import org.autofetch.worker.LogDirectories;
import org.autofetch.worker.WorkerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Main loop of the daemon. Dispatches due jobs in trigger order, reschedules them from the
 * current time, reaps finished workers and reacts to {@link ControlEvent}s.
 * <p>
 * Single-threaded: every read and write of {@link RunState} happens on the thread calling
 * {@link #run()}. The only suspension point is the wait on the event channel, so a reload or
 * shutdown request ends a sleep immediately. Shutdown stops dispatch and then waits for every
 * running worker to exit; workers are never killed.
 */
public class ControlLoop {
    private static final Logger logger = LoggerFactory.getLogger(ControlLoop.class);

    static final Duration WAKE_MARGIN = Duration.ofMillis(100);

    private final RunState state;
    private final ConfigSource configSource;
    private final JobRunner runner;
    private final ChildReaper reaper;
    private final ControlEvents events;
    private final Clock clock;

    private Set<WorkerHandle> running = new LinkedHashSet<>();
    private Instant lastReloadAt;
    private String lastReloadError;
    private final AtomicReference<StatusSnapshot> status = new AtomicReference<>(StatusSnapshot.starting());

    public ControlLoop(RunState state, ConfigSource configSource, JobRunner runner,
                       ChildReaper reaper, ControlEvents events, Clock clock) {
        this.state = state;
        this.configSource = configSource;
        this.runner = runner;
        this.reaper = reaper;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Runs until a shutdown is requested, then drains all workers.
     * The drain also runs when the loop itself fails or is interrupted; the failure is
     * rethrown once every worker has exited.
     */
    public void run() throws InterruptedException {
        LogContext.start("ControlLoop");
        try {
            logger.info("Control loop started with {} scheduled jobs", state.queue().size());
            while (!state.isExiting()) {
                Duration wait = iterate();
                if (!wait.isZero() && !state.isExiting()) {
                    ControlEvent event = events.await(wait);
                    if (event != null) {
                        handle(event);
                    }
                }
            }
        } catch (InterruptedException e) {
            logger.error("Control loop interrupted, draining workers");
            throw e;
        } catch (RuntimeException | Error e) {
            logger.error("Control loop failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            try {
                drainWorkers();
            } finally {
                LogContext.clear();
            }
        }
    }

    private void drainWorkers() throws InterruptedException {
        state.markExiting();
        publish();
        reaper.drain(running);
        running = new LinkedHashSet<>();
        publish("STOPPED");
        logger.info("All workers finished");
    }

    /**
     * One pass of the loop.
     *
     * @return how long to wait for an event before the next pass; zero to continue at once
     */
    Duration iterate() {
        for (ControlEvent event : events.drain()) {
            handle(event);
        }
        if (state.isExiting()) {
            return Duration.ZERO;
        }

        running = reaper.poll(running);
        logger.debug("{} recorded children, {} total children", running.size(), reaper.childCount());

        TriggerQueue queue = state.queue();
        if (queue.isEmpty()) {
            logger.info("No scheduled jobs. Sleeping.");
            publish();
            return state.idleSleep();
        }

        Instant now = clock.instant();
        QueueEntry next = queue.peek();

        if (!next.triggerTime().isAfter(now)) {
            QueueEntry due = queue.pop();
            Path logDirectory = LogDirectories.dayLogDir(state.logDirectory(), due.triggerTime(), state.zone());
            WorkerHandle handle = runner.spawn(due.job(), due.triggerTime(), logDirectory, state.lockDirectory());
            running.add(handle);

            Instant nextTrigger = queue.reschedule(due.job(), now);
            logger.debug("Next trigger of {} in {}", due.job().name(), Duration.between(now, nextTrigger));
            publish();
            return Duration.ZERO;
        }

        Duration sleep = Duration.between(now, next.triggerTime()).plus(WAKE_MARGIN);
        logger.debug("Sleeping for {} until {}", sleep, next.job().name());
        publish();
        return sleep;
    }

    void handle(ControlEvent event) {
        switch (event) {
            case SHUTDOWN_REQUESTED -> {
                if (state.markExiting()) {
                    logger.info("Shutdown requested, no further jobs will be dispatched");
                }
            }
            case RELOAD_REQUESTED -> reload();
        }
    }

    private void reload() {
        logger.info("Reloading configuration");
        lastReloadAt = clock.instant();
        try {
            FetchConfig config = configSource.load();
            state.apply(config, clock.instant());
            lastReloadError = null;
            logger.debug("{} jobs loaded", state.queue().size());
        } catch (ConfigInvalidException | UncheckedIOException | IllegalArgumentException e) {
            lastReloadError = e.getMessage();
            logger.error("Reload failed, keeping previous schedule: {}", e.getMessage(), e);
        }
    }

    public StatusSnapshot status() {
        return status.get();
    }

    Set<WorkerHandle> running() {
        return Set.copyOf(running);
    }

    private void publish() {
        publish(state.isExiting() ? "EXITING" : "RUNNING");
    }

    private void publish(String phase) {
        List<StatusSnapshot.Pending> pending = state.queue().entries().stream()
                .map(e -> new StatusSnapshot.Pending(e.job().name(), e.job().schedule().pattern(), e.triggerTime()))
                .collect(Collectors.toList());
        List<StatusSnapshot.Running> workers = running.stream()
                .map(h -> new StatusSnapshot.Running(h.jobName(), h.pid(), h.label(), h.triggerTime(), h.startTime()))
                .collect(Collectors.toList());
        status.set(new StatusSnapshot(phase, clock.instant(), pending, workers, lastReloadAt, lastReloadError));
    }
}
