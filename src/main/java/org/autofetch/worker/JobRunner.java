package org.autofetch.worker;

import org.autofetch.schedule.ScheduledJob;

import java.nio.file.Path;
import java.time.Instant;

public interface JobRunner {

    /**
     * Starts one trigger of {@code job} in an isolated worker and returns without waiting for it.
     */
    WorkerHandle spawn(ScheduledJob job, Instant triggerTime, Path logDirectory, Path lockDirectory);
}
