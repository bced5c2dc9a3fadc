package org.autofetch.worker;

import java.time.Instant;

/**
 * A spawned worker process, owned by the reaper's tracked set until its exit is reported.
 */
public record WorkerHandle(Process process, long pid, String jobName, Instant triggerTime,
                           Instant startTime, String label) {
}
