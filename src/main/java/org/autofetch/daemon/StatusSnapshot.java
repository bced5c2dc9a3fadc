package org.autofetch.daemon;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the control loop, published after every iteration for the admin surface.
 */
public record StatusSnapshot(
        String state,
        Instant generatedAt,
        List<Pending> queue,
        List<Running> workers,
        Instant lastReloadAt,
        String lastReloadError
) {

    public record Pending(String job, String schedule, Instant triggerTime) {}

    public record Running(String job, long pid, String label, Instant triggerTime, Instant startedAt) {}

    public static StatusSnapshot starting() {
        return new StatusSnapshot("STARTING", Instant.now(), List.of(), List.of(), null, null);
    }
}
