package org.autofetch.schedule;

import java.time.Instant;
import java.util.Comparator;

/**
 * One pending trigger. Ordered by trigger time, then by job name, so the order is total.
 */
public record QueueEntry(Instant triggerTime, ScheduledJob job) implements Comparable<QueueEntry> {

    private static final Comparator<QueueEntry> ORDER = Comparator
            .comparing(QueueEntry::triggerTime)
            .thenComparing(entry -> entry.job().name());

    @Override
    public int compareTo(QueueEntry other) {
        return ORDER.compare(this, other);
    }
}
