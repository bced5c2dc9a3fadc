package org.autofetch.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Min-heap of pending triggers, one entry per job.
 * Recurrence is modelled by {@link #pop()} followed by {@link #reschedule(ScheduledJob, Instant)}.
 * Not thread-safe: owned by the control loop thread.
 */
public class TriggerQueue {

    private final PriorityQueue<QueueEntry> entries = new PriorityQueue<>();
    private final Set<String> pending = new HashSet<>();
    private final ZoneId zone;

    public TriggerQueue(Collection<ScheduledJob> jobs, Instant baseTime, ZoneId zone) {
        this.zone = zone;
        for (ScheduledJob job : jobs) {
            reschedule(job, baseTime);
        }
    }

    public static TriggerQueue empty(ZoneId zone) {
        return new TriggerQueue(List.of(), Instant.EPOCH, zone);
    }

    /** Earliest entry, left in place. */
    public QueueEntry peek() {
        QueueEntry head = entries.peek();
        if (head == null) {
            throw new EmptyQueueException();
        }
        return head;
    }

    /** Removes and returns the earliest entry. */
    public QueueEntry pop() {
        QueueEntry head = entries.poll();
        if (head == null) {
            throw new EmptyQueueException();
        }
        pending.remove(head.job().name());
        return head;
    }

    /**
     * Inserts the job's next occurrence strictly after {@code baseTime}.
     *
     * @return the computed trigger time
     * @throws IllegalStateException if the job already has a pending entry
     */
    public Instant reschedule(ScheduledJob job, Instant baseTime) {
        if (pending.contains(job.name())) {
            throw new IllegalStateException("Job '" + job.name() + "' already has a pending trigger");
        }
        Instant next = job.schedule().nextAfter(baseTime, zone);
        entries.add(new QueueEntry(next, job));
        pending.add(job.name());
        return next;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public ZoneId zone() {
        return zone;
    }

    /** Snapshot of all pending entries in trigger order. */
    public List<QueueEntry> entries() {
        List<QueueEntry> sorted = new ArrayList<>(entries);
        sorted.sort(null);
        return sorted;
    }
}
