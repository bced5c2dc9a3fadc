package org.autofetch.daemon;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Channel from signal handlers and admin requests to the control loop.
 * Producers only post; the control loop is the only consumer.
 */
public class ControlEvents {

    private final BlockingQueue<ControlEvent> queue = new LinkedBlockingQueue<>();

    public void post(ControlEvent event) {
        queue.add(event);
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or null if none arrived in time
     */
    public ControlEvent await(Duration timeout) throws InterruptedException {
        return queue.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    /** Removes and returns all pending events without waiting. */
    public List<ControlEvent> drain() {
        List<ControlEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }
}
