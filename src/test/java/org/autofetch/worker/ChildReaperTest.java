package org.autofetch.worker;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChildReaperTest {

    private final List<Integer> exits = new CopyOnWriteArrayList<>();
    private final ChildReaper reaper = new ChildReaper((handle, exitCode) -> exits.add(exitCode));

    private static WorkerHandle handle(FakeProcess process, String job) {
        Instant t = Instant.parse("2025-06-01T10:01:00Z");
        return new WorkerHandle(process, process.pid(), job, t, t, "fetch 1001 " + job);
    }

    @Test
    void runningWorkersStayTracked() {
        WorkerHandle running = handle(new FakeProcess(101), "a");

        Set<WorkerHandle> still = reaper.poll(Set.of(running));

        assertEquals(Set.of(running), still);
        assertTrue(exits.isEmpty());
    }

    @Test
    void finishedWorkersAreReportedAndDropped() {
        WorkerHandle ok = handle(FakeProcess.finished(102, 0), "ok");
        WorkerHandle failed = handle(FakeProcess.finished(103, 3), "failed");
        WorkerHandle running = handle(new FakeProcess(104), "running");

        Set<WorkerHandle> still = reaper.poll(new LinkedHashSet<>(List.of(ok, failed, running)));

        assertEquals(Set.of(running), still);
        assertEquals(List.of(0, 3), exits);
    }

    @Test
    void unreadableStatusIsRetainedAndRepolled() {
        FakeProcess process = new FakeProcess(105);
        process.setStatusUnreadable(true);
        WorkerHandle racing = handle(process, "racing");

        Set<WorkerHandle> still = reaper.poll(Set.of(racing));
        assertEquals(Set.of(racing), still);
        assertTrue(exits.isEmpty());

        process.setStatusUnreadable(false);
        process.finish(0);
        assertTrue(reaper.poll(still).isEmpty());
        assertEquals(List.of(0), exits);
    }

    @Test
    void drainWaitsForEveryWorker() throws Exception {
        FakeProcess first = new FakeProcess(106);
        FakeProcess second = new FakeProcess(107);
        Set<WorkerHandle> tracked = new LinkedHashSet<>(List.of(handle(first, "a"), handle(second, "b")));

        List<Throwable> errors = new ArrayList<>();
        Thread drainer = new Thread(() -> {
            try {
                reaper.drain(tracked);
            } catch (InterruptedException e) {
                errors.add(e);
            }
        });
        drainer.start();

        drainer.join(300);
        assertTrue(drainer.isAlive(), "drain must block while workers run");

        first.finish(0);
        drainer.join(300);
        assertTrue(drainer.isAlive());

        second.finish(1);
        drainer.join(5000);
        assertFalse(drainer.isAlive());
        assertTrue(errors.isEmpty());
        assertEquals(List.of(0, 1), exits);
    }
}
