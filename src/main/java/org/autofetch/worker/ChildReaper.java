package org.autofetch.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects finished workers and reports their exit status.
 */
public class ChildReaper {
    private static final Logger logger = LoggerFactory.getLogger(ChildReaper.class);

    private final WorkerExitListener exitListener;

    public ChildReaper() {
        this(WorkerExitListener.NONE);
    }

    public ChildReaper(WorkerExitListener exitListener) {
        this.exitListener = exitListener;
    }

    /**
     * Non-blocking pass over the tracked workers.
     *
     * @return the handles that are still running, or whose exit status could not be read yet
     */
    public Set<WorkerHandle> poll(Set<WorkerHandle> tracked) {
        Set<WorkerHandle> stillRunning = new LinkedHashSet<>();
        for (WorkerHandle handle : tracked) {
            if (handle.process().isAlive()) {
                stillRunning.add(handle);
                continue;
            }
            if (!report(handle)) {
                stillRunning.add(handle);
            }
        }
        return stillRunning;
    }

    /**
     * Live children of this JVM that are not in {@code tracked}: processes whose handle
     * was never recorded, such as a spawn that failed after the process had started.
     */
    public List<ProcessHandle> untrackedChildren(Set<WorkerHandle> tracked) {
        Set<Long> trackedPids = tracked.stream().map(WorkerHandle::pid).collect(Collectors.toSet());
        return ProcessHandle.current().children()
                .filter(child -> !trackedPids.contains(child.pid()))
                .collect(Collectors.toList());
    }

    public long childCount() {
        return ProcessHandle.current().children().count();
    }

    /**
     * Blocks until every tracked worker and every untracked child has exited,
     * reporting each tracked one.
     */
    public void drain(Set<WorkerHandle> tracked) throws InterruptedException {
        List<ProcessHandle> untracked = untrackedChildren(tracked);
        logger.info("Shutting down. Joining {} children", tracked.size() + untracked.size());

        for (WorkerHandle handle : tracked) {
            handle.process().waitFor();
            if (!report(handle)) {
                logger.warn("Exit status of {} (pid {}) unavailable after wait", handle.label(), handle.pid());
            }
        }
        for (ProcessHandle child : untracked) {
            child.onExit().join();
            logger.info("Untracked child {} finished", child.pid());
        }
    }

    /**
     * Logs the exit of a finished worker.
     *
     * @return false if the exit status is not available yet
     */
    boolean report(WorkerHandle handle) {
        int exitCode;
        try {
            exitCode = handle.process().exitValue();
        } catch (IllegalThreadStateException e) {
            logger.warn("Child not finished {} {}", handle.label(), handle.pid());
            return false;
        }

        logger.debug("Child finished {} {}", handle.label(), handle.pid());
        if (exitCode != 0) {
            logger.error("Error return code {} from {}", exitCode, handle.label());
        }
        exitListener.workerExited(handle, exitCode);
        return true;
    }
}
