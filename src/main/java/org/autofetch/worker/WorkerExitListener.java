package org.autofetch.worker;

/**
 * Alerting hook called once for every reported worker exit, after it has been logged.
 */
@FunctionalInterface
public interface WorkerExitListener {

    WorkerExitListener NONE = (handle, exitCode) -> {};

    void workerExited(WorkerHandle handle, int exitCode);
}
