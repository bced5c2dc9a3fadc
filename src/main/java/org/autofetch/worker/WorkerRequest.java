package org.autofetch.worker;

import org.autofetch.sources.DataSourceSpec;

import java.time.Instant;

/**
 * Everything a worker needs to run one trigger. Sent as JSON on the worker's stdin.
 */
public record WorkerRequest(String jobName, Instant triggerTime, String label,
                            String lockDirectory, DataSourceSpec source) {
}
