package org.autofetch.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by the daemon and its workers.
 * The daemon logs under component "ControlLoop"; a worker logs under its run label
 * and also carries the job name, so one trace id covers exactly one trigger.
 */
public class LogContext {
    static final String COMPONENT = "component";
    static final String TRACE_ID = "trace.id";
    static final String JOB = "job";

    private LogContext() {}

    public static void start(String component) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, UUID.randomUUID().toString());
    }

    /** Context of one worker run. */
    public static void startRun(String label, String jobName) {
        start(label);
        MDC.put(JOB, jobName);
    }

    public static void clear() {
        MDC.clear();
    }
}
