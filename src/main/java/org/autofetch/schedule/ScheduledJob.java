package org.autofetch.schedule;

import org.autofetch.sources.DataSourceSpec;

import java.util.Objects;

/**
 * A named, independently scheduled fetch job. The source is opaque to the engine:
 * it is only ever instantiated inside a worker process.
 */
public record ScheduledJob(String name, CronSchedule schedule, DataSourceSpec source) {

    public ScheduledJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(source, "source");
    }
}
