package org.autofetch.sources;

/**
 * The work behind a fetch job. Only ever invoked inside a worker process.
 * <p>
 * Implementations provide a public constructor taking {@code Map<String, String>}
 * (the job's configured properties) or a public no-arg constructor.
 */
public interface DataSource {

    /**
     * Performs one fetch, reporting each file outcome to {@code reporter}.
     * Anything thrown ends the worker with a failure exit status.
     */
    void trigger(FetchReporter reporter) throws Exception;
}
