package org.autofetch.worker;

import org.autofetch.config.utils.LogContext;
import org.autofetch.sources.DataSource;
import org.autofetch.sources.DataSourceFactory;
import org.autofetch.sources.LoggingReporter;
import org.autofetch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Entry point of a worker process: runs exactly one trigger of one job.
 * <p>
 * Reads a {@link WorkerRequest} from stdin, takes the job's lock (exiting 0 when it is
 * held elsewhere), then calls the source. Stdout/stderr are already the run's log file.
 * The worker is a fresh JVM: it installs no signal handlers of its own, so TERM/INT/HUP
 * keep their default dispositions.
 */
public class WorkerMain {
    private static final Logger logger = LoggerFactory.getLogger(WorkerMain.class);

    static final String LOGBACK_CONFIG = "logback-worker.xml";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_BAD_REQUEST = 2;

    public static void main(String[] args) {
        int status;
        try {
            status = run(System.in);
        } catch (RuntimeException e) {
            logger.error("Worker failed: {}", e.getMessage(), e);
            status = EXIT_FAILURE;
        }
        System.exit(status);
    }

    static int run(InputStream in) {
        WorkerRequest request;
        try {
            request = JsonUtil.mapper().readValue(in, WorkerRequest.class);
        } catch (IOException e) {
            logger.error("Unreadable worker request: {}", e.getMessage(), e);
            return EXIT_BAD_REQUEST;
        }

        String label = request.label();
        LogContext.startRun(label, request.jobName());
        Thread.currentThread().setName(label);
        try {
            LockManager locks = new LockManager(Path.of(request.lockDirectory()));
            if (!locks.tryAcquire(request.jobName())) {
                logger.debug("Lock is activated. Skipping run. {}", label);
                return EXIT_OK;
            }

            DataSource source;
            try {
                source = DataSourceFactory.create(request.source());
            } catch (IllegalArgumentException e) {
                logger.error("Cannot create source for {}: {}", label, e.getMessage(), e);
                return EXIT_BAD_REQUEST;
            }

            logger.debug("Triggering {}: {}", label, request.source());
            try {
                source.trigger(new LoggingReporter());
            } catch (Exception e) {
                logger.error("Job {} failed: {}", request.jobName(), e.getMessage(), e);
                return EXIT_FAILURE;
            }
            logger.info("Finished {}", label);
            return EXIT_OK;
        } finally {
            LogContext.clear();
        }
    }
}
