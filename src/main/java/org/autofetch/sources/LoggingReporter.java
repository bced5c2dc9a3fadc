package org.autofetch.sources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes fetch outcomes to the log, which inside a worker is the run's log file.
 */
public class LoggingReporter implements FetchReporter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingReporter.class);

    @Override
    public void fileComplete(String source, String name, String destination) {
        logger.info("Completed {}: {} -> {}", name, source, destination);
    }

    @Override
    public void fileError(String source, String message) {
        logger.info("Error ({}): {}", source, message);
    }
}
