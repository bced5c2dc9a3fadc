package org.autofetch.worker;

import org.autofetch.config.FetchConfig;
import org.autofetch.schedule.ScheduledJob;
import org.autofetch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs each trigger in a child JVM executing {@link WorkerMain}.
 * <p>
 * The child's stdout and stderr are redirected by the OS to
 * {@code <logDirectory>/<HHMM>-<file-id>.log} before any job code runs. The readable
 * label {@code fetch <HHMM> <job>} is put on the child's command line so it shows up in
 * process listings.
 */
public class ProcessJobRunner implements JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessJobRunner.class);

    static final String TITLE_PROPERTY = "autofetch.title";
    private static final DateTimeFormatter HHMM = DateTimeFormatter.ofPattern("HHmm");

    private final String javaCommand;
    private final List<String> jvmOptions;
    private final String classpath;
    private final ZoneId zone;
    private final Clock clock;

    public ProcessJobRunner(String javaCommand, List<String> jvmOptions, String classpath, ZoneId zone, Clock clock) {
        this.javaCommand = javaCommand;
        this.jvmOptions = List.copyOf(jvmOptions);
        this.classpath = classpath;
        this.zone = zone;
        this.clock = clock;
    }

    /** Runner for the daemon's own JVM and classpath, honouring the configured worker settings. */
    public static ProcessJobRunner forConfig(FetchConfig.Worker worker, ZoneId zone) {
        String javaCommand = worker.javaCommand() != null
                ? worker.javaCommand()
                : Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return new ProcessJobRunner(javaCommand, worker.jvmOptions(),
                System.getProperty("java.class.path"), zone, Clock.system(zone));
    }

    @Override
    public WorkerHandle spawn(ScheduledJob job, Instant triggerTime, Path logDirectory, Path lockDirectory) {
        String hhmm = HHMM.format(triggerTime.atZone(zone));
        String fileId = FileIds.of(job.name());
        Path logFile = logDirectory.resolve(hhmm + "-" + fileId + ".log");
        Path lockFile = new LockManager(lockDirectory).lockFile(job.name());
        String label = "fetch " + hhmm + " " + job.name();

        logger.info("Spawning {}. Log {}, Lock {}", label, logFile, lockFile);
        logger.debug("Source info {}", job.source());

        ProcessBuilder builder = new ProcessBuilder(command(label))
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.to(logFile.toFile()));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start worker for " + job.name(), e);
        }

        WorkerRequest request = new WorkerRequest(job.name(), triggerTime, label,
                lockDirectory.toString(), job.source());
        try (OutputStream stdin = process.getOutputStream()) {
            JsonUtil.mapper().writeValue(stdin, request);
        } catch (IOException e) {
            // the worker exits non-zero without a request; the reaper reports it
            logger.warn("Could not send request to {} (pid {}): {}", label, process.pid(), e.getMessage());
        }

        return new WorkerHandle(process, process.pid(), job.name(), triggerTime, clock.instant(), label);
    }

    List<String> command(String label) {
        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        command.addAll(jvmOptions);
        command.add("-D" + TITLE_PROPERTY + "=" + label);
        command.add("-Dlogback.configurationFile=" + WorkerMain.LOGBACK_CONFIG);
        command.add("-cp");
        command.add(classpath);
        command.add(WorkerMain.class.getName());
        return command;
    }
}
