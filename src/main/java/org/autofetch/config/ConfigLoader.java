package org.autofetch.config;

import org.autofetch.config.utils.XmlUtil;
import org.autofetch.schedule.CronSchedule;
import org.autofetch.schedule.ScheduledJob;
import org.autofetch.sources.DataSourceFactory;
import org.autofetch.sources.DataSourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Reads the XML file and returns a fully validated {@link FetchConfig}.
     */
    public static FetchConfig load(Path xmlPath) throws ConfigInvalidException {
        XmlConfiguration raw;
        try {
            Document doc = XmlUtil.readDocument(xmlPath);
            raw = XmlUtil.unmarshal(doc, XmlConfiguration.class);
        } catch (Exception e) {
            throw new ConfigInvalidException("Failed to read config file " + xmlPath + ": " + e.getMessage(), e);
        }
        FetchConfig config = validate(raw);
        logger.debug("Configuration loaded from {}: {} jobs", xmlPath, config.jobs().size());
        return config;
    }

    static FetchConfig validate(XmlConfiguration raw) throws ConfigInvalidException {
        if (raw.directory == null || raw.directory.isBlank()) {
            throw new ConfigInvalidException("Missing <directory> in configuration");
        }
        Path directory = Path.of(raw.directory.trim());
        if (!Files.isDirectory(directory)) {
            throw new ConfigInvalidException("Configured base folder does not exist: " + directory);
        }

        ZoneId zone;
        try {
            zone = raw.timezone == null || raw.timezone.isBlank()
                    ? ZoneId.systemDefault()
                    : ZoneId.of(raw.timezone.trim());
        } catch (DateTimeException e) {
            throw new ConfigInvalidException("Unknown <timezone>: " + raw.timezone, e);
        }

        Duration idleSleep = FetchConfig.DEFAULT_IDLE_SLEEP;
        if (raw.idleSleepSeconds != null) {
            if (raw.idleSleepSeconds <= 0) {
                throw new ConfigInvalidException("<idleSleepSeconds> must be positive, was " + raw.idleSleepSeconds);
            }
            idleSleep = Duration.ofSeconds(raw.idleSleepSeconds);
        }

        List<ScheduledJob> jobs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (XmlConfiguration.Job job : raw.jobs) {
            ScheduledJob parsed = toJob(job, zone);
            if (!names.add(parsed.name())) {
                throw new ConfigInvalidException("Duplicate job name: " + parsed.name());
            }
            jobs.add(parsed);
        }

        return new FetchConfig(directory, zone, idleSleep, jobs, toWorker(raw.worker), toAdmin(raw.admin));
    }

    private static ScheduledJob toJob(XmlConfiguration.Job job, ZoneId zone) throws ConfigInvalidException {
        if (job.name == null || job.name.isBlank()) {
            throw new ConfigInvalidException("Job without a name attribute");
        }
        String name = job.name.trim();
        if (job.source == null || job.source.isBlank()) {
            throw new ConfigInvalidException("Job '" + name + "' has no <source>");
        }

        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(job.schedule);
            schedule.nextAfter(Instant.now(), zone);
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("Job '" + name + "': " + e.getMessage(), e);
        }

        String type = job.source.trim();
        try {
            DataSourceFactory.resolve(type);
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("Job '" + name + "': " + e.getMessage(), e);
        }

        Map<String, String> properties = new LinkedHashMap<>();
        for (XmlConfiguration.Property property : job.properties) {
            if (property.name == null || property.name.isBlank()) {
                throw new ConfigInvalidException("Job '" + name + "' has a property without a name");
            }
            properties.put(property.name, property.value == null ? "" : property.value);
        }
        return new ScheduledJob(name, schedule, new DataSourceSpec(type, properties));
    }

    private static FetchConfig.Worker toWorker(XmlConfiguration.Worker worker) {
        if (worker == null) {
            return FetchConfig.Worker.defaults();
        }
        String javaCommand = worker.javaCommand == null || worker.javaCommand.isBlank()
                ? null : worker.javaCommand.trim();
        List<String> jvmOptions = worker.jvmOptions == null || worker.jvmOptions.isBlank()
                ? List.of()
                : Arrays.asList(worker.jvmOptions.trim().split("\\s+"));
        return new FetchConfig.Worker(javaCommand, jvmOptions);
    }

    private static FetchConfig.Admin toAdmin(XmlConfiguration.Admin admin) throws ConfigInvalidException {
        if (admin == null || !admin.enabled) {
            return FetchConfig.Admin.disabled();
        }
        if (admin.port < 0 || admin.port > 65535) {
            throw new ConfigInvalidException("<admin><port> out of range: " + admin.port);
        }
        String host = admin.host == null || admin.host.isBlank() ? "127.0.0.1" : admin.host.trim();
        return new FetchConfig.Admin(true, host, admin.port);
    }
}
