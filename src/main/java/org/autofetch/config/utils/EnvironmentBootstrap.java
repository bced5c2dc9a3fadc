package org.autofetch.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * EnvironmentBootstrap acts as the universal environment bootstrap of the daemon.
 *
 * Responsibilities:
 *  1. Loads environment variables (.env or system)
 *  2. Initializes the correct Logback config (dev/prod)
 *  3. Resolves the configuration file path
 */
public class EnvironmentBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentBootstrap.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static final String ENV_CONFIG_PATH = "AUTOFETCH_CONFIG";
    private static final String DEFAULT_CONFIG_PATH = "autofetch.xml";

    private static boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    private EnvironmentBootstrap() {}

    /** Initialize environment and logger config. */
    public static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure().ignoreIfMissing().load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            if ("DEVELOPMENT".equals(activeEnv)) {
                loadLogbackFromClasspath("logback-dev.xml");
                logger.info("Environment set to DEVELOPMENT, using logback-dev.xml");
            } else {
                loadLogbackFromClasspath("logback.xml");
                logger.info("Environment set to PRODUCTION, using logback.xml");
            }

            initialized = true;
        } catch (Exception e) {
            logger.error("Failed to initialize environment: {}", e.getMessage(), e);
            throw new IllegalStateException("Environment initialization failed.", e);
        }
    }

    /**
     * Configuration path: first CLI argument, else AUTOFETCH_CONFIG from the
     * environment or .env, else autofetch.xml in the working directory.
     */
    public static Path configPath(String[] args) {
        if (!initialized) init();

        if (args != null && args.length > 0 && !args[0].isBlank()) {
            return Path.of(args[0]);
        }
        String path = System.getenv(ENV_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = dotenv.get(ENV_CONFIG_PATH, DEFAULT_CONFIG_PATH);
        }
        return Path.of(path);
    }

    /** Active environment; before {@link #init()} it is read from the process environment only. */
    public static String getEnvironment() {
        if (initialized) return activeEnv;
        String env = System.getenv(ENV_ENVIRONMENT);
        return env == null || env.isBlank() ? "PRODUCTION" : env.toUpperCase();
    }

    private static void loadLogbackFromClasspath(String resourceName) {
        try (InputStream in = EnvironmentBootstrap.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                System.err.println("Logback config not found on classpath: " + resourceName);
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        } catch (Exception e) {
            System.err.println("Failed to load logback config: " + resourceName + " (" + e.getMessage() + ")");
        }
    }
}
