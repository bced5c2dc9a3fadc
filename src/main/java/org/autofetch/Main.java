package org.autofetch;

import org.autofetch.config.ConfigInvalidException;
import org.autofetch.config.ConfigLoader;
import org.autofetch.config.FetchConfig;
import org.autofetch.config.utils.EnvironmentBootstrap;
import org.autofetch.config.utils.LogContext;
import org.autofetch.daemon.ControlEvents;
import org.autofetch.daemon.ControlLoop;
import org.autofetch.daemon.RunState;
import org.autofetch.daemon.SignalEvents;
import org.autofetch.rest.AdminServer;
import org.autofetch.worker.ChildReaper;
import org.autofetch.worker.ProcessJobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Entry point
 * Load configuration from XML
 * Install signal handlers
 * Run the control loop until shutdown, then drain workers
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EnvironmentBootstrap.init();
        LogContext.start("Main");

        int status = 0;
        AdminServer admin = null;
        try {
            logger.info("[------------ Starting autofetch ------------]");

            Path configPath = EnvironmentBootstrap.configPath(args);
            FetchConfig cfg = ConfigLoader.load(configPath);
            logger.info("Configuration loaded from {}: {} jobs, base directory {}",
                    configPath, cfg.jobs().size(), cfg.directory());

            RunState state = new RunState();
            state.apply(cfg, Instant.now());

            ControlEvents events = new ControlEvents();
            SignalEvents.install(events);

            ControlLoop loop = new ControlLoop(
                    state,
                    () -> ConfigLoader.load(configPath),
                    ProcessJobRunner.forConfig(cfg.worker(), state.zone()),
                    new ChildReaper(),
                    events,
                    Clock.system(state.zone()));

            if (cfg.admin().enabled()) {
                admin = AdminServer.start(cfg.admin(), events, loop::status);
            }

            loop.run();
            logger.info("[------------ autofetch shutdown complete ------------]");

        } catch (ConfigInvalidException e) {
            logger.error("[------------ Invalid configuration: {} ------------]", e.getMessage(), e);
            status = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("[------------ Interrupted while running ------------]");
            status = 1;
        } catch (Exception e) {
            logger.error("[------------ autofetch failed: {} ------------]", e.getMessage(), e);
            status = 1;
        } finally {
            if (admin != null) {
                admin.stop();
            }
            LogContext.clear();
        }
        System.exit(status);
    }
}
