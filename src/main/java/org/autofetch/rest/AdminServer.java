package org.autofetch.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.autofetch.config.FetchConfig;
import org.autofetch.daemon.ControlEvents;
import org.autofetch.daemon.StatusSnapshot;
import org.autofetch.rest.base.FallBack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Optional Undertow server for operators: health, scheduler status and a reload trigger.
 * Handlers never touch the run state; reloads go through the control event channel.
 */
public class AdminServer {
    private static final Logger logger = LoggerFactory.getLogger(AdminServer.class);

    private final Undertow server;

    private AdminServer(Undertow server) {
        this.server = server;
    }

    public static AdminServer start(FetchConfig.Admin cfg, ControlEvents events, Supplier<StatusSnapshot> status) {
        if (cfg == null || !cfg.enabled()) {
            throw new IllegalArgumentException("Admin server is not enabled in configuration");
        }

        PathHandler pathHandler = Handlers.path(new FallBack())
                .addPrefixPath("/system", Routes.system(events, status));

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(1)
                .setWorkerThreads(2)
                .addHttpListener(cfg.port(), cfg.host())
                .setHandler(pathHandler)
                .build();
        server.start();

        AdminServer admin = new AdminServer(server);
        logger.info("Admin server started on http://{}:{}/system", cfg.host(), admin.port());
        return admin;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public void stop() {
        server.stop();
        logger.info("Admin server stopped");
    }
}
