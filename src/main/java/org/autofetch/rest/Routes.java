package org.autofetch.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.autofetch.daemon.ControlEvents;
import org.autofetch.daemon.StatusSnapshot;
import org.autofetch.handlers.HealthCheckHandler;
import org.autofetch.handlers.ReloadHandler;
import org.autofetch.handlers.StatusHandler;
import org.autofetch.rest.base.Dispatcher;
import org.autofetch.rest.base.FallBack;
import org.autofetch.rest.base.InvalidMethod;

import java.util.function.Supplier;

public class Routes {

    private Routes() {}

    public static RoutingHandler system(ControlEvents events, Supplier<StatusSnapshot> status) {
        return Handlers.routing()
                .get("/health", new HealthCheckHandler())
                .get("/status", new StatusHandler(status))
                .post("/reload", new ReloadHandler(events))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
