package org.autofetch.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.autofetch.daemon.StatusSnapshot;
import org.autofetch.utils.ResponseUtil;

import java.util.function.Supplier;

/**
 * Latest control-loop snapshot: pending triggers, running workers, last reload outcome.
 */
public class StatusHandler implements HttpHandler {

    private final Supplier<StatusSnapshot> status;

    public StatusHandler(Supplier<StatusSnapshot> status) {
        this.status = status;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendSuccess(exchange, "Scheduler status", status.get());
    }
}
