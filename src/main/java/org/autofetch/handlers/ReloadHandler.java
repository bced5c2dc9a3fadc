package org.autofetch.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.autofetch.daemon.ControlEvent;
import org.autofetch.daemon.ControlEvents;
import org.autofetch.utils.ResponseUtil;

/**
 * Asks the control loop to reload its configuration, the same as SIGHUP.
 * The reload itself happens asynchronously on the loop thread.
 */
public class ReloadHandler implements HttpHandler {

    private final ControlEvents events;

    public ReloadHandler(ControlEvents events) {
        this.events = events;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        events.post(ControlEvent.RELOAD_REQUESTED);
        ResponseUtil.sendAccepted(exchange, "Reload requested");
    }
}
