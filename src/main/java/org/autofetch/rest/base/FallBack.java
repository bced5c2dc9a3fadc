package org.autofetch.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.autofetch.utils.ResponseUtil;

/**
 * 404 for anything outside the admin routes.
 */
public class FallBack implements HttpHandler {

    static final String ROUTES = "GET /system/health, GET /system/status, POST /system/reload";

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                "No admin route " + exchange.getRequestPath() + ". Available: " + ROUTES);
    }
}
