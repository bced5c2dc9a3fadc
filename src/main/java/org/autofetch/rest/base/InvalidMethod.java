package org.autofetch.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.autofetch.utils.ResponseUtil;

/**
 * 405 for a known admin route called with the wrong method.
 */
public class InvalidMethod implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                exchange.getRequestMethod() + " not allowed on admin route " + exchange.getRequestPath()
                        + ". Available: " + FallBack.ROUTES);
    }
}
