package org.autofetch.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.autofetch.config.utils.EnvironmentBootstrap;
import org.autofetch.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint: basic app info and uptime.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "autofetch");
        response.put("version", "1.0.0");
        response.put("environment", EnvironmentBootstrap.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
