package in.pilottraders.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.pilottraders.service.relay.ConnectionRegistry;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness and status endpoints:
 * - GET /        - service banner
 * - GET /status  - connection listing (redacted) plus aggregate counts
 * - GET /health  - plain "OK"
 */
public final class StatusHandlers {
    private static final Logger log = LoggerFactory.getLogger(StatusHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static final String SERVICE_NAME = "Pilot Traders Webhook Relay";

    private final ConnectionRegistry registry;
    private final Clock clock;
    private final Instant startedAt;

    public StatusHandlers(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * GET /
     */
    public void root(HttpServerExchange exchange) {
        Instant now = clock.instant();
        ObjectNode body = MAPPER.createObjectNode();
        body.put("name", SERVICE_NAME);
        body.put("status", "running");
        body.put("connectedClients", registry.size());
        body.put("uptime", uptimeSeconds(now));
        body.put("timestamp", now.toString());

        ObjectNode endpoints = body.putObject("endpoints");
        endpoints.put("webhook", "POST /webhook/{webhookId}");
        endpoints.put("legacy", "POST /alert");
        endpoints.put("status", "GET /status");
        endpoints.put("health", "GET /health");
        endpoints.put("test", "GET /test");
        endpoints.put("websocket", "WS /ws");
        sendJson(exchange, body);
    }

    /**
     * GET /status
     */
    public void status(HttpServerExchange exchange) {
        Instant now = clock.instant();
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "running");
        body.put("connectedClients", registry.size());
        body.put("legacyClients", registry.legacyCount());
        body.put("webhookClients", registry.webhookConnectionCount());
        body.put("webhookChannels", registry.webhookChannelCount());
        body.set("clients", MAPPER.valueToTree(registry.snapshot()));
        body.put("uptime", uptimeSeconds(now));
        body.put("timestamp", now.toString());
        sendJson(exchange, body);
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseSender().send("OK", StandardCharsets.UTF_8);
    }

    private double uptimeSeconds(Instant now) {
        return Duration.between(startedAt, now).toMillis() / 1000.0;
    }

    private static void sendJson(HttpServerExchange exchange, ObjectNode body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("[HTTP] Failed to serialize status: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Failed to serialize status", StandardCharsets.UTF_8);
            return;
        }
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
