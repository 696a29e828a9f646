package in.pilottraders.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pilottraders.config.RelayConfig;
import in.pilottraders.domain.relay.Alert;
import in.pilottraders.domain.relay.ConnectionSummary;
import in.pilottraders.service.relay.AlertRouter;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Deque;

/**
 * HTTP alert submission:
 * - POST /alert                - legacy feed, fanned out to every legacy subscriber
 * - POST /webhook/{webhookId}  - delivered only to subscribers registered for that webhook
 * - GET  /test                 - sends a fixed LEVELS alert down the legacy feed
 *
 * Any JSON body is accepted as the payload; an empty body is treated as {}.
 */
public final class AlertHandlers {
    private static final Logger log = LoggerFactory.getLogger(AlertHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_MESSAGE = "message";
    private static final String JSON_ERROR = "error";

    private final AlertRouter router;
    private final Clock clock;
    private final int logPayloadChars;
    private final int webhookPreviewChars;

    public AlertHandlers(AlertRouter router, Clock clock, RelayConfig config) {
        this.router = router;
        this.clock = clock;
        this.logPayloadChars = config.logPayloadChars();
        this.webhookPreviewChars = config.webhookPreviewChars();
    }

    /**
     * POST /alert
     */
    public void legacyAlert(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode payload = readPayload(body);
                Alert alert = Alert.legacy(payload, clock.instant());
                log.info("[HTTP] Webhook received: {}", truncate(payload.toString()));

                int delivered = router.route(alert);
                ObjectNode response = result(alert, delivered, "Alert received and broadcast");
                sendJson(ex, StatusCodes.OK, response);
            } catch (InvalidAlertException e) {
                log.warn("[HTTP] Rejected legacy alert: {}", e.getMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("[HTTP] Legacy alert failed: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to relay alert");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /webhook/{webhookId}
     */
    public void webhookAlert(HttpServerExchange exchange) {
        String webhookId = pathParam(exchange, "webhookId");
        if (webhookId == null || webhookId.isBlank()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing webhookId");
            return;
        }

        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode payload = readPayload(body);
                Alert alert = Alert.keyed(webhookId, payload, clock.instant());
                log.info("[HTTP] Webhook received for {}: {}",
                        ConnectionSummary.redact(webhookId, webhookPreviewChars), truncate(payload.toString()));

                int delivered = router.route(alert);
                ObjectNode response = result(alert, delivered, "Alert received and delivered");
                response.put("webhookId", webhookId);
                sendJson(ex, StatusCodes.OK, response);
            } catch (InvalidAlertException e) {
                log.warn("[HTTP] Rejected webhook alert: {}", e.getMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("[HTTP] Webhook alert failed: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to relay alert");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /test
     */
    public void testAlert(HttpServerExchange exchange) {
        ObjectNode payload = testPayload();
        Alert alert = Alert.legacy(payload, clock.instant());
        int delivered = router.route(alert);

        ObjectNode response = result(alert, delivered, "Test alert sent");
        response.set("data", payload);
        sendJson(exchange, StatusCodes.OK, response);
    }

    static ObjectNode testPayload() {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("type", "LEVELS");
        payload.put("symbol", "TEST");
        payload.put("t1", 100.50);
        payload.put("t2", 101.00);
        payload.put("t3", 101.50);
        payload.put("eject", 99.50);
        payload.put("entry", 100.00);
        payload.put("source", "relay-test");
        return payload;
    }

    static JsonNode readPayload(String body) {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return node == null ? MAPPER.createObjectNode() : node;
        } catch (JsonProcessingException e) {
            throw new InvalidAlertException("Invalid JSON body: " + e.getOriginalMessage(), e);
        }
    }

    private ObjectNode result(Alert alert, int delivered, String message) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put(JSON_SUCCESS, true);
        response.put(JSON_MESSAGE, message);
        response.put("deliveredTo", delivered);
        response.put("timestamp", alert.receivedAt().toString());
        return response;
    }

    private String truncate(String s) {
        return s.length() <= logPayloadChars ? s : s.substring(0, logPayloadChars);
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    private static void sendJson(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_SUCCESS, false);
        body.put(JSON_ERROR, message);
        sendJson(exchange, status, body);
    }
}
