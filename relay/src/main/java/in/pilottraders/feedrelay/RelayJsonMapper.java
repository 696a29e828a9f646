package in.pilottraders.feedrelay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pilottraders.domain.relay.Alert;
import in.pilottraders.domain.relay.ClientMessage;

import java.time.Instant;

/**
 * JSON codec for the subscriber wire protocol.
 *
 * Inbound frames are JSON objects with a {@code type} field:
 * {@code register}, {@code subscribe}, {@code ping}, {@code clear_session}.
 * Outbound frames: {@code connected}, {@code registered}, {@code pong},
 * {@code session_cleared}, {@code alert}.
 */
public final class RelayJsonMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String WELCOME_MESSAGE = "Connected to Pilot Traders Webhook Relay";

    private RelayJsonMapper() {}

    /**
     * Decode a subscriber frame. Never throws: anything unusable becomes {@link ClientMessage#ignored()}.
     */
    public static ClientMessage parseClientMessage(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClientMessage.ignored();
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return ClientMessage.ignored();
        }
        if (node == null || !node.isObject()) {
            return ClientMessage.ignored();
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            return ClientMessage.ignored();
        }

        return switch (type.asText()) {
            case "register" -> parseRegister(node);
            case "subscribe" -> ClientMessage.subscribe(text(node, "symbol"));
            case "ping" -> ClientMessage.ping();
            case "clear_session" -> ClientMessage.clearSession();
            default -> ClientMessage.ignored();
        };
    }

    // webhookId wins over legacy when both are present
    private static ClientMessage parseRegister(JsonNode node) {
        String webhookId = text(node, "webhookId");
        if (webhookId != null && !webhookId.isBlank()) {
            return ClientMessage.registerWebhook(webhookId);
        }
        JsonNode legacy = node.get("legacy");
        if (legacy != null && legacy.isBoolean() && legacy.booleanValue()) {
            return ClientMessage.registerLegacy();
        }
        return ClientMessage.ignored();
    }

    public static String connected(long clientId, Instant now) {
        ObjectNode o = frame("connected", now);
        o.put("clientId", clientId);
        o.put("message", WELCOME_MESSAGE);
        return o.toString();
    }

    public static String registeredWebhook(String webhookId, Instant now) {
        ObjectNode o = frame("registered", now);
        o.put("mode", "webhook");
        o.put("webhookId", webhookId);
        return o.toString();
    }

    public static String registeredLegacy(Instant now) {
        ObjectNode o = frame("registered", now);
        o.put("mode", "legacy");
        o.put("legacy", true);
        return o.toString();
    }

    public static String pong(Instant now) {
        return frame("pong", now).toString();
    }

    public static String sessionCleared(Instant ignoreUntil, Instant now) {
        ObjectNode o = frame("session_cleared", now);
        o.put("ignoreUntil", ignoreUntil.toString());
        return o.toString();
    }

    /**
     * Delivery envelope. Serialized once per alert and shared by every recipient.
     */
    public static String alertEnvelope(Alert alert) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", "alert");
        o.set("data", alert.payload());
        o.put("timestamp", alert.receivedAt().toString());
        if (alert.isLegacy()) {
            o.put("legacy", true);
        } else {
            o.put("webhookId", alert.webhookId());
        }
        return o.toString();
    }

    private static ObjectNode frame(String type, Instant now) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", type);
        o.put("timestamp", now.toString());
        return o;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
