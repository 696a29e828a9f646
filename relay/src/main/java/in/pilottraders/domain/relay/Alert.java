package in.pilottraders.domain.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Inbound alert: an opaque JSON payload plus its routing target.
 *
 * @param payload    request body as received
 * @param route      keyed or legacy
 * @param webhookId  routing key for {@link AlertRoute#WEBHOOK}, null for legacy
 * @param receivedAt arrival time, used as the envelope timestamp
 */
public record Alert(JsonNode payload, AlertRoute route, String webhookId, Instant receivedAt) {

    public Alert {
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(receivedAt, "receivedAt");
        if (route == AlertRoute.LEGACY) {
            webhookId = null;
        }
    }

    public static Alert keyed(String webhookId, JsonNode payload, Instant receivedAt) {
        return new Alert(payload, AlertRoute.WEBHOOK, webhookId, receivedAt);
    }

    public static Alert legacy(JsonNode payload, Instant receivedAt) {
        return new Alert(payload, AlertRoute.LEGACY, null, receivedAt);
    }

    public boolean isLegacy() {
        return route == AlertRoute.LEGACY;
    }

    /**
     * Top-level textual {@code symbol} of the payload, or null.
     */
    public String symbol() {
        if (!payload.isObject()) {
            return null;
        }
        JsonNode symbol = payload.get("symbol");
        return symbol != null && symbol.isTextual() ? symbol.asText() : null;
    }
}
