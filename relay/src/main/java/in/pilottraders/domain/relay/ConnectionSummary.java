package in.pilottraders.domain.relay;

import java.time.Instant;

/**
 * Status-listing view of a connection. Never carries the transport or a full webhook id.
 */
public record ConnectionSummary(
        long id,
        Instant connectedAt,
        String symbol,
        boolean legacy,
        boolean hasWebhook,
        String webhookId) {

    public static ConnectionSummary of(Connection connection, int previewChars) {
        String webhookId = connection.webhookId();
        return new ConnectionSummary(
                connection.id(),
                connection.connectedAt(),
                connection.symbolFilter(),
                connection.isLegacy(),
                webhookId != null,
                redact(webhookId, previewChars));
    }

    /**
     * Keep the first {@code visible} characters of a webhook id and mask the rest.
     * Ids no longer than {@code visible} are fully masked.
     */
    public static String redact(String webhookId, int visible) {
        if (webhookId == null) {
            return null;
        }
        if (webhookId.length() <= visible) {
            return "****";
        }
        return webhookId.substring(0, visible) + "****";
    }
}
