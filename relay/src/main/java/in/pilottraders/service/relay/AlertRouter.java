package in.pilottraders.service.relay;

import com.fasterxml.jackson.databind.JsonNode;
import in.pilottraders.domain.relay.Alert;
import in.pilottraders.domain.relay.AlertRoute;
import in.pilottraders.domain.relay.Connection;
import in.pilottraders.feedrelay.RelayJsonMapper;
import in.pilottraders.infrastructure.metrics.RelayMetrics;
import in.pilottraders.infrastructure.metrics.RelayMetrics.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;

/**
 * Fans an inbound alert out to the connections the registry resolves for it.
 *
 * Webhook alerts go to every connection bound to that webhook id; legacy alerts go to every
 * legacy connection whose symbol filter admits the payload. Connections inside their ignore
 * window are skipped on both paths. Delivery is fire-and-forget: a failed write is counted
 * as not delivered and never aborts the batch or retracts the connection.
 */
public final class AlertRouter {
    private static final Logger log = LoggerFactory.getLogger(AlertRouter.class);

    private final ConnectionRegistry registry;
    private final RelayMetrics metrics;
    private final Clock clock;

    public AlertRouter(ConnectionRegistry registry, RelayMetrics metrics, Clock clock) {
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Deliver to connections bound to {@code webhookId}. Symbol filters do not apply.
     *
     * @return connections that accepted the write; 0 if none are bound
     */
    public int routeKeyed(String webhookId, JsonNode payload) {
        return route(Alert.keyed(webhookId, payload, clock.instant()));
    }

    /**
     * Deliver to legacy connections whose symbol filter admits the payload.
     *
     * @return connections that accepted the write
     */
    public int routeLegacy(JsonNode payload) {
        return route(Alert.legacy(payload, clock.instant()));
    }

    public int route(Alert alert) {
        metrics.recordAlertReceived(alert.route());

        Set<Connection> targets = alert.isLegacy()
                ? registry.lookupLegacy()
                : registry.lookupByKey(alert.webhookId());

        if (targets.isEmpty()) {
            log.info("[ROUTER] No {} subscribers for {}", alert.route().label(), describe(alert));
            metrics.recordAlertDelivered(alert.route(), 0);
            return 0;
        }

        String envelope = RelayJsonMapper.alertEnvelope(alert);
        String symbol = alert.isLegacy() ? alert.symbol() : null;
        Instant now = clock.instant();

        int delivered = 0;
        for (Connection connection : targets) {
            if (connection.isIgnoring(now)) {
                log.debug("[ROUTER] Skipping client {} - in ignore window until {}",
                        connection.id(), connection.ignoreUntil());
                metrics.recordSkip(alert.route(), SkipReason.IGNORE_WINDOW);
                continue;
            }
            if (alert.isLegacy() && !connection.acceptsSymbol(symbol)) {
                log.debug("[ROUTER] Skipping client {} - subscribed to {}, alert is {}",
                        connection.id(), connection.symbolFilter(), symbol);
                metrics.recordSkip(alert.route(), SkipReason.SYMBOL_FILTER);
                continue;
            }
            if (connection.send(envelope)) {
                delivered++;
            } else {
                log.debug("[ROUTER] Write to client {} not accepted", connection.id());
                metrics.recordSkip(alert.route(), SkipReason.SEND_FAILED);
            }
        }

        metrics.recordAlertDelivered(alert.route(), delivered);
        log.info("[ROUTER] {} delivered to {}/{} clients", describe(alert), delivered, targets.size());
        return delivered;
    }

    private String describe(Alert alert) {
        return alert.route() == AlertRoute.LEGACY
                ? "legacy alert"
                : "webhook " + registry.redact(alert.webhookId());
    }
}
