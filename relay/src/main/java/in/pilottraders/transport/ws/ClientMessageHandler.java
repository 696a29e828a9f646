package in.pilottraders.transport.ws;

import in.pilottraders.domain.relay.ClientMessage;
import in.pilottraders.domain.relay.ClientMessageType;
import in.pilottraders.domain.relay.Connection;
import in.pilottraders.feedrelay.RelayJsonMapper;
import in.pilottraders.infrastructure.metrics.RelayMetrics;
import in.pilottraders.service.relay.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies one subscriber frame to that subscriber's own registry entry.
 *
 * Frames from a single connection arrive on its channel's receive thread one at a time,
 * so no two frames of the same connection are handled concurrently. Unknown or malformed
 * frames get no reply and never close the connection.
 */
public final class ClientMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(ClientMessageHandler.class);

    private final ConnectionRegistry registry;
    private final RelayMetrics metrics;
    private final Clock clock;
    private final Duration clearSessionWindow;

    public ClientMessageHandler(ConnectionRegistry registry, RelayMetrics metrics,
                                Clock clock, Duration clearSessionWindow) {
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.clearSessionWindow = clearSessionWindow;
    }

    /**
     * Decode and apply a raw text frame.
     *
     * @return the kind the frame was decoded as
     */
    public ClientMessageType handle(Connection connection, String raw) {
        ClientMessage msg = RelayJsonMapper.parseClientMessage(raw);
        metrics.recordClientMessage(msg.type());
        apply(connection, msg);
        return msg.type();
    }

    void apply(Connection connection, ClientMessage msg) {
        long id = connection.id();
        switch (msg.type()) {
            case REGISTER_WEBHOOK -> {
                if (registry.bindRoutingKey(id, msg.webhookId())) {
                    log.info("[RELAY] Client {} registered for webhook {}", id, registry.redact(msg.webhookId()));
                    connection.send(RelayJsonMapper.registeredWebhook(msg.webhookId(), clock.instant()));
                }
            }
            case REGISTER_LEGACY -> {
                if (registry.bindLegacy(id)) {
                    log.info("[RELAY] Client {} registered for legacy feed", id);
                    connection.send(RelayJsonMapper.registeredLegacy(clock.instant()));
                }
            }
            case SUBSCRIBE -> {
                if (registry.setSymbolFilter(id, msg.symbol())) {
                    log.info("[RELAY] Client {} subscribed to {}", id, msg.symbol() == null ? "all symbols" : msg.symbol());
                }
            }
            case PING -> connection.send(RelayJsonMapper.pong(clock.instant()));
            case CLEAR_SESSION -> {
                Instant now = clock.instant();
                Optional<Instant> until = registry.setIgnoreWindow(id, now.plus(clearSessionWindow));
                until.ifPresent(deadline -> {
                    log.info("[RELAY] Client {} requested clear_session - ignoring alerts until {}", id, deadline);
                    connection.send(RelayJsonMapper.sessionCleared(deadline, now));
                });
            }
            case IGNORED -> log.debug("[RELAY] Ignoring unrecognised frame from client {}", id);
        }
    }
}
