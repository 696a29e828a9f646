package in.pilottraders.infrastructure.metrics;

import in.pilottraders.domain.relay.AlertRoute;
import in.pilottraders.domain.relay.ClientMessageType;

/**
 * Relay metrics interface.
 *
 * Implementations can publish to Prometheus or be disabled with {@link #noop()}.
 */
public interface RelayMetrics {

    /**
     * Why an alert was not delivered to a connection that was otherwise routed to.
     */
    enum SkipReason {
        IGNORE_WINDOW,
        SYMBOL_FILTER,
        SEND_FAILED
    }

    /**
     * Record a subscriber connect.
     *
     * @param activeConnections registry size after the connect
     */
    void recordConnect(int activeConnections);

    /**
     * Record a subscriber disconnect.
     *
     * @param activeConnections registry size after the disconnect
     */
    void recordDisconnect(int activeConnections);

    void recordAlertReceived(AlertRoute route);

    /**
     * Record the outcome of one routed alert.
     *
     * @param route     webhook or legacy
     * @param delivered connections that accepted the write
     */
    void recordAlertDelivered(AlertRoute route, int delivered);

    void recordSkip(AlertRoute route, SkipReason reason);

    void recordClientMessage(ClientMessageType type);

    static RelayMetrics noop() {
        return NoopRelayMetrics.INSTANCE;
    }
}
