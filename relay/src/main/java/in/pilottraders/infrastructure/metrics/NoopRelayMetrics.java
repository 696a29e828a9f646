package in.pilottraders.infrastructure.metrics;

import in.pilottraders.domain.relay.AlertRoute;
import in.pilottraders.domain.relay.ClientMessageType;

final class NoopRelayMetrics implements RelayMetrics {
    static final NoopRelayMetrics INSTANCE = new NoopRelayMetrics();

    private NoopRelayMetrics() {}

    @Override
    public void recordConnect(int activeConnections) {}

    @Override
    public void recordDisconnect(int activeConnections) {}

    @Override
    public void recordAlertReceived(AlertRoute route) {}

    @Override
    public void recordAlertDelivered(AlertRoute route, int delivered) {}

    @Override
    public void recordSkip(AlertRoute route, SkipReason reason) {}

    @Override
    public void recordClientMessage(ClientMessageType type) {}
}
