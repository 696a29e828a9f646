package in.pilottraders.infrastructure.metrics;

import in.pilottraders.domain.relay.AlertRoute;
import in.pilottraders.domain.relay.ClientMessageType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of RelayMetrics.
 *
 * Key Metrics:
 * - relay_connections_active - Live subscriber connections
 * - relay_connections_total - Connections accepted since start
 * - relay_alerts_received_total{route} - Alerts submitted per route
 * - relay_alerts_delivered_total{route} - Frames accepted by subscriber transports
 * - relay_alerts_skipped_total{route, reason} - Routed connections that did not get the alert
 * - relay_client_messages_total{type} - Frames received from subscribers
 *
 * Usage:
 * <pre>
 * PrometheusRelayMetrics metrics = new PrometheusRelayMetrics(CollectorRegistry.defaultRegistry);
 * AlertRouter router = new AlertRouter(registry, metrics, Clock.systemUTC());
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRelayMetrics implements RelayMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRelayMetrics.class);

    private final CollectorRegistry registry;

    private final Gauge activeConnections;
    private final Counter connectionsTotal;
    private final Counter alertsReceived;
    private final Counter alertsDelivered;
    private final Counter alertsSkipped;
    private final Counter clientMessages;

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("relay_connections_active")
            .help("Live subscriber connections")
            .register(registry);

        this.connectionsTotal = Counter.build()
            .name("relay_connections_total")
            .help("Total number of subscriber connections accepted")
            .register(registry);

        this.alertsReceived = Counter.build()
            .name("relay_alerts_received_total")
            .help("Total number of alerts submitted")
            .labelNames("route")
            .register(registry);

        this.alertsDelivered = Counter.build()
            .name("relay_alerts_delivered_total")
            .help("Total number of alert frames accepted by subscriber transports")
            .labelNames("route")
            .register(registry);

        this.alertsSkipped = Counter.build()
            .name("relay_alerts_skipped_total")
            .help("Total number of routed connections an alert was not delivered to")
            .labelNames("route", "reason")
            .register(registry);

        this.clientMessages = Counter.build()
            .name("relay_client_messages_total")
            .help("Total number of frames received from subscribers")
            .labelNames("type")
            .register(registry);

        log.info("[PrometheusRelayMetrics] Initialized");
    }

    @Override
    public void recordConnect(int active) {
        connectionsTotal.inc();
        activeConnections.set(active);
    }

    @Override
    public void recordDisconnect(int active) {
        activeConnections.set(active);
    }

    @Override
    public void recordAlertReceived(AlertRoute route) {
        alertsReceived.labels(route.label()).inc();
    }

    @Override
    public void recordAlertDelivered(AlertRoute route, int delivered) {
        if (delivered > 0) {
            alertsDelivered.labels(route.label()).inc(delivered);
        }
    }

    @Override
    public void recordSkip(AlertRoute route, SkipReason reason) {
        alertsSkipped.labels(route.label(), reason.name().toLowerCase()).inc();
    }

    @Override
    public void recordClientMessage(ClientMessageType type) {
        clientMessages.labels(type.name().toLowerCase()).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
