package in.pilottraders.transport;

import in.pilottraders.config.RelayConfig;
import in.pilottraders.infrastructure.metrics.PrometheusMetricsHandler;
import in.pilottraders.infrastructure.metrics.PrometheusRelayMetrics;
import in.pilottraders.service.relay.AlertRouter;
import in.pilottraders.service.relay.ConnectionRegistry;
import in.pilottraders.transport.http.AlertHandlers;
import in.pilottraders.transport.http.StatusHandlers;
import in.pilottraders.transport.ws.ClientMessageHandler;
import in.pilottraders.transport.ws.RelayHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Wires registry, router and handlers onto one Undertow listener.
 *
 * HTTP and WebSocket share the port: a WebSocket upgrade on any path opens a subscriber
 * connection, everything else is dispatched by route.
 */
public final class RelayServer {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private final RelayConfig config;
    private final ConnectionRegistry registry;
    private final HttpHandler rootHandler;
    private Undertow server;

    public RelayServer(RelayConfig config, Clock clock, CollectorRegistry collectorRegistry) {
        this.config = config;

        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics(collectorRegistry);
        this.registry = new ConnectionRegistry(config.webhookPreviewChars());
        AlertRouter router = new AlertRouter(registry, metrics, clock);

        ClientMessageHandler messageHandler =
                new ClientMessageHandler(registry, metrics, clock, config.clearSessionWindow());
        RelayHub hub = new RelayHub(registry, messageHandler, metrics, clock, config.connectIgnoreWindow());

        AlertHandlers alerts = new AlertHandlers(router, clock, config);
        StatusHandlers status = new StatusHandlers(registry, clock);

        RoutingHandler routes = Handlers.routing()
            .get("/", status::root)
            .get("/status", status::status)
            .get("/health", status::health)
            .get("/metrics", new PrometheusMetricsHandler(collectorRegistry))
            .post("/alert", alerts::legacyAlert)
            .post("/webhook/{webhookId}", alerts::webhookAlert)
            .get("/test", alerts::testAlert)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Pilot Traders Webhook Relay\n\n" +
                    "Alerts: POST /alert, POST /webhook/{webhookId}\n" +
                    "Status: GET /status, /health, /metrics, /test\n" +
                    "WS:     ws://<host>:" + config.port() + "/ws\n",
                    StandardCharsets.UTF_8);
            });

        this.rootHandler = cors(hub.websocketHandler(routes));
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(rootHandler)
            .build();
        server.start();
        log.info("[RELAY] Listening on http://{}:{}/", config.host(), config.port());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[RELAY] Server stopped");
        }
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    private static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }
}
