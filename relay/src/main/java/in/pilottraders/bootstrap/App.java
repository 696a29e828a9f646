package in.pilottraders.bootstrap;

import in.pilottraders.config.RelayConfig;
import in.pilottraders.transport.RelayServer;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * Receives alert webhooks over HTTP and relays them to WebSocket subscribers,
 * either per webhook id or through the shared legacy feed.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        RelayConfig config = RelayConfig.fromEnv();

        RelayServer server = new RelayServer(config, Clock.systemUTC(), CollectorRegistry.defaultRegistry);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[RELAY] Shutdown requested");
            server.stop();
        }, "relay-shutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("  PILOT TRADERS WEBHOOK RELAY");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("  Server running on port {}", config.port());
        log.info("  Connect ignore window: {} ms, clear_session window: {} ms",
            config.connectIgnoreWindow().toMillis(), config.clearSessionWindow().toMillis());
        log.info("");
        log.info("  Endpoints:");
        log.info("    POST /alert                - Legacy feed (all admin clients)");
        log.info("    POST /webhook/{webhookId}  - User-specific alerts");
        log.info("    GET  /status               - Server & client status");
        log.info("    GET  /health               - Liveness");
        log.info("    GET  /metrics              - Prometheus metrics");
        log.info("    GET  /test                 - Send test alert to legacy clients");
        log.info("    WS   /ws                   - WebSocket for subscriber clients");
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private App() {}
}
