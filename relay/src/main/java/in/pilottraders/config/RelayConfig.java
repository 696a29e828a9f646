package in.pilottraders.config;

import in.pilottraders.util.Env;

import java.time.Duration;

/**
 * Relay runtime settings, read once at startup.
 *
 * @param host                 listener bind address
 * @param port                 listener port (HTTP and WebSocket share it)
 * @param connectIgnoreWindow  alerts suppressed for this long after a client connects
 * @param clearSessionWindow   alerts suppressed for this long after a clear_session request
 * @param webhookPreviewChars  leading characters of a webhook id shown in status listings
 * @param logPayloadChars      alert payload truncation in logs
 */
public record RelayConfig(
        String host,
        int port,
        Duration connectIgnoreWindow,
        Duration clearSessionWindow,
        int webhookPreviewChars,
        int logPayloadChars) {

    public static final int DEFAULT_PORT = 3333;
    public static final long DEFAULT_CONNECT_IGNORE_MS = 5_000;
    public static final long DEFAULT_CLEAR_SESSION_IGNORE_MS = 10_000;
    public static final int DEFAULT_WEBHOOK_PREVIEW_CHARS = 4;
    public static final int DEFAULT_LOG_PAYLOAD_CHARS = 200;

    public RelayConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (connectIgnoreWindow == null || connectIgnoreWindow.isNegative()) {
            connectIgnoreWindow = Duration.ZERO;
        }
        if (clearSessionWindow == null || clearSessionWindow.isNegative()) {
            clearSessionWindow = Duration.ZERO;
        }
        webhookPreviewChars = Math.max(0, webhookPreviewChars);
        logPayloadChars = Math.max(0, logPayloadChars);
    }

    public static RelayConfig fromEnv() {
        return new RelayConfig(
                Env.get("RELAY_HOST", "0.0.0.0"),
                Env.getInt("PORT", DEFAULT_PORT),
                Duration.ofMillis(Env.getLong("RELAY_CONNECT_IGNORE_MS", DEFAULT_CONNECT_IGNORE_MS)),
                Duration.ofMillis(Env.getLong("RELAY_CLEAR_SESSION_IGNORE_MS", DEFAULT_CLEAR_SESSION_IGNORE_MS)),
                Env.getInt("RELAY_WEBHOOK_PREVIEW_CHARS", DEFAULT_WEBHOOK_PREVIEW_CHARS),
                Env.getInt("RELAY_LOG_PAYLOAD_CHARS", DEFAULT_LOG_PAYLOAD_CHARS));
    }

    public static RelayConfig defaults() {
        return new RelayConfig(
                "0.0.0.0",
                DEFAULT_PORT,
                Duration.ofMillis(DEFAULT_CONNECT_IGNORE_MS),
                Duration.ofMillis(DEFAULT_CLEAR_SESSION_IGNORE_MS),
                DEFAULT_WEBHOOK_PREVIEW_CHARS,
                DEFAULT_LOG_PAYLOAD_CHARS);
    }
}
