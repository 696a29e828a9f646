package in.pilottraders.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Relay Config Tests")
class RelayConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        RelayConfig config = RelayConfig.defaults();

        assertEquals(3333, config.port());
        assertEquals(Duration.ofSeconds(5), config.connectIgnoreWindow());
        assertEquals(Duration.ofSeconds(10), config.clearSessionWindow());
        assertEquals(4, config.webhookPreviewChars());
        assertEquals(200, config.logPayloadChars());
    }

    @Test
    @DisplayName("Negative windows and widths are clamped to zero")
    void testClamping() {
        RelayConfig config = new RelayConfig("localhost", 8080,
            Duration.ofMillis(-1), null, -3, -10);

        assertEquals(Duration.ZERO, config.connectIgnoreWindow());
        assertEquals(Duration.ZERO, config.clearSessionWindow());
        assertEquals(0, config.webhookPreviewChars());
        assertEquals(0, config.logPayloadChars());
    }

    @Test
    @DisplayName("Out-of-range port is rejected")
    void testInvalidPort() {
        assertThrows(IllegalArgumentException.class,
            () -> new RelayConfig("localhost", 70000, Duration.ZERO, Duration.ZERO, 4, 200));
        assertThrows(IllegalArgumentException.class,
            () -> new RelayConfig("localhost", -1, Duration.ZERO, Duration.ZERO, 4, 200));
    }

    @Test
    @DisplayName("System properties override defaults when the environment is silent")
    void testFromSystemProperties() {
        System.setProperty("RELAY_CLEAR_SESSION_IGNORE_MS", " 2500 ");
        System.setProperty("RELAY_WEBHOOK_PREVIEW_CHARS", "not-a-number");
        try {
            RelayConfig config = RelayConfig.fromEnv();
            if (System.getenv("RELAY_CLEAR_SESSION_IGNORE_MS") == null) {
                assertEquals(Duration.ofMillis(2500), config.clearSessionWindow());
            }
            if (System.getenv("RELAY_WEBHOOK_PREVIEW_CHARS") == null) {
                assertEquals(4, config.webhookPreviewChars(), "Unparseable value falls back to default");
            }
        } finally {
            System.clearProperty("RELAY_CLEAR_SESSION_IGNORE_MS");
            System.clearProperty("RELAY_WEBHOOK_PREVIEW_CHARS");
        }
    }
}
