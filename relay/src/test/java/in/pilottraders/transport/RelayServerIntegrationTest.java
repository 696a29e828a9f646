package in.pilottraders.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.pilottraders.config.RelayConfig;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test over a real listener: WebSocket subscribers, HTTP alert submission, status.
 */
@DisplayName("Relay Server Integration Tests")
class RelayServerIntegrationTest {

    private static final int TEST_PORT = 19093;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RelayServer server;
    private HttpClient httpClient;
    private final List<WebSocket> sockets = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RelayConfig config = new RelayConfig("localhost", TEST_PORT, Duration.ZERO, Duration.ofSeconds(10), 4, 200);
        server = new RelayServer(config, Clock.systemUTC(), new CollectorRegistry());
        server.start();

        httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        for (WebSocket ws : sockets) {
            ws.abort();
        }
        server.stop();
    }

    /** Subscriber that queues every complete text frame it receives. */
    private static final class Subscriber implements WebSocket.Listener {
        private final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    frames.add(MAPPER.readTree(partial.toString()));
                } catch (Exception e) {
                    throw new AssertionError("Invalid frame: " + partial, e);
                } finally {
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }

        JsonNode next(String type) throws InterruptedException {
            while (true) {
                JsonNode frame = frames.poll(5, TimeUnit.SECONDS);
                assertNotNull(frame, "Timed out waiting for " + type);
                if (type.equals(frame.path("type").asText())) {
                    return frame;
                }
            }
        }

        JsonNode poll(long millis) throws InterruptedException {
            return frames.poll(millis, TimeUnit.MILLISECONDS);
        }
    }

    private WebSocket connect(Subscriber subscriber, String path) {
        WebSocket ws = httpClient.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + path), subscriber)
            .join();
        sockets.add(ws);
        return ws;
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Webhook alert reaches only the subscriber registered for it")
    void testWebhookDelivery() throws Exception {
        Subscriber keyed = new Subscriber();
        WebSocket ws = connect(keyed, "/ws");
        JsonNode welcome = keyed.next("connected");
        assertTrue(welcome.get("clientId").asLong() > 0);

        ws.sendText("{\"type\":\"register\",\"webhookId\":\"abc123\"}", true).join();
        assertEquals("abc123", keyed.next("registered").get("webhookId").asText());

        HttpResponse<String> response = post("/webhook/abc123", "{\"symbol\":\"BTCUSD\",\"entry\":100.5}");
        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.get("success").asBoolean());
        assertEquals(1, body.get("deliveredTo").asInt());
        assertEquals("abc123", body.get("webhookId").asText());

        JsonNode alert = keyed.next("alert");
        assertEquals("BTCUSD", alert.get("data").get("symbol").asText());
        assertEquals("abc123", alert.get("webhookId").asText());

        JsonNode other = MAPPER.readTree(post("/webhook/someone-else", "{}").body());
        assertEquals(0, other.get("deliveredTo").asInt());
    }

    @Test
    @DisplayName("Legacy alert reaches legacy subscribers and honours their symbol filter")
    void testLegacyDelivery() throws Exception {
        Subscriber all = new Subscriber();
        WebSocket wsAll = connect(all, "/");
        all.next("connected");
        wsAll.sendText("{\"type\":\"register\",\"legacy\":true}", true).join();
        all.next("registered");

        Subscriber btc = new Subscriber();
        WebSocket wsBtc = connect(btc, "/ws");
        btc.next("connected");
        wsBtc.sendText("{\"type\":\"register\",\"legacy\":true}", true).join();
        btc.next("registered");
        wsBtc.sendText("{\"type\":\"subscribe\",\"symbol\":\"BTCUSD\"}", true).join();
        wsBtc.sendText("{\"type\":\"ping\"}", true).join();
        btc.next("pong");

        JsonNode eth = MAPPER.readTree(post("/alert", "{\"symbol\":\"ETHUSD\"}").body());
        assertEquals(1, eth.get("deliveredTo").asInt());
        assertEquals("ETHUSD", all.next("alert").get("data").get("symbol").asText());

        JsonNode btcResult = MAPPER.readTree(post("/alert", "{\"symbol\":\"BTCUSD\"}").body());
        assertEquals(2, btcResult.get("deliveredTo").asInt());
        JsonNode delivered = btc.next("alert");
        assertEquals("BTCUSD", delivered.get("data").get("symbol").asText());
        assertTrue(delivered.get("legacy").asBoolean());
    }

    @Test
    @DisplayName("clear_session suppresses delivery for the window")
    void testClearSession() throws Exception {
        Subscriber sub = new Subscriber();
        WebSocket ws = connect(sub, "/ws");
        sub.next("connected");
        ws.sendText("{\"type\":\"register\",\"webhookId\":\"abc123\"}", true).join();
        sub.next("registered");
        ws.sendText("{\"type\":\"clear_session\"}", true).join();
        assertTrue(sub.next("session_cleared").has("ignoreUntil"));

        JsonNode body = MAPPER.readTree(post("/webhook/abc123", "{}").body());
        assertEquals(0, body.get("deliveredTo").asInt());
        assertNull(sub.poll(200), "Nothing is delivered inside the window");
    }

    @Test
    @DisplayName("Status lists connections with redacted webhook ids")
    void testStatusRedaction() throws Exception {
        Subscriber sub = new Subscriber();
        WebSocket ws = connect(sub, "/ws");
        sub.next("connected");
        ws.sendText("{\"type\":\"register\",\"webhookId\":\"secret-webhook-123\"}", true).join();
        sub.next("registered");

        HttpResponse<String> response = get("/status");
        assertEquals(200, response.statusCode());
        assertFalse(response.body().contains("secret-webhook-123"));

        JsonNode status = MAPPER.readTree(response.body());
        assertEquals(1, status.get("connectedClients").asInt());
        assertEquals(1, status.get("webhookClients").asInt());
        assertEquals(1, status.get("webhookChannels").asInt());
        JsonNode client = status.get("clients").get(0);
        assertEquals("secr****", client.get("webhookId").asText());
        assertTrue(client.get("hasWebhook").asBoolean());
        assertTrue(client.get("connectedAt").isTextual(), "Timestamps are ISO-8601 strings");
    }

    @Test
    @DisplayName("Disconnected subscriber is removed and no longer counted")
    void testDisconnect() throws Exception {
        Subscriber sub = new Subscriber();
        WebSocket ws = connect(sub, "/ws");
        sub.next("connected");
        ws.sendText("{\"type\":\"register\",\"webhookId\":\"abc123\"}", true).join();
        sub.next("registered");

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").join();

        long deadline = System.currentTimeMillis() + 5_000;
        while (server.registry().size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, server.registry().size());

        JsonNode body = MAPPER.readTree(post("/webhook/abc123", "{}").body());
        assertEquals(0, body.get("deliveredTo").asInt());
    }

    @Test
    @DisplayName("Health, banner, test alert and error responses")
    void testPlainEndpoints() throws Exception {
        HttpResponse<String> health = get("/health");
        assertEquals(200, health.statusCode());
        assertEquals("OK", health.body());

        JsonNode root = MAPPER.readTree(get("/").body());
        assertEquals("running", root.get("status").asText());
        assertTrue(root.has("endpoints"));

        JsonNode test = MAPPER.readTree(get("/test").body());
        assertTrue(test.get("success").asBoolean());
        assertEquals("TEST", test.get("data").get("symbol").asText());

        HttpResponse<String> bad = post("/alert", "{not json");
        assertEquals(400, bad.statusCode());
        assertFalse(MAPPER.readTree(bad.body()).get("success").asBoolean());

        HttpResponse<String> empty = post("/alert", "");
        assertEquals(200, empty.statusCode());

        assertEquals(404, get("/nope").statusCode());
    }

    @Test
    @DisplayName("Preflight requests are answered with CORS headers")
    void testCorsPreflight() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/alert"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    }
}
