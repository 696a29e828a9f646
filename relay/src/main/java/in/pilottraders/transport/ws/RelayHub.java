package in.pilottraders.transport.ws;

import in.pilottraders.domain.relay.Connection;
import in.pilottraders.domain.relay.RelayChannel;
import in.pilottraders.feedrelay.RelayJsonMapper;
import in.pilottraders.infrastructure.metrics.RelayMetrics;
import in.pilottraders.service.relay.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Undertow-native WebSocket entry point for subscribers:
 * - Registers each connection on handshake with a connect-time ignore window
 * - Feeds inbound text frames to {@link ClientMessageHandler}
 * - Retracts the connection from the registry on close or error, exactly once
 */
public final class RelayHub {
    private static final Logger log = LoggerFactory.getLogger(RelayHub.class);

    private final ConnectionRegistry registry;
    private final ClientMessageHandler messageHandler;
    private final RelayMetrics metrics;
    private final Clock clock;
    private final Duration connectIgnoreWindow;

    public RelayHub(ConnectionRegistry registry, ClientMessageHandler messageHandler, RelayMetrics metrics,
                    Clock clock, Duration connectIgnoreWindow) {
        this.registry = registry;
        this.messageHandler = messageHandler;
        this.metrics = metrics;
        this.clock = clock;
        this.connectIgnoreWindow = connectIgnoreWindow;
    }

    /**
     * Upgrade WebSocket handshakes on any path; plain HTTP requests fall through to {@code next}.
     */
    public WebSocketProtocolHandshakeHandler websocketHandler(HttpHandler next) {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String remote = remoteAddress(exchange.getRequestHeader("X-Forwarded-For"),
                        String.valueOf(channel.getSourceAddress()));
                Connection connection = open(new UndertowRelayChannel(channel), remote);

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        messageHandler.handle(connection, message.getData());
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[RELAY] Client {} error: {}", connection.id(), error.toString());
                        close(connection);
                        super.onError(ch, error);
                    }
                });
                channel.getCloseSetter().set(ch -> close(connection));
                channel.resumeReceives();
            }
        }, next);
    }

    /**
     * Admit a freshly handshaken connection and greet it.
     */
    public Connection open(RelayChannel channel, String remoteAddress) {
        Instant now = clock.instant();
        Connection connection = registry.register(channel, remoteAddress, now, now.plus(connectIgnoreWindow));
        int total = registry.size();
        metrics.recordConnect(total);
        log.info("[RELAY] Client {} connected from {}. Total: {}", connection.id(), remoteAddress, total);
        connection.send(RelayJsonMapper.connected(connection.id(), now));
        return connection;
    }

    /**
     * Retract a connection after transport close or error. Later calls are no-ops.
     */
    public void close(Connection connection) {
        if (registry.unregister(connection.id())) {
            int total = registry.size();
            metrics.recordDisconnect(total);
            log.info("[RELAY] Client {} disconnected. Total: {}", connection.id(), total);
        }
    }

    /**
     * First hop of {@code X-Forwarded-For} if present, else the socket address.
     */
    static String remoteAddress(String forwardedFor, String socketAddress) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            int comma = forwardedFor.indexOf(',');
            return (comma < 0 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
        }
        return socketAddress;
    }
}
