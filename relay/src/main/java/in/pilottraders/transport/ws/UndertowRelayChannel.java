package in.pilottraders.transport.ws;

import in.pilottraders.domain.relay.RelayChannel;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * RelayChannel over an Undertow WebSocket. Sends are queued asynchronously on the channel's
 * I/O thread; completion is only logged, never awaited.
 */
final class UndertowRelayChannel implements RelayChannel {
    private static final Logger log = LoggerFactory.getLogger(UndertowRelayChannel.class);

    private final WebSocketChannel channel;
    private final WebSocketCallback<Void> sendCallback;

    UndertowRelayChannel(WebSocketChannel channel) {
        this.channel = channel;
        this.sendCallback = new WebSocketCallback<>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.warn("[RELAY] Send to {} failed: {}", ch.getSourceAddress(), throwable.toString());
            }
        };
    }

    @Override
    public boolean send(String text) {
        try {
            WebSockets.sendText(text, channel, sendCallback);
            return true;
        } catch (RuntimeException e) {
            log.warn("[RELAY] Send to {} rejected: {}", channel.getSourceAddress(), e.toString());
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[RELAY] Close of {} failed: {}", channel.getSourceAddress(), e.toString());
        }
    }
}
