package in.pilottraders.domain.relay;

/**
 * Outbound half of a subscriber's duplex stream.
 *
 * Writes are fire-and-forget: {@link #send(String)} only reports whether the
 * frame was handed to the transport, never whether the peer received it.
 */
public interface RelayChannel {

    /**
     * Queue a text frame for the peer.
     *
     * @return true if the transport accepted the write call
     */
    boolean send(String text);

    boolean isOpen();

    /**
     * Close the underlying stream. Safe to call more than once.
     */
    void close();
}
