package in.pilottraders.domain.relay;

/**
 * Kinds of frames a subscriber may send. Anything unrecognised or malformed is {@link #IGNORED}.
 */
public enum ClientMessageType {
    REGISTER_WEBHOOK,
    REGISTER_LEGACY,
    SUBSCRIBE,
    PING,
    CLEAR_SESSION,
    IGNORED
}
