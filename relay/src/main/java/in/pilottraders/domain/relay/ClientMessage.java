package in.pilottraders.domain.relay;

/**
 * A decoded subscriber frame.
 *
 * @param type      message kind
 * @param webhookId routing key, only for {@link ClientMessageType#REGISTER_WEBHOOK}
 * @param symbol    symbol filter, only for {@link ClientMessageType#SUBSCRIBE}; null clears it
 */
public record ClientMessage(ClientMessageType type, String webhookId, String symbol) {

    private static final ClientMessage REGISTER_LEGACY = new ClientMessage(ClientMessageType.REGISTER_LEGACY, null, null);
    private static final ClientMessage PING = new ClientMessage(ClientMessageType.PING, null, null);
    private static final ClientMessage CLEAR_SESSION = new ClientMessage(ClientMessageType.CLEAR_SESSION, null, null);
    private static final ClientMessage IGNORED = new ClientMessage(ClientMessageType.IGNORED, null, null);

    public static ClientMessage registerWebhook(String webhookId) {
        return new ClientMessage(ClientMessageType.REGISTER_WEBHOOK, webhookId, null);
    }

    public static ClientMessage registerLegacy() {
        return REGISTER_LEGACY;
    }

    public static ClientMessage subscribe(String symbol) {
        return new ClientMessage(ClientMessageType.SUBSCRIBE, null, symbol);
    }

    public static ClientMessage ping() {
        return PING;
    }

    public static ClientMessage clearSession() {
        return CLEAR_SESSION;
    }

    public static ClientMessage ignored() {
        return IGNORED;
    }
}
