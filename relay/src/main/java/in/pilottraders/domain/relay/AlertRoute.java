package in.pilottraders.domain.relay;

/**
 * Which index an alert is routed through.
 */
public enum AlertRoute {
    /** Addressed to one webhook id. */
    WEBHOOK,
    /** Shared admin endpoint, fanned out to every legacy connection. */
    LEGACY;

    public String label() {
        return name().toLowerCase();
    }
}
