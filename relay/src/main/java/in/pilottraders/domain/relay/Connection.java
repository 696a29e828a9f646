package in.pilottraders.domain.relay;

import java.time.Instant;
import java.util.Objects;

/**
 * One live subscriber session.
 *
 * Routing fields (webhook id, legacy flag, symbol filter, ignore window) are
 * written only by {@code ConnectionRegistry} while it holds its lock; they are
 * volatile so the router can read them without taking that lock.
 */
public final class Connection {
    private final long id;
    private final RelayChannel channel;
    private final String remoteAddress;
    private final Instant connectedAt;

    private volatile String symbolFilter;
    private volatile String webhookId;
    private volatile boolean legacy;
    private volatile Instant ignoreUntil;

    // guarded by this
    private boolean retracted;

    public Connection(long id, RelayChannel channel, String remoteAddress, Instant connectedAt, Instant ignoreUntil) {
        this.id = id;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.remoteAddress = remoteAddress == null ? "unknown" : remoteAddress;
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.ignoreUntil = ignoreUntil == null ? connectedAt : ignoreUntil;
    }

    public long id() {
        return id;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public String symbolFilter() {
        return symbolFilter;
    }

    public String webhookId() {
        return webhookId;
    }

    public boolean isLegacy() {
        return legacy;
    }

    public Instant ignoreUntil() {
        return ignoreUntil;
    }

    public boolean isIgnoring(Instant now) {
        return now.isBefore(ignoreUntil);
    }

    /**
     * Whether a payload symbol passes this connection's subscription.
     * No filter, or no symbol on the alert, always passes. Otherwise exact, case-sensitive.
     */
    public boolean acceptsSymbol(String alertSymbol) {
        String filter = symbolFilter;
        if (filter == null || filter.isEmpty() || alertSymbol == null) {
            return true;
        }
        return filter.equals(alertSymbol);
    }

    public void setSymbolFilter(String symbolFilter) {
        this.symbolFilter = symbolFilter;
    }

    public void bindWebhook(String webhookId) {
        this.webhookId = webhookId;
        this.legacy = false;
    }

    public void bindLegacy() {
        this.webhookId = null;
        this.legacy = true;
    }

    /**
     * Move the ignore deadline to {@code until} if that is later than the current one.
     *
     * @return the deadline in force after the call
     */
    public Instant extendIgnoreUntil(Instant until) {
        if (until != null && until.isAfter(ignoreUntil)) {
            ignoreUntil = until;
        }
        return ignoreUntil;
    }

    /**
     * Write a frame unless the connection has been retracted from the registry.
     * Holding the monitor across the write orders it against {@link #retract()}.
     */
    public synchronized boolean send(String text) {
        if (retracted || !channel.isOpen()) {
            return false;
        }
        return channel.send(text);
    }

    /**
     * Refuse all further writes. Idempotent.
     */
    public synchronized void retract() {
        retracted = true;
    }

    public synchronized boolean isRetracted() {
        return retracted;
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", remote=" + remoteAddress + ", legacy=" + legacy + "}";
    }
}
