package in.pilottraders.service.relay;

import in.pilottraders.domain.relay.Connection;
import in.pilottraders.domain.relay.ConnectionSummary;
import in.pilottraders.domain.relay.RelayChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Live subscriber connections and their routing indexes.
 *
 * Three structures are kept in step:
 * - primary set: id -> connection
 * - webhook index: webhook id -> connections bound to it
 * - legacy index: connections receiving the shared admin feed
 *
 * A connection sits in at most one of the two indexes. Every method takes the
 * registry monitor, so any caller sees the indexes and the primary set agree.
 * Unknown ids are ignored rather than reported as errors.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final int webhookPreviewChars;

    // guarded by this
    private long idCounter = 0;
    private final TreeMap<Long, Connection> connections = new TreeMap<>();
    private final Map<String, Set<Connection>> byWebhook = new HashMap<>();
    private final Set<Connection> legacy = new LinkedHashSet<>();

    public ConnectionRegistry(int webhookPreviewChars) {
        this.webhookPreviewChars = Math.max(0, webhookPreviewChars);
    }

    /**
     * Admit a new connection under the next id. Ids are never reused.
     */
    public synchronized Connection register(RelayChannel channel, String remoteAddress,
                                            Instant connectedAt, Instant ignoreUntil) {
        long id = ++idCounter;
        Connection connection = new Connection(id, channel, remoteAddress, connectedAt, ignoreUntil);
        connections.put(id, connection);
        return connection;
    }

    /**
     * Bind a connection to a webhook id, dropping any earlier webhook or legacy binding.
     *
     * @return false if the id is not registered
     */
    public synchronized boolean bindRoutingKey(long id, String webhookId) {
        Connection connection = connections.get(id);
        if (connection == null || webhookId == null || webhookId.isEmpty()) {
            return false;
        }
        unindex(connection);
        connection.bindWebhook(webhookId);
        byWebhook.computeIfAbsent(webhookId, k -> new LinkedHashSet<>()).add(connection);
        log.debug("[REGISTRY] Connection {} bound to webhook {}", id, redact(webhookId));
        return true;
    }

    /**
     * Bind a connection to the legacy feed, dropping any webhook binding.
     *
     * @return false if the id is not registered
     */
    public synchronized boolean bindLegacy(long id) {
        Connection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        unindex(connection);
        connection.bindLegacy();
        legacy.add(connection);
        log.debug("[REGISTRY] Connection {} bound to legacy feed", id);
        return true;
    }

    /**
     * Set or clear (null/blank) the symbol filter.
     */
    public synchronized boolean setSymbolFilter(long id, String symbol) {
        Connection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        connection.setSymbolFilter(symbol == null || symbol.isBlank() ? null : symbol);
        return true;
    }

    /**
     * Push the ignore deadline forward to {@code until}. An earlier value leaves it unchanged.
     *
     * @return the deadline now in force, empty if the id is not registered
     */
    public synchronized Optional<Instant> setIgnoreWindow(long id, Instant until) {
        Connection connection = connections.get(id);
        if (connection == null) {
            return Optional.empty();
        }
        return Optional.of(connection.extendIgnoreUntil(until));
    }

    /**
     * Remove a connection from the primary set and whichever index holds it.
     * The connection refuses writes once this returns.
     *
     * @return true if the id was registered
     */
    public synchronized boolean unregister(long id) {
        Connection connection = connections.remove(id);
        if (connection == null) {
            return false;
        }
        unindex(connection);
        connection.retract();
        return true;
    }

    /**
     * Connections currently bound to {@code webhookId}; empty if none.
     */
    public synchronized Set<Connection> lookupByKey(String webhookId) {
        if (webhookId == null) {
            return Collections.emptySet();
        }
        Set<Connection> bucket = byWebhook.get(webhookId);
        if (bucket == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(bucket));
    }

    public synchronized Set<Connection> lookupLegacy() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(legacy));
    }

    /**
     * Redacted summaries ordered by connection id.
     */
    public synchronized List<ConnectionSummary> snapshot() {
        List<ConnectionSummary> out = new ArrayList<>(connections.size());
        for (Connection connection : connections.values()) {
            out.add(ConnectionSummary.of(connection, webhookPreviewChars));
        }
        return out;
    }

    public synchronized int size() {
        return connections.size();
    }

    public synchronized int legacyCount() {
        return legacy.size();
    }

    public synchronized int webhookConnectionCount() {
        int total = 0;
        for (Set<Connection> bucket : byWebhook.values()) {
            total += bucket.size();
        }
        return total;
    }

    /**
     * Number of distinct webhook ids with at least one bound connection.
     */
    public synchronized int webhookChannelCount() {
        return byWebhook.size();
    }

    public String redact(String webhookId) {
        return ConnectionSummary.redact(webhookId, webhookPreviewChars);
    }

    // caller holds the monitor
    private void unindex(Connection connection) {
        String previous = connection.webhookId();
        if (previous != null) {
            Set<Connection> bucket = byWebhook.get(previous);
            if (bucket != null) {
                bucket.remove(connection);
                if (bucket.isEmpty()) {
                    byWebhook.remove(previous);
                }
            }
        }
        legacy.remove(connection);
    }
}
