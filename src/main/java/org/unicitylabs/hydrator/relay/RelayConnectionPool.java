package org.unicitylabs.hydrator.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Cache of live relay connections keyed by normalized URL.
 *
 * The pool owns the connections it hands out: callers subscribe and read through them
 * but never close them, they release them through {@link #releaseIfIdle(String)},
 * {@link #closeRelay(String)},
 * {@link #cleanupStale(long)} or {@link #closeAll()}. Concurrent callers asking for the
 * same URL share one connection; different URLs never block each other.
 */
public class RelayConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RelayConnectionPool.class);

    /** Consecutive failures after which a relay's connection is dropped. */
    public static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final RelayConnectionFactory connectionFactory;
    private final Clock clock;

    private final Map<String, RelayConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, RelayState> relays = new ConcurrentHashMap<>();
    private final List<ConnectionEventListener> connectionListeners = new CopyOnWriteArrayList<>();

    public RelayConnectionPool(RelayConnectionFactory connectionFactory) {
        this(connectionFactory, Clock.systemUTC());
    }

    public RelayConnectionPool(RelayConnectionFactory connectionFactory, Clock clock) {
        this.connectionFactory = connectionFactory;
        this.clock = clock;
    }

    /**
     * Add a connection event listener.
     */
    public void addConnectionListener(ConnectionEventListener listener) {
        connectionListeners.add(listener);
    }

    public void removeConnectionListener(ConnectionEventListener listener) {
        connectionListeners.remove(listener);
    }

    /**
     * Get the pooled connection for a relay, connecting on demand.
     *
     * @param relayUrl Relay URL; normalized before lookup
     * @return a connected connection
     * @throws ConnectionException if a new connection could not be opened
     */
    public RelayConnection getConnection(String relayUrl) throws ConnectionException {
        String url = RelayUrls.normalize(relayUrl);
        RelayState state = relays.computeIfAbsent(url, RelayState::new);

        synchronized (state) {
            RelayConnection existing = connections.get(url);
            if (existing != null) {
                if (existing.isConnected()) {
                    return existing;
                }
                connections.remove(url);
                existing.close();
                logger.debug("Replacing dead connection to {}", url);
            }

            RelayConnection connection = connectionFactory.create(url);
            try {
                connection.connect();
            } catch (ConnectionException e) {
                connection.close();
                int failures = state.recordFailure(clock.millis());
                logger.warn("Failed to connect to {} (attempt {}): {}", url, failures, e.getMessage());
                throw e;
            }

            boolean reconnect = state.lastConnected > 0;
            state.recordSuccess(clock.millis());
            connections.put(url, connection);
            relays.putIfAbsent(url, state);

            if (reconnect) {
                emitConnectionEvent(listener -> listener.onReconnected(url));
            } else {
                emitConnectionEvent(listener -> listener.onConnect(url));
            }
            return connection;
        }
    }

    /**
     * Record that a pooled connection broke while in use. After
     * {@link #MAX_CONSECUTIVE_FAILURES} the cached connection is closed and dropped.
     */
    public void reportFailure(String relayUrl, String reason) {
        String url = RelayUrls.normalize(relayUrl);
        RelayState state = relays.computeIfAbsent(url, RelayState::new);
        int failures;
        synchronized (state) {
            failures = state.recordFailure(clock.millis());
            if (failures >= MAX_CONSECUTIVE_FAILURES) {
                RelayConnection connection = connections.remove(url);
                if (connection != null) {
                    connection.close();
                    logger.warn("Evicted {} after {} consecutive failures", url, failures);
                }
            }
        }
        emitConnectionEvent(listener -> listener.onDisconnect(url, reason));
    }

    /**
     * Close and drop every connection idle for longer than maxAgeMs.
     *
     * @return number of connections removed
     */
    public int cleanupStale(long maxAgeMs) {
        long now = clock.millis();
        int removed = 0;

        for (Iterator<Map.Entry<String, RelayState>> it = relays.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, RelayState> entry = it.next();
            String url = entry.getKey();
            RelayState state = entry.getValue();
            synchronized (state) {
                RelayConnection connection = connections.get(url);
                if (connection == null) {
                    // Failure bookkeeping for relays we no longer hold expires the same way
                    if (now - state.lastFailure > maxAgeMs) {
                        it.remove();
                    }
                    continue;
                }
                long age = now - connection.getLastActivityAt();
                if (age <= maxAgeMs) {
                    continue;
                }
                connections.remove(url);
                it.remove();
                connection.close();
                removed++;
                logger.info("Closed stale connection to {} (idle {}s)", url, age / 1000);
            }
            emitConnectionEvent(listener -> listener.onDisconnect(url, "Stale"));
        }

        if (removed > 0) {
            logger.info("Cleaned up {} stale relay connection(s)", removed);
        }
        return removed;
    }

    /**
     * Close a relay's connection if no subscription is open on it. Failure counters are
     * kept. A caller that needs the connection again gets a new one from
     * {@link #getConnection(String)}.
     *
     * @return true if a connection was closed
     */
    public boolean releaseIfIdle(String relayUrl) {
        String url = RelayUrls.normalize(relayUrl);
        RelayState state = relays.computeIfAbsent(url, RelayState::new);
        synchronized (state) {
            RelayConnection connection = connections.get(url);
            if (connection == null) {
                return false;
            }
            int open = connection.getSubscriptionCount();
            if (open > 0) {
                logger.debug("Keeping connection to {} open for {} subscription(s)", url, open);
                return false;
            }
            connections.remove(url);
            connection.close();
        }
        emitConnectionEvent(listener -> listener.onDisconnect(url, "Released"));
        return true;
    }

    /**
     * Close one relay's connection and forget its counters.
     */
    public void closeRelay(String relayUrl) {
        String url = RelayUrls.normalize(relayUrl);
        RelayState state = relays.remove(url);
        RelayConnection connection;
        if (state != null) {
            synchronized (state) {
                connection = connections.remove(url);
            }
        } else {
            connection = connections.remove(url);
        }
        if (connection != null) {
            connection.close();
            emitConnectionEvent(listener -> listener.onDisconnect(url, "Closed"));
        }
    }

    /**
     * Close every pooled connection.
     */
    public void closeAll() {
        for (String url : new ArrayList<>(relays.keySet())) {
            closeRelay(url);
        }
        for (String url : new ArrayList<>(connections.keySet())) {
            closeRelay(url);
        }
        logger.info("Closed all relay connections");
    }

    @Override
    public void close() {
        closeAll();
    }

    /**
     * Snapshot of active connections and per-relay counters.
     */
    public PoolStats stats() {
        long now = clock.millis();
        List<PoolStats.RelayStats> relayStats = new ArrayList<>();
        int active = 0;
        for (Map.Entry<String, RelayState> entry : relays.entrySet()) {
            String url = entry.getKey();
            RelayState state = entry.getValue();
            RelayConnection connection = connections.get(url);
            boolean connected = connection != null && connection.isConnected();
            if (connected) {
                active++;
            }
            long age = connection != null ? now - connection.getLastActivityAt() : -1;
            relayStats.add(new PoolStats.RelayStats(url, connected, state.failures, state.lastConnected, age));
        }
        return new PoolStats(active, relayStats);
    }

    /**
     * Whether a live connection to the relay is cached.
     */
    public boolean isConnected(String relayUrl) {
        RelayConnection connection = connections.get(RelayUrls.normalize(relayUrl));
        return connection != null && connection.isConnected();
    }

    private void emitConnectionEvent(Consumer<ConnectionEventListener> action) {
        for (ConnectionEventListener listener : connectionListeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.warn("Error in connection listener", e);
            }
        }
    }

    /**
     * Per-relay counters. Guarded by its own monitor.
     */
    private static class RelayState {
        final String url;
        int failures;
        long lastConnected;
        long lastFailure;

        RelayState(String url) {
            this.url = url;
        }

        int recordFailure(long now) {
            failures++;
            lastFailure = now;
            return failures;
        }

        void recordSuccess(long now) {
            failures = 0;
            lastConnected = now;
        }
    }
}
