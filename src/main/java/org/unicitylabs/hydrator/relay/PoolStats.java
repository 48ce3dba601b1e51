package org.unicitylabs.hydrator.relay;

import java.util.Collections;
import java.util.List;

/**
 * Snapshot of the connection pool.
 */
public class PoolStats {

    private final int activeConnections;
    private final List<RelayStats> relays;

    public PoolStats(int activeConnections, List<RelayStats> relays) {
        this.activeConnections = activeConnections;
        this.relays = Collections.unmodifiableList(relays);
    }

    public int getActiveConnections() { return activeConnections; }
    public List<RelayStats> getRelays() { return relays; }

    /**
     * Stats for one relay URL, or null when the pool has never seen it.
     */
    public RelayStats get(String url) {
        String normalized = RelayUrls.normalize(url);
        for (RelayStats relay : relays) {
            if (relay.getUrl().equals(normalized)) {
                return relay;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "PoolStats{activeConnections=" + activeConnections + ", relays=" + relays + '}';
    }

    /**
     * Per-relay counters.
     */
    public static class RelayStats {
        private final String url;
        private final boolean connected;
        private final int failedAttempts;
        private final long lastConnected;
        private final long ageMs;

        public RelayStats(String url, boolean connected, int failedAttempts, long lastConnected, long ageMs) {
            this.url = url;
            this.connected = connected;
            this.failedAttempts = failedAttempts;
            this.lastConnected = lastConnected;
            this.ageMs = ageMs;
        }

        public String getUrl() { return url; }
        public boolean isConnected() { return connected; }
        /** Consecutive failures since the last successful connect. */
        public int getFailedAttempts() { return failedAttempts; }
        /** Epoch millis of the last successful connect, 0 if never. */
        public long getLastConnected() { return lastConnected; }
        /** Millis since the last traffic on the pooled connection, -1 without a connection. */
        public long getAgeMs() { return ageMs; }

        @Override
        public String toString() {
            return "RelayStats{url=" + url +
                    ", connected=" + connected +
                    ", failedAttempts=" + failedAttempts +
                    ", lastConnected=" + lastConnected +
                    ", ageMs=" + ageMs +
                    '}';
        }
    }
}
