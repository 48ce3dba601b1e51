package org.unicitylabs.hydrator.config;

import org.unicitylabs.hydrator.relay.RelayUrls;
import org.unicitylabs.hydrator.store.StoreDataSources;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runtime settings for relays, timeouts, the pool, the worker and the record store.
 * Every setting has a default; see {@link HydratorConfigLoader} for the YAML keys.
 */
public class HydratorConfig {

    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    public static final long DEFAULT_PER_RELAY_TIMEOUT_MS = 15000;
    public static final long DEFAULT_OVERALL_TIMEOUT_MS = 30000;
    public static final long DEFAULT_RECEIVE_TIMEOUT_MS = 1000;
    public static final long DEFAULT_BACKOFF_MS = 5000;
    public static final long DEFAULT_POOL_MAX_AGE_SECONDS = 300;
    public static final long DEFAULT_POOL_CLEANUP_INTERVAL_SECONDS = 60;
    public static final long DEFAULT_PING_INTERVAL_MS = 25000;
    public static final int DEFAULT_BATCH_SIZE = 50;

    private String localRelay;
    private List<String> defaultRelays = new ArrayList<>();

    private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    private long perRelayTimeoutMs = DEFAULT_PER_RELAY_TIMEOUT_MS;
    private long overallTimeoutMs = DEFAULT_OVERALL_TIMEOUT_MS;
    private long receiveTimeoutMs = DEFAULT_RECEIVE_TIMEOUT_MS;
    private long backoffMs = DEFAULT_BACKOFF_MS;

    private long poolMaxAgeSeconds = DEFAULT_POOL_MAX_AGE_SECONDS;
    private long poolCleanupIntervalSeconds = DEFAULT_POOL_CLEANUP_INTERVAL_SECONDS;
    private long pingIntervalMs = DEFAULT_PING_INTERVAL_MS;

    private String jdbcUrl = StoreDataSources.DEFAULT_JDBC_URL;
    private String storeUsername = "SA";
    private String storePassword = "";
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Relays to hydrate from: local relay first, then the configured defaults, or the
     * built-in public relays when no defaults are configured.
     */
    public List<String> getRelays() {
        return RelayUrls.resolve(localRelay, defaultRelays);
    }

    /**
     * Only the relays actually configured, without the public fallback.
     *
     * @throws ConfigurationException if neither a local relay nor defaults are set
     */
    public List<String> getConfiguredRelays() {
        List<String> relays = RelayUrls.withLocalFirst(localRelay, defaultRelays);
        if (relays.isEmpty()) {
            throw new ConfigurationException("No relay configured (relays.local / relays.defaults)");
        }
        return relays;
    }

    public String getLocalRelay() { return localRelay; }
    public List<String> getDefaultRelays() { return Collections.unmodifiableList(defaultRelays); }
    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public long getPerRelayTimeoutMs() { return perRelayTimeoutMs; }
    public long getOverallTimeoutMs() { return overallTimeoutMs; }
    public long getReceiveTimeoutMs() { return receiveTimeoutMs; }
    public long getBackoffMs() { return backoffMs; }
    public long getPoolMaxAgeSeconds() { return poolMaxAgeSeconds; }
    public long getPoolCleanupIntervalSeconds() { return poolCleanupIntervalSeconds; }
    public long getPingIntervalMs() { return pingIntervalMs; }
    public String getJdbcUrl() { return jdbcUrl; }
    public String getStoreUsername() { return storeUsername; }
    public String getStorePassword() { return storePassword; }
    public int getBatchSize() { return batchSize; }

    public void setLocalRelay(String localRelay) {
        this.localRelay = localRelay == null || localRelay.isBlank() ? null : localRelay.trim();
    }

    public void setDefaultRelays(List<String> defaultRelays) {
        this.defaultRelays = defaultRelays == null ? new ArrayList<>() : new ArrayList<>(defaultRelays);
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = positive("timeouts.connect-ms", connectTimeoutMs);
    }

    public void setPerRelayTimeoutMs(long perRelayTimeoutMs) {
        this.perRelayTimeoutMs = positive("timeouts.per-relay-ms", perRelayTimeoutMs);
    }

    public void setOverallTimeoutMs(long overallTimeoutMs) {
        this.overallTimeoutMs = positive("timeouts.overall-ms", overallTimeoutMs);
    }

    public void setReceiveTimeoutMs(long receiveTimeoutMs) {
        this.receiveTimeoutMs = positive("timeouts.receive-ms", receiveTimeoutMs);
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = positive("worker.backoff-ms", backoffMs);
    }

    public void setPoolMaxAgeSeconds(long poolMaxAgeSeconds) {
        this.poolMaxAgeSeconds = positive("pool.max-age-seconds", poolMaxAgeSeconds);
    }

    public void setPoolCleanupIntervalSeconds(long poolCleanupIntervalSeconds) {
        this.poolCleanupIntervalSeconds = positive("pool.cleanup-interval-seconds", poolCleanupIntervalSeconds);
    }

    public void setPingIntervalMs(long pingIntervalMs) {
        this.pingIntervalMs = positive("pool.ping-interval-ms", pingIntervalMs);
    }

    public void setJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new ConfigurationException("store.jdbc-url must not be blank");
        }
        this.jdbcUrl = jdbcUrl.trim();
    }

    public void setStoreUsername(String storeUsername) { this.storeUsername = storeUsername; }
    public void setStorePassword(String storePassword) { this.storePassword = storePassword; }

    public void setBatchSize(int batchSize) {
        this.batchSize = (int) positive("hydration.batch-size", batchSize);
    }

    private static long positive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
        return value;
    }
}
