package org.unicitylabs.hydrator.relay;

import okhttp3.OkHttpClient;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Builds {@link WebSocketRelayConnection}s sharing one OkHttp client (and its dispatcher
 * and connection pool).
 */
public class WebSocketRelayConnectionFactory implements RelayConnectionFactory {

    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 30_000;
    private static final long DEFAULT_PING_INTERVAL_MS = 25_000;

    private final OkHttpClient httpClient;
    private final long connectTimeoutMs;
    private final Clock clock;

    public WebSocketRelayConnectionFactory() {
        this(DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_PING_INTERVAL_MS, Clock.systemUTC());
    }

    /**
     * @param connectTimeoutMs Handshake timeout
     * @param pingIntervalMs Client ping interval (0 disables client pings)
     * @param clock Clock for activity timestamps
     */
    public WebSocketRelayConnectionFactory(long connectTimeoutMs, long pingIntervalMs, Clock clock) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.clock = clock;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(0, TimeUnit.MILLISECONDS)  // No read timeout for WebSocket
            .writeTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
            .pingInterval(pingIntervalMs, TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public RelayConnection create(String url) {
        return new WebSocketRelayConnection(RelayUrls.normalize(url), httpClient, connectTimeoutMs, clock);
    }

    /**
     * Release OkHttp's dispatcher threads. Connections should be closed first.
     */
    public void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
