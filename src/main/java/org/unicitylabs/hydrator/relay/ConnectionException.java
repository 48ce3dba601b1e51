package org.unicitylabs.hydrator.relay;

import java.io.IOException;

/**
 * A relay could not be reached, the WebSocket handshake failed or timed out, or an
 * established connection dropped. Always recoverable: the caller skips the relay or
 * retries after a backoff.
 */
public class ConnectionException extends IOException {

    private final String relayUrl;

    public ConnectionException(String relayUrl, String message) {
        super(message + " (" + relayUrl + ")");
        this.relayUrl = relayUrl;
    }

    public ConnectionException(String relayUrl, String message, Throwable cause) {
        super(message + " (" + relayUrl + ")", cause);
        this.relayUrl = relayUrl;
    }

    public String getRelayUrl() {
        return relayUrl;
    }
}
