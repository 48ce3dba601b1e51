package org.unicitylabs.hydrator.relay;

/**
 * Connection event listener for monitoring relay connections.
 */
public interface ConnectionEventListener {
    /** Called when a relay connection is established for the first time. */
    default void onConnect(String relayUrl) {}
    /** Called when a relay connection is closed or reported broken. */
    default void onDisconnect(String relayUrl, String reason) {}
    /** Called when a subscription worker is about to retry a relay. */
    default void onReconnecting(String relayUrl, int attempt) {}
    /** Called when a relay that was connected before is connected again. */
    default void onReconnected(String relayUrl) {}
}
