package org.unicitylabs.hydrator.subscription;

import org.unicitylabs.hydrator.protocol.Event;

/**
 * Callback receiving verified events from a live subscription.
 */
public interface EventHandler {

    /**
     * Called once per verified event. Exceptions are logged by the worker and the
     * stream continues with the next event.
     *
     * @param event The received event
     * @param relayUrl Relay that delivered it
     */
    void onEvent(Event event, String relayUrl) throws Exception;

    /**
     * Called when End-Of-Stored-Events (EOSE) is received for a subscription.
     * Optional: default implementation does nothing.
     *
     * @param subscriptionId The subscription ID
     */
    default void onEndOfStoredEvents(String subscriptionId) {
        // Optional callback
    }
}
