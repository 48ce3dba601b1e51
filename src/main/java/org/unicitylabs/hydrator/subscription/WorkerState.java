package org.unicitylabs.hydrator.subscription;

/**
 * Lifecycle of a {@link SubscriptionWorker}.
 *
 * <pre>
 * CONNECTING -> SUBSCRIBED -> RECEIVING
 *      ^                          |
 *      +------ RECONNECTING <-----+  (connection error, fixed backoff)
 * any state -> STOPPED               (shutdown requested)
 * </pre>
 */
public enum WorkerState {
    CONNECTING,
    SUBSCRIBED,
    RECEIVING,
    RECONNECTING,
    STOPPED
}
