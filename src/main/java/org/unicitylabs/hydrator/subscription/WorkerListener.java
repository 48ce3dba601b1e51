package org.unicitylabs.hydrator.subscription;

/**
 * Observer for worker state transitions.
 */
public interface WorkerListener {

    void onStateChange(String relayUrl, WorkerState previous, WorkerState current);
}
