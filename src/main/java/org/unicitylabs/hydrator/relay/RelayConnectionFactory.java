package org.unicitylabs.hydrator.relay;

/**
 * Creates unconnected relay connections. The pool owns when and how often.
 */
public interface RelayConnectionFactory {

    /**
     * @param url Normalized relay URL
     * @return a new connection, not yet connected
     */
    RelayConnection create(String url);
}
