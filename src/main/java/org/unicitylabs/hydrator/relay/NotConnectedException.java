package org.unicitylabs.hydrator.relay;

/**
 * Send or receive attempted on a connection that is not open.
 */
public class NotConnectedException extends ConnectionException {

    public NotConnectedException(String relayUrl) {
        super(relayUrl, "Not connected");
    }
}
