package org.unicitylabs.hydrator.protocol;

/**
 * A relay sent a frame that is not valid JSON or does not have the shape of a known
 * relay-to-client message. The frame is dropped; the connection stays usable.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
