package org.unicitylabs.hydrator.relay;

import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.protocol.RelayMessage;

import java.util.List;

/**
 * One duplex WebSocket session with one relay.
 *
 * Inbound frames are demultiplexed: frames carrying the id of an open subscription go to
 * that subscription's mailbox and are read with {@link #receive(String, long)}; NOTICE, OK
 * and AUTH frames go to the connection mailbox read with {@link #receive(long)}. Ping
 * frames are answered by the transport and never surface. Callers must {@link #close()}
 * a connection they own on every exit path.
 */
public interface RelayConnection extends AutoCloseable {

    /**
     * Normalized relay URL.
     */
    String getUrl();

    /**
     * Open the session. Does nothing when already connected.
     *
     * @throws ConnectionException on handshake failure or timeout
     */
    void connect() throws ConnectionException;

    boolean isConnected();

    /**
     * Send a raw text frame.
     *
     * @throws NotConnectedException if the session is not open
     */
    void send(String frame) throws NotConnectedException;

    /**
     * Open a mailbox for the subscription and send ["REQ", subscriptionId, filters...].
     */
    void subscribe(String subscriptionId, List<Filter> filters) throws ConnectionException;

    /**
     * Send ["CLOSE", subscriptionId] (best-effort) and discard the mailbox.
     */
    void unsubscribe(String subscriptionId);

    /**
     * Subscriptions currently open on this connection.
     */
    int getSubscriptionCount();

    /**
     * Next connection-level frame (NOTICE, OK, AUTH).
     *
     * @param timeoutMs Maximum time to wait
     * @return the frame, or null on timeout
     * @throws ConnectionException if the connection is or becomes closed
     */
    RelayMessage receive(long timeoutMs) throws ConnectionException;

    /**
     * Next frame for an open subscription (EVENT, EOSE, CLOSED).
     *
     * @param subscriptionId Subscription previously opened with {@link #subscribe}
     * @param timeoutMs Maximum time to wait
     * @return the frame, or null on timeout
     * @throws ConnectionException if the connection is or becomes closed
     */
    RelayMessage receive(String subscriptionId, long timeoutMs) throws ConnectionException;

    /**
     * Epoch millis of the last successful connect, 0 if never connected.
     */
    long getConnectedAt();

    /**
     * Epoch millis of the last frame sent or received.
     */
    long getLastActivityAt();

    /**
     * Close the session. Idempotent; wakes every blocked reader.
     */
    @Override
    void close();
}
