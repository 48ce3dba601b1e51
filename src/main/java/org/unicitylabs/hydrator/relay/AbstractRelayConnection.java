package org.unicitylabs.hydrator.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unicitylabs.hydrator.protocol.ClientMessages;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.protocol.ProtocolException;
import org.unicitylabs.hydrator.protocol.RelayMessage;
import org.unicitylabs.hydrator.protocol.RelayMessageParser;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Frame routing, mailboxes and activity bookkeeping shared by every transport.
 * Subclasses open and close the transport and feed inbound text through
 * {@link #deliver(String)}; a transport failure is reported with {@link #connectionLost(String)}.
 */
public abstract class AbstractRelayConnection implements RelayConnection {

    private static final Logger logger = LoggerFactory.getLogger(AbstractRelayConnection.class);
    private static final int CONNECTION_MAILBOX_CAPACITY = 256;

    /** Wakes readers when the connection goes away. */
    private static final Object CONNECTION_LOST = new Object();

    protected final String url;
    protected final Clock clock;

    private final BlockingQueue<Object> connectionMailbox = new LinkedBlockingQueue<>(CONNECTION_MAILBOX_CAPACITY);
    private final Map<String, BlockingQueue<Object>> subscriptionMailboxes = new ConcurrentHashMap<>();
    private final AtomicLong protocolErrors = new AtomicLong();

    private volatile boolean connected = false;
    private volatile String lostReason;
    private volatile long connectedAt;
    private volatile long lastActivityAt;

    protected AbstractRelayConnection(String url, Clock clock) {
        this.url = url;
        this.clock = clock;
    }

    /**
     * Open the transport and block until it is usable.
     */
    protected abstract void openTransport() throws ConnectionException;

    /**
     * Hand a text frame to the transport.
     *
     * @return false if the transport refused the frame (closing or closed)
     */
    protected abstract boolean sendText(String text);

    /**
     * Release the transport. Must not throw.
     */
    protected abstract void closeTransport();

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public synchronized void connect() throws ConnectionException {
        if (connected) {
            return;
        }
        connectionMailbox.clear();
        subscriptionMailboxes.clear();
        lostReason = null;

        openTransport();

        connected = true;
        connectedAt = clock.millis();
        lastActivityAt = connectedAt;
        logger.info("Connected to relay: {}", url);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void send(String frame) throws NotConnectedException {
        if (!connected || !sendText(frame)) {
            throw new NotConnectedException(url);
        }
        touch();
    }

    @Override
    public void subscribe(String subscriptionId, List<Filter> filters) throws ConnectionException {
        subscriptionMailboxes.put(subscriptionId, new LinkedBlockingQueue<>());
        try {
            send(ClientMessages.req(subscriptionId, filters));
        } catch (NotConnectedException e) {
            subscriptionMailboxes.remove(subscriptionId);
            throw e;
        }
        logger.debug("Subscribed {} on {}", subscriptionId, url);
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        subscriptionMailboxes.remove(subscriptionId);
        if (!connected) {
            return;
        }
        try {
            send(ClientMessages.close(subscriptionId));
            logger.debug("Sent CLOSE for {} to {}", subscriptionId, url);
        } catch (NotConnectedException e) {
            logger.debug("Could not send CLOSE for {} to {}: {}", subscriptionId, url, e.getMessage());
        }
    }

    @Override
    public int getSubscriptionCount() {
        return subscriptionMailboxes.size();
    }

    @Override
    public RelayMessage receive(long timeoutMs) throws ConnectionException {
        return take(connectionMailbox, timeoutMs);
    }

    @Override
    public RelayMessage receive(String subscriptionId, long timeoutMs) throws ConnectionException {
        BlockingQueue<Object> mailbox = subscriptionMailboxes.get(subscriptionId);
        if (mailbox == null) {
            throw new IllegalStateException("No open subscription " + subscriptionId + " on " + url);
        }
        return take(mailbox, timeoutMs);
    }

    private RelayMessage take(BlockingQueue<Object> mailbox, long timeoutMs) throws ConnectionException {
        if (!connected && mailbox.isEmpty()) {
            throw new NotConnectedException(url);
        }
        Object item;
        try {
            item = mailbox.poll(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException(url, "Interrupted while waiting for frames", e);
        }
        if (item == null) {
            return null;
        }
        if (item == CONNECTION_LOST) {
            // Leave the marker for any later reader of the same mailbox
            mailbox.offer(CONNECTION_LOST);
            throw new ConnectionException(url, lostReason != null ? lostReason : "Connection lost");
        }
        return (RelayMessage) item;
    }

    /**
     * Parse and route one inbound text frame. Malformed frames are dropped.
     */
    protected void deliver(String text) {
        touch();
        RelayMessage message;
        try {
            message = RelayMessageParser.parse(text);
        } catch (ProtocolException e) {
            protocolErrors.incrementAndGet();
            logger.debug("Dropping malformed frame from {}: {}", url, e.getMessage());
            return;
        }

        String subscriptionId = message.getSubscriptionId();
        if (subscriptionId != null) {
            BlockingQueue<Object> mailbox = subscriptionMailboxes.get(subscriptionId);
            if (mailbox == null) {
                logger.debug("Dropping {} for unknown subscription {} from {}", message.getType(), subscriptionId, url);
                return;
            }
            mailbox.offer(message);
            return;
        }

        switch (message.getType()) {
            case NOTICE:
                RelayMessage.NoticeMessage notice = (RelayMessage.NoticeMessage) message;
                if (notice.isError()) {
                    logger.warn("Relay {} error notice: {}", url, notice.getMessage());
                } else {
                    logger.info("Relay {} notice: {}", url, notice.getMessage());
                }
                break;
            case OK:
                RelayMessage.OkMessage ok = (RelayMessage.OkMessage) message;
                if (ok.isAccepted()) {
                    logger.debug("Event accepted by {}: {}", url, ok.getEventId());
                } else {
                    logger.warn("Event rejected by {}: {} - {}", url, ok.getEventId(), ok.getMessage());
                }
                break;
            case AUTH:
                logger.info("Relay {} sent an AUTH challenge", url);
                break;
            default:
                break;
        }
        while (!connectionMailbox.offer(message)) {
            // Nobody is reading connection-level frames; keep the newest
            connectionMailbox.poll();
        }
    }

    /**
     * The transport failed or the relay closed the socket.
     */
    protected synchronized void connectionLost(String reason) {
        if (!connected) {
            return;
        }
        connected = false;
        lostReason = reason;
        logger.warn("Lost connection to relay {}: {}", url, reason);
        wakeReaders();
    }

    @Override
    public synchronized void close() {
        boolean wasConnected = connected;
        connected = false;
        if (lostReason == null) {
            lostReason = "Closed by client";
        }
        closeTransport();
        wakeReaders();
        if (wasConnected) {
            logger.debug("Closed connection to relay {}", url);
        }
    }

    private void wakeReaders() {
        while (!connectionMailbox.offer(CONNECTION_LOST)) {
            connectionMailbox.poll();
        }
        for (BlockingQueue<Object> mailbox : subscriptionMailboxes.values()) {
            mailbox.offer(CONNECTION_LOST);
        }
    }

    private void touch() {
        lastActivityAt = clock.millis();
    }

    @Override
    public long getConnectedAt() {
        return connectedAt;
    }

    @Override
    public long getLastActivityAt() {
        return lastActivityAt;
    }

    /**
     * Frames dropped because they could not be parsed.
     */
    public long getProtocolErrorCount() {
        return protocolErrors.get();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{url=" + url + ", connected=" + connected + '}';
    }
}
