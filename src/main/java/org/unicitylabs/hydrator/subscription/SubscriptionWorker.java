package org.unicitylabs.hydrator.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unicitylabs.hydrator.protocol.ClientMessages;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventVerifier;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.protocol.RelayMessage;
import org.unicitylabs.hydrator.relay.ConnectionException;
import org.unicitylabs.hydrator.relay.RelayConnection;
import org.unicitylabs.hydrator.relay.RelayConnectionPool;
import org.unicitylabs.hydrator.relay.RelayUrls;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds one live subscription on one relay and hands every verified event to a handler.
 *
 * {@link #run} blocks the calling thread until {@link #shutdown()} is called. A dropped
 * connection is retried after a fixed backoff with a fresh subscription id; a handler
 * that throws is logged and skipped. Run one worker per relay and filter. Workers and
 * fan-out queries may share a pooled connection; on exit a worker closes it only when no
 * other subscription is open on it.
 */
public class SubscriptionWorker {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionWorker.class);
    public static final long DEFAULT_RECEIVE_TIMEOUT_MS = 1000;
    public static final long DEFAULT_BACKOFF_MS = 5000;

    private final RelayConnectionPool pool;
    private final List<WorkerListener> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong handlerErrorCount = new AtomicLong();
    private final AtomicLong reconnectCount = new AtomicLong();

    private long receiveTimeoutMs = DEFAULT_RECEIVE_TIMEOUT_MS;
    private long backoffMs = DEFAULT_BACKOFF_MS;

    private volatile WorkerState state = WorkerState.CONNECTING;
    private volatile String relayUrl;
    private volatile String subscriptionId;

    public SubscriptionWorker(RelayConnectionPool pool) {
        this.pool = pool;
    }

    /**
     * Set how long one receive call blocks. Shutdown is noticed within this interval.
     */
    public void setReceiveTimeoutMs(long receiveTimeoutMs) {
        this.receiveTimeoutMs = receiveTimeoutMs;
    }

    /**
     * Set the fixed wait between a connection error and the next connect attempt.
     */
    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public void addListener(WorkerListener listener) {
        listeners.add(listener);
    }

    /**
     * Subscribe and stream until shutdown. Returns normally once stopped.
     *
     * @param relayUrl Relay to subscribe to
     * @param filter Subscription filter, reused for every reconnect
     * @param handler Receives each verified event
     * @throws IllegalStateException if this worker was already started
     */
    public void run(String relayUrl, Filter filter, EventHandler handler) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker already started");
        }
        String url = RelayUrls.normalize(relayUrl);
        this.relayUrl = url;
        logger.info("Starting subscription worker for {}", url);

        try {
            while (!isStopRequested()) {
                transition(WorkerState.CONNECTING);
                String subId = ClientMessages.newSubscriptionId("live");
                RelayConnection connection;
                try {
                    connection = pool.getConnection(url);
                } catch (ConnectionException e) {
                    backoff(url, e.getMessage());
                    continue;
                }

                try {
                    connection.subscribe(subId, Collections.singletonList(filter));
                } catch (ConnectionException e) {
                    pool.reportFailure(url, e.getMessage());
                    backoff(url, e.getMessage());
                    continue;
                }

                subscriptionId = subId;
                transition(WorkerState.SUBSCRIBED);
                logger.info("Subscribed to {} with id {}", url, subId);

                try {
                    receiveLoop(connection, url, subId, handler);
                } catch (ConnectionException e) {
                    if (isStopRequested()) {
                        break;
                    }
                    pool.reportFailure(url, e.getMessage());
                    backoff(url, e.getMessage());
                } finally {
                    connection.unsubscribe(subId);
                }
            }
        } finally {
            pool.releaseIfIdle(url);
            transition(WorkerState.STOPPED);
            logger.info("Subscription worker for {} stopped ({} delivered, {} rejected, {} reconnects)",
                    url, deliveredCount.get(), rejectedCount.get(), reconnectCount.get());
        }
    }

    private void receiveLoop(RelayConnection connection, String url, String subId, EventHandler handler)
            throws ConnectionException {
        transition(WorkerState.RECEIVING);
        while (!isStopRequested()) {
            RelayMessage message = connection.receive(subId, receiveTimeoutMs);
            if (message == null) {
                continue;
            }
            switch (message.getType()) {
                case EVENT:
                    handle(((RelayMessage.EventMessage) message).getEvent(), url, handler);
                    break;
                case EOSE:
                    logger.debug("Caught up with stored events on {}", url);
                    endOfStoredEvents(subId, url, handler);
                    break;
                case CLOSED:
                    throw new ConnectionException(url,
                            "Subscription closed by relay: " + ((RelayMessage.ClosedMessage) message).getMessage());
                default:
                    break;
            }
        }
    }

    private void handle(Event event, String url, EventHandler handler) {
        EventVerifier.Outcome check = EventVerifier.check(event);
        if (!check.isValid()) {
            rejectedCount.incrementAndGet();
            logger.warn("Rejected event {} from {}: {}", event.getShortId(), url, check);
            return;
        }
        try {
            handler.onEvent(event, url);
            deliveredCount.incrementAndGet();
        } catch (Exception e) {
            handlerErrorCount.incrementAndGet();
            logger.error("Handler failed for event {} from {}", event.getShortId(), url, e);
        }
    }

    private void endOfStoredEvents(String subId, String url, EventHandler handler) {
        try {
            handler.onEndOfStoredEvents(subId);
        } catch (Exception e) {
            handlerErrorCount.incrementAndGet();
            logger.error("Handler failed at end of stored events for subscription {} on {}", subId, url, e);
        }
    }

    private void backoff(String url, String reason) {
        if (isStopRequested()) {
            return;
        }
        transition(WorkerState.RECONNECTING);
        long attempt = reconnectCount.incrementAndGet();
        logger.warn("Connection to {} failed ({}), reconnecting in {}ms (attempt {})", url, reason, backoffMs, attempt);
        try {
            stopSignal.await(backoffMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
        }
    }

    private void transition(WorkerState next) {
        WorkerState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        logger.debug("Worker for {}: {} -> {}", relayUrl, previous, next);
        for (WorkerListener listener : listeners) {
            try {
                listener.onStateChange(relayUrl, previous, next);
            } catch (Exception e) {
                logger.warn("Error in worker listener", e);
            }
        }
    }

    /**
     * Request the worker to stop. {@link #run} returns within one receive timeout.
     */
    public void shutdown() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    public WorkerState getState() { return state; }
    public String getRelayUrl() { return relayUrl; }
    /** Id of the current (or last) live subscription. */
    public String getSubscriptionId() { return subscriptionId; }
    public long getDeliveredCount() { return deliveredCount.get(); }
    public long getRejectedCount() { return rejectedCount.get(); }
    public long getHandlerErrorCount() { return handlerErrorCount.get(); }
    public long getReconnectCount() { return reconnectCount.get(); }
}
