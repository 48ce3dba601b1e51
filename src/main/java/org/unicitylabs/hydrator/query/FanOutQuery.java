package org.unicitylabs.hydrator.query;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues one filter to several relays at once and merges what they return.
 *
 * Each relay is read by its own leg until EOSE, the per-relay timeout or the overall
 * timeout, whichever comes first. The per-relay timeout covers connecting as well as
 * reading. A relay that cannot be reached is skipped; it never
 * fails the query. Events failing verification are dropped and counted. The merge keeps
 * the first verified event for each id.
 */
public class FanOutQuery implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FanOutQuery.class);
    public static final long DEFAULT_PER_RELAY_TIMEOUT_MS = 15000;
    public static final long DEFAULT_OVERALL_TIMEOUT_MS = 30000;

    /** Time a leg gets after its deadline to hand back its outcome. */
    private static final long LEG_SETTLE_MS = 200;

    private final RelayConnectionPool pool;
    private final ExecutorService legExecutor;
    private final boolean ownsExecutor;
    private final AtomicLong rejectedCount = new AtomicLong();

    /**
     * Create a query aggregator running legs on its own daemon threads.
     */
    public FanOutQuery(RelayConnectionPool pool) {
        this(pool, Executors.newCachedThreadPool(new LegThreadFactory()), true);
    }

    /**
     * Create a query aggregator running legs on a caller-supplied executor.
     */
    public FanOutQuery(RelayConnectionPool pool, ExecutorService legExecutor) {
        this(pool, legExecutor, false);
    }

    private FanOutQuery(RelayConnectionPool pool, ExecutorService legExecutor, boolean ownsExecutor) {
        this.pool = pool;
        this.legExecutor = legExecutor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Query relays and return the merged, de-duplicated, verified events.
     */
    public List<Event> query(Collection<String> relayUrls, Filter filter,
                             long perRelayTimeoutMs, long overallTimeoutMs) {
        return execute(relayUrls, filter, perRelayTimeoutMs, overallTimeoutMs).getEvents();
    }

    public List<Event> query(Collection<String> relayUrls, Filter filter) {
        return query(relayUrls, filter, DEFAULT_PER_RELAY_TIMEOUT_MS, DEFAULT_OVERALL_TIMEOUT_MS);
    }

    /**
     * Query relays and return the merged events together with per-relay outcomes.
     */
    public QueryResult execute(Collection<String> relayUrls, Filter filter,
                               long perRelayTimeoutMs, long overallTimeoutMs) {
        List<String> urls = RelayUrls.normalizeAll(relayUrls);
        long startNanos = System.nanoTime();
        long legBudgetMs = Math.min(perRelayTimeoutMs, overallTimeoutMs);
        long overallDeadline = startNanos + TimeUnit.MILLISECONDS.toNanos(overallTimeoutMs);

        List<Leg> legs = new ArrayList<>(urls.size());
        List<Future<RelayLegOutcome>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            Leg leg = new Leg(url, filter, startNanos + TimeUnit.MILLISECONDS.toNanos(legBudgetMs));
            legs.add(leg);
            futures.add(legExecutor.submit(leg::run));
        }

        List<RelayLegOutcome> outcomes = new ArrayList<>(legs.size());
        for (int i = 0; i < legs.size(); i++) {
            outcomes.add(await(legs.get(i), futures.get(i), overallDeadline));
        }

        Map<String, Event> merged = new LinkedHashMap<>();
        Map<String, String> sources = new HashMap<>();
        int duplicates = 0;
        int rejected = 0;
        for (Leg leg : legs) {
            rejected += leg.rejected.get();
            for (Event event : leg.snapshot()) {
                if (merged.putIfAbsent(event.getId(), event) != null) {
                    duplicates++;
                } else {
                    sources.put(event.getId(), leg.url);
                }
            }
        }

        QueryResult result = new QueryResult(new ArrayList<>(merged.values()), rejected, duplicates, outcomes, sources);
        logger.info("Fan-out query over {} relay(s) returned {} event(s) ({} duplicate, {} rejected) in {}ms",
                urls.size(), merged.size(), duplicates, rejected,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return result;
    }

    private RelayLegOutcome await(Leg leg, Future<RelayLegOutcome> future, long overallDeadline) {
        // A leg stops reading at its own deadline; one still busy after that is stuck connecting
        long legDeadline = leg.deadlineNanos + TimeUnit.MILLISECONDS.toNanos(LEG_SETTLE_MS);
        long waitUntil = Math.min(legDeadline, overallDeadline);
        try {
            return future.get(Math.max(0, waitUntil - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // Left running without interruption; its connection is reclaimed by pool cleanup
            leg.abandon();
            future.cancel(false);
            if (System.nanoTime() >= overallDeadline) {
                logger.warn("Abandoned query leg for {} at overall timeout", leg.url);
                return leg.outcome(RelayLegOutcome.Status.ABANDONED, "Overall timeout");
            }
            String phase = leg.connecting ? "connecting" : "reading";
            logger.warn("Gave up on {} after per-relay timeout while {}", leg.url, phase);
            return leg.outcome(RelayLegOutcome.Status.TIMEOUT, "Per-relay timeout while " + phase);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Query leg for {} failed", leg.url, cause);
            return leg.outcome(RelayLegOutcome.Status.CONNECTION_LOST, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            leg.abandon();
            return leg.outcome(RelayLegOutcome.Status.ABANDONED, "Interrupted");
        }
    }

    /**
     * Events rejected by verification across every query run by this instance.
     */
    public long getRejectedCount() {
        return rejectedCount.get();
    }

    /**
     * Stop the leg threads if this instance created them.
     */
    public void shutdown() {
        if (ownsExecutor) {
            legExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * One relay's share of a query.
     */
    private class Leg {
        final String url;
        final Filter filter;
        final long deadlineNanos;
        final long startNanos = System.nanoTime();
        final List<Event> events = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger rejected = new AtomicInteger();
        volatile boolean abandoned = false;
        volatile boolean connecting = true;

        Leg(String url, Filter filter, long deadlineNanos) {
            this.url = url;
            this.filter = filter;
            this.deadlineNanos = deadlineNanos;
        }

        RelayLegOutcome run() {
            RelayConnection connection;
            try {
                connection = pool.getConnection(url);
            } catch (ConnectionException e) {
                logger.warn("Skipping {}: {}", url, e.getMessage());
                return outcome(RelayLegOutcome.Status.CONNECT_FAILED, e.getMessage());
            } finally {
                connecting = false;
            }
            if (abandoned) {
                logger.debug("Connected to {} after its leg was given up", url);
                return outcome(RelayLegOutcome.Status.ABANDONED, "Connected too late");
            }

            String subscriptionId = ClientMessages.newSubscriptionId("q");
            try {
                connection.subscribe(subscriptionId, Collections.singletonList(filter));
            } catch (ConnectionException e) {
                pool.reportFailure(url, e.getMessage());
                return outcome(RelayLegOutcome.Status.CONNECTION_LOST, e.getMessage());
            }

            try {
                return read(connection, subscriptionId);
            } catch (ConnectionException e) {
                pool.reportFailure(url, e.getMessage());
                logger.warn("Lost {} mid-query after {} event(s): {}", url, events.size(), e.getMessage());
                return outcome(RelayLegOutcome.Status.CONNECTION_LOST, e.getMessage());
            } finally {
                connection.unsubscribe(subscriptionId);
            }
        }

        private RelayLegOutcome read(RelayConnection connection, String subscriptionId) throws ConnectionException {
            while (!abandoned) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0) {
                    break;
                }
                RelayMessage message = connection.receive(subscriptionId, remainingMs);
                if (message == null) {
                    break;
                }
                switch (message.getType()) {
                    case EVENT:
                        accept(((RelayMessage.EventMessage) message).getEvent());
                        break;
                    case EOSE:
                        logger.debug("EOSE from {} after {} event(s)", url, events.size());
                        return outcome(RelayLegOutcome.Status.EOSE, null);
                    case CLOSED:
                        String reason = ((RelayMessage.ClosedMessage) message).getMessage();
                        logger.info("Relay {} closed query subscription: {}", url, reason);
                        return outcome(RelayLegOutcome.Status.CLOSED, reason);
                    default:
                        break;
                }
            }
            if (abandoned) {
                return outcome(RelayLegOutcome.Status.ABANDONED, "Overall timeout");
            }
            logger.debug("Timed out waiting for EOSE from {}", url);
            return outcome(RelayLegOutcome.Status.TIMEOUT, null);
        }

        private void accept(Event event) {
            EventVerifier.Outcome check = EventVerifier.check(event);
            if (!check.isValid()) {
                rejected.incrementAndGet();
                rejectedCount.incrementAndGet();
                logger.debug("Rejected event {} from {}: {}", event.getShortId(), url, check);
                return;
            }
            if (!abandoned) {
                events.add(event);
            }
        }

        void abandon() {
            abandoned = true;
        }

        List<Event> snapshot() {
            synchronized (events) {
                return new ArrayList<>(events);
            }
        }

        RelayLegOutcome outcome(RelayLegOutcome.Status status, String message) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return new RelayLegOutcome(url, status, events.size(), rejected.get(), elapsedMs, message);
        }
    }

    private static class LegThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "fanout-leg-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
