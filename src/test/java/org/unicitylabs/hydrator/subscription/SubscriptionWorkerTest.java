package org.unicitylabs.hydrator.subscription;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.protocol.TestEvents;
import org.unicitylabs.hydrator.relay.RelayConnection;
import org.unicitylabs.hydrator.relay.RelayConnectionPool;
import org.unicitylabs.hydrator.relay.ScriptedRelayConnection;
import org.unicitylabs.hydrator.relay.ScriptedRelayConnectionFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.*;

/**
 * Unit tests for the live subscription loop, driven by scripted relays.
 */
public class SubscriptionWorkerTest {

    private static final String RELAY = "wss://live";

    private final Filter filter = Filter.builder().kinds(EventKinds.TEXT_NOTE).build();

    private ScriptedRelayConnectionFactory factory;
    private RelayConnectionPool pool;
    private SubscriptionWorker worker;
    private Thread workerThread;
    private final List<String> received = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        factory = new ScriptedRelayConnectionFactory();
        pool = new RelayConnectionPool(factory);
        worker = new SubscriptionWorker(pool);
        worker.setReceiveTimeoutMs(50);
        worker.setBackoffMs(20);
    }

    @After
    public void tearDown() throws InterruptedException {
        worker.shutdown();
        if (workerThread != null) {
            workerThread.join(5000);
        }
        pool.close();
    }

    @Test
    public void testDeliversStoredAndLiveEvents() throws Exception {
        Event stored = TestEvents.note("stored");
        Event live = TestEvents.note("live");
        ScriptedRelayConnection relay = factory.enqueue(RELAY).withEvents(stored);
        List<String> eoseIds = new CopyOnWriteArrayList<>();

        start(new EventHandler() {
            @Override
            public void onEvent(Event event, String relayUrl) {
                received.add(event.getId());
            }

            @Override
            public void onEndOfStoredEvents(String subscriptionId) {
                eoseIds.add(subscriptionId);
            }
        });

        waitFor(() -> eoseIds.size() == 1);
        assertEquals(worker.getSubscriptionId(), eoseIds.get(0));
        assertTrue(eoseIds.get(0).startsWith("live-"));

        relay.push(ScriptedRelayConnection.frame("EVENT", worker.getSubscriptionId(), live));
        waitFor(() -> received.size() == 2);

        assertEquals(stored.getId(), received.get(0));
        assertEquals(live.getId(), received.get(1));
        assertEquals(2, worker.getDeliveredCount());
        assertEquals(WorkerState.RECEIVING, worker.getState());
    }

    @Test
    public void testReconnectsWithFreshSubscriptionAfterDrop() throws Exception {
        Event before = TestEvents.note("before drop");
        Event after = TestEvents.note("after drop");
        ScriptedRelayConnection first = factory.enqueue(RELAY).withEvents(before).droppingAfterEvents();
        ScriptedRelayConnection second = factory.enqueue(RELAY).withEvents(after).withoutEose();

        start(collecting());
        waitFor(() -> received.size() == 2);

        assertEquals(before.getId(), received.get(0));
        assertEquals(after.getId(), received.get(1));
        assertEquals(1, worker.getReconnectCount());

        String firstSubId = subscriptionIdOf(first.getSent().get(0));
        String secondSubId = subscriptionIdOf(second.getSent().get(0));
        assertNotEquals(firstSubId, secondSubId);
        assertEquals(secondSubId, worker.getSubscriptionId());
    }

    @Test
    public void testRetriesUntilRelayComesUp() throws Exception {
        Event event = TestEvents.note("eventually");

        start(collecting());
        waitFor(() -> worker.getReconnectCount() >= 2);
        assertTrue(received.isEmpty());

        factory.enqueue(RELAY).withEvents(event);
        waitFor(() -> received.size() == 1);
        assertEquals(event.getId(), received.get(0));
    }

    @Test
    public void testHandlerFailureDoesNotStopStream() throws Exception {
        Event poison = TestEvents.note("poison");
        Event fine = TestEvents.note("fine");
        factory.enqueue(RELAY).withEvents(poison, fine);

        start((event, relayUrl) -> {
            if (event.getId().equals(poison.getId())) {
                throw new IllegalStateException("handler blew up");
            }
            received.add(event.getId());
        });
        waitFor(() -> received.size() == 1);

        assertEquals(fine.getId(), received.get(0));
        assertEquals(1, worker.getHandlerErrorCount());
        assertEquals(1, worker.getDeliveredCount());
        assertEquals(0, worker.getReconnectCount());
    }

    @Test
    public void testEndOfStoredEventsFailureDoesNotStopStream() throws Exception {
        Event live = TestEvents.note("live after eose");
        ScriptedRelayConnection relay = factory.enqueue(RELAY);

        start(new EventHandler() {
            @Override
            public void onEvent(Event event, String relayUrl) {
                received.add(event.getId());
            }

            @Override
            public void onEndOfStoredEvents(String subscriptionId) {
                throw new IllegalStateException("eose handler blew up");
            }
        });
        waitFor(() -> worker.getHandlerErrorCount() == 1);

        relay.push(ScriptedRelayConnection.frame("EVENT", worker.getSubscriptionId(), live));
        waitFor(() -> received.size() == 1);

        assertTrue(workerThread.isAlive());
        assertFalse(worker.isStopRequested());
        assertEquals(WorkerState.RECEIVING, worker.getState());
        assertEquals(0, worker.getReconnectCount());
        assertEquals(1, factory.createdCount(RELAY));
    }

    @Test
    public void testForgedEventsAreNotDelivered() throws Exception {
        Event forged = TestEvents.withForeignSignature(TestEvents.note("forged"));
        Event genuine = TestEvents.note("genuine");
        factory.enqueue(RELAY).withEvents(forged, genuine);

        start(collecting());
        waitFor(() -> received.size() == 1);

        assertEquals(genuine.getId(), received.get(0));
        assertEquals(1, worker.getRejectedCount());
    }

    @Test
    public void testRelayClosingSubscriptionEventuallyForcesNewConnection() throws Exception {
        Event event = TestEvents.note("after closed");
        factory.enqueue(RELAY).closingSubscription("error: shutting down");
        factory.enqueue(RELAY).withEvents(event);

        start(collecting());
        waitFor(() -> received.size() == 1);

        assertEquals(event.getId(), received.get(0));
        assertEquals(RelayConnectionPool.MAX_CONSECUTIVE_FAILURES, worker.getReconnectCount());
        assertEquals(2, factory.createdCount(RELAY));
    }

    @Test
    public void testShutdownDuringBackoff() throws Exception {
        worker.setBackoffMs(60_000);
        start(collecting());
        waitFor(() -> worker.getState() == WorkerState.RECONNECTING);

        worker.shutdown();
        workerThread.join(2000);

        assertFalse(workerThread.isAlive());
        assertEquals(WorkerState.STOPPED, worker.getState());
    }

    @Test
    public void testShutdownClosesPooledConnection() throws Exception {
        factory.enqueue(RELAY).withoutEose();
        start(collecting());
        waitFor(() -> worker.getState() == WorkerState.RECEIVING);
        assertTrue(pool.isConnected(RELAY));

        worker.shutdown();
        workerThread.join(2000);

        assertEquals(WorkerState.STOPPED, worker.getState());
        assertFalse(pool.isConnected(RELAY));
    }

    @Test
    public void testShutdownKeepsConnectionUsedByOtherSubscription() throws Exception {
        ScriptedRelayConnection relay = factory.enqueue(RELAY).withoutEose();
        start(collecting());
        waitFor(() -> worker.getState() == WorkerState.RECEIVING);
        String workerSubId = worker.getSubscriptionId();

        RelayConnection shared = pool.getConnection(RELAY);
        assertSame(relay, shared);
        shared.subscribe("other-sub", Collections.singletonList(filter));

        worker.shutdown();
        workerThread.join(2000);

        assertEquals(WorkerState.STOPPED, worker.getState());
        assertTrue(pool.isConnected(RELAY));
        assertEquals(1, shared.getSubscriptionCount());
        assertTrue(relay.getSent().contains("[\"CLOSE\",\"" + workerSubId + "\"]"));
        assertFalse(relay.getSent().contains("[\"CLOSE\",\"other-sub\"]"));
    }

    @Test
    public void testStateTransitionsAreReported() throws Exception {
        List<WorkerState> states = new CopyOnWriteArrayList<>();
        worker.addListener((relayUrl, previous, current) -> states.add(current));
        factory.enqueue(RELAY).withEvents(TestEvents.note("x"));

        start(collecting());
        waitFor(() -> received.size() == 1);
        worker.shutdown();
        workerThread.join(2000);

        List<WorkerState> expected = new ArrayList<>();
        Collections.addAll(expected, WorkerState.SUBSCRIBED, WorkerState.RECEIVING, WorkerState.STOPPED);
        assertEquals(expected, states);
    }

    @Test(expected = IllegalStateException.class)
    public void testWorkerCannotBeStartedTwice() {
        worker.shutdown();
        worker.run(RELAY, filter, collecting());
        assertEquals(WorkerState.STOPPED, worker.getState());

        worker.run(RELAY, filter, collecting());
    }

    private EventHandler collecting() {
        return (event, relayUrl) -> received.add(event.getId());
    }

    private void start(EventHandler handler) {
        workerThread = new Thread(() -> worker.run(RELAY, filter, handler), "worker-under-test");
        workerThread.setDaemon(true);
        workerThread.start();
    }

    private static String subscriptionIdOf(String reqFrame) {
        // ["REQ","live-xxxxxxxxxxxxxxxx",{...}]
        int start = reqFrame.indexOf('"', 6) + 1;
        return reqFrame.substring(start, reqFrame.indexOf('"', start));
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
