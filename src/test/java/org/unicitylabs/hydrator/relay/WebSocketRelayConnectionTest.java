package org.unicitylabs.hydrator.relay;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.unicitylabs.hydrator.protocol.CanonicalJson;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.protocol.RelayMessage;
import org.unicitylabs.hydrator.protocol.TestEvents;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

/**
 * Tests against a real WebSocket served by MockWebServer.
 */
public class WebSocketRelayConnectionTest {

    private MockWebServer server;
    private WebSocketRelayConnectionFactory factory;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final AtomicReference<WebSocket> serverSocket = new AtomicReference<>();
    private final CountDownLatch serverOpened = new CountDownLatch(1);
    private Event scripted;

    @Before
    public void setUp() throws Exception {
        scripted = TestEvents.note("served over websocket");
        server = new MockWebServer();
        server.start();
        factory = new WebSocketRelayConnectionFactory(5000, 25000, Clock.systemUTC());
    }

    @After
    public void tearDown() throws Exception {
        factory.shutdown();
        server.shutdown();
    }

    private void enqueueRelay() {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                serverSocket.set(webSocket);
                serverOpened.countDown();
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                received.add(text);
                try {
                    JsonNode frame = CanonicalJson.mapper().readTree(text);
                    if ("REQ".equals(frame.get(0).asText())) {
                        String subId = frame.get(1).asText();
                        webSocket.send(ScriptedRelayConnection.frame("EVENT", subId, scripted));
                        webSocket.send(ScriptedRelayConnection.frame("EOSE", subId));
                    }
                } catch (Exception e) {
                    webSocket.close(1011, "bad frame");
                }
            }
        }));
    }

    private String relayUrl() {
        return "ws://" + server.getHostName() + ":" + server.getPort() + "/";
    }

    @Test
    public void testSubscribeReceivesEventsThenEose() throws Exception {
        enqueueRelay();
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.connect();
            assertTrue(connection.isConnected());
            assertTrue(connection.getConnectedAt() > 0);

            connection.subscribe("sub-1", Collections.singletonList(Filter.builder().kinds(1).limit(10).build()));

            RelayMessage first = connection.receive("sub-1", 5000);
            assertNotNull(first);
            assertEquals(RelayMessage.Type.EVENT, first.getType());
            assertEquals(scripted.getId(), ((RelayMessage.EventMessage) first).getEvent().getId());

            RelayMessage second = connection.receive("sub-1", 5000);
            assertEquals(RelayMessage.Type.EOSE, second.getType());

            assertNull(connection.receive("sub-1", 100));
            assertTrue(received.get(0).startsWith("[\"REQ\",\"sub-1\","));
        } finally {
            connection.close();
        }
        assertFalse(connection.isConnected());
    }

    @Test
    public void testConnectIsIdempotent() throws Exception {
        enqueueRelay();
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.connect();
            long connectedAt = connection.getConnectedAt();
            connection.connect();
            assertEquals(connectedAt, connection.getConnectedAt());
            assertEquals(1, server.getRequestCount());
        } finally {
            connection.close();
        }
    }

    @Test
    public void testNoticeGoesToConnectionMailbox() throws Exception {
        enqueueRelay();
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.connect();
            assertTrue(serverOpened.await(5, TimeUnit.SECONDS));
            serverSocket.get().send("[\"NOTICE\",\"ERROR: too many subscriptions\"]");

            RelayMessage message = connection.receive(5000);
            assertNotNull(message);
            assertEquals(RelayMessage.Type.NOTICE, message.getType());
            assertTrue(((RelayMessage.NoticeMessage) message).isError());
        } finally {
            connection.close();
        }
    }

    @Test
    public void testMalformedFramesAreDroppedAndCounted() throws Exception {
        enqueueRelay();
        WebSocketRelayConnection connection = (WebSocketRelayConnection) factory.create(relayUrl());
        try {
            connection.connect();
            assertTrue(serverOpened.await(5, TimeUnit.SECONDS));
            serverSocket.get().send("not json");
            serverSocket.get().send("[\"EVENT\",\"sub-x\",{\"kind\":\"one\"}]");
            serverSocket.get().send("[\"NOTICE\",\"still here\"]");

            RelayMessage message = connection.receive(5000);
            assertNotNull(message);
            assertEquals(RelayMessage.Type.NOTICE, message.getType());
            assertEquals(2, connection.getProtocolErrorCount());
            assertTrue(connection.isConnected());
        } finally {
            connection.close();
        }
    }

    @Test
    public void testServerCloseFailsBlockedReader() throws Exception {
        enqueueRelay();
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.connect();
            assertTrue(serverOpened.await(5, TimeUnit.SECONDS));
            serverSocket.get().close(1001, "going away");

            try {
                connection.receive(5000);
                fail("Expected ConnectionException");
            } catch (ConnectionException e) {
                assertEquals(connection.getUrl(), e.getRelayUrl());
            }
            assertFalse(connection.isConnected());
        } finally {
            connection.close();
        }
    }

    @Test
    public void testSendWhenNotConnectedFails() {
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.send("[\"CLOSE\",\"x\"]");
            fail("Expected NotConnectedException");
        } catch (NotConnectedException e) {
            assertTrue(e.getMessage().contains("Not connected"));
        } finally {
            connection.close();
        }
    }

    @Test
    public void testHandshakeFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        RelayConnection connection = factory.create(relayUrl());
        try {
            connection.connect();
            fail("Expected ConnectionException");
        } catch (ConnectionException e) {
            assertFalse(connection.isConnected());
        } finally {
            connection.close();
        }
    }

    @Test
    public void testUrlIsNormalized() {
        RelayConnection connection = factory.create(" wss://relay.example.com/ ");
        assertEquals("wss://relay.example.com", connection.getUrl());
    }
}
