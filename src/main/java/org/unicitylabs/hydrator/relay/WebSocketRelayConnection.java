package org.unicitylabs.hydrator.relay;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relay connection over an OkHttp WebSocket. OkHttp answers server pings and sends its
 * own pings at the client's configured interval, so keep-alive needs no code here.
 */
public class WebSocketRelayConnection extends AbstractRelayConnection {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketRelayConnection.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final long connectTimeoutMs;

    private volatile WebSocket webSocket;
    private volatile boolean closing = false;

    public WebSocketRelayConnection(String url, OkHttpClient httpClient, long connectTimeoutMs, Clock clock) {
        super(url, clock);
        this.httpClient = httpClient;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    protected void openTransport() throws ConnectionException {
        Request request;
        try {
            request = new Request.Builder().url(url).build();
        } catch (IllegalArgumentException e) {
            throw new ConnectionException(url, "Invalid relay URL", e);
        }

        closing = false;
        CompletableFuture<Void> opened = new CompletableFuture<>();
        logger.debug("Opening WebSocket to {}", url);
        WebSocket socket = httpClient.newWebSocket(request, new Listener(opened));
        webSocket = socket;

        try {
            opened.get(connectTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            socket.cancel();
            throw new ConnectionException(url, "Handshake timed out after " + connectTimeoutMs + "ms", e);
        } catch (ExecutionException e) {
            socket.cancel();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectionException(url, "Handshake failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            socket.cancel();
            Thread.currentThread().interrupt();
            throw new ConnectionException(url, "Interrupted during handshake", e);
        }
    }

    @Override
    protected boolean sendText(String text) {
        WebSocket socket = webSocket;
        return socket != null && socket.send(text);
    }

    @Override
    protected void closeTransport() {
        closing = true;
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "Client disconnect");
        }
    }

    private class Listener extends WebSocketListener {
        private final CompletableFuture<Void> opened;

        Listener(CompletableFuture<Void> opened) {
            this.opened = opened;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            deliver(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            if (!closing) {
                connectionLost("Relay closed connection (code " + code + (reason.isEmpty() ? "" : ": " + reason) + ")");
            }
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (!opened.isDone()) {
                opened.completeExceptionally(t);
                return;
            }
            if (closing) {
                // EOF after our own close is the normal shutdown path
                logger.debug("WebSocket closed during disconnect: {}", url);
                return;
            }
            if (t instanceof EOFException) {
                connectionLost("Connection closed unexpectedly");
            } else {
                connectionLost(t.getClass().getSimpleName() + ": " + t.getMessage());
            }
        }
    }
}
