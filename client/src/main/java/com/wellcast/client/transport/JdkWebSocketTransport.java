/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * {@link ClientTransport} over the JDK's {@link java.net.http.WebSocket}. The
 * bearer token is fetched on every connect, so a refreshed token is picked up
 * by the next reconnect.
 */
public class JdkWebSocketTransport implements ClientTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final URI endpoint;
    private final Supplier<String> tokenSupplier;
    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(URI endpoint, Supplier<String> tokenSupplier, HttpClient httpClient,
                                 Duration connectTimeout) {
        this.endpoint = endpoint;
        this.tokenSupplier = tokenSupplier;
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    public JdkWebSocketTransport(URI endpoint, Supplier<String> tokenSupplier) {
        this(endpoint, tokenSupplier, HttpClient.newHttpClient(), Duration.ofSeconds(10));
    }

    @Override
    public CompletableFuture<TransportSession> connect(TransportListener listener) {
        log.debug("Opening WebSocket to {}", endpoint);
        return httpClient.newWebSocketBuilder()
                .header("Authorization", "Bearer " + tokenSupplier.get())
                .connectTimeout(connectTimeout)
                .buildAsync(endpoint, new Adapter(listener))
                .thenApply(Session::new);
    }

    /** Reassembles partial text messages and forwards events. */
    private static final class Adapter implements WebSocket.Listener {

        private final TransportListener listener;
        private final StringBuilder partial = new StringBuilder();

        private Adapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    /** The JDK allows one outstanding send per socket, so sends are chained. */
    private static final class Session implements TransportSession {

        private final WebSocket webSocket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private Session(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            tail = tail.handle((ok, ex) -> null)
                    .thenCompose(v -> webSocket.sendText(text, true))
                    .thenApply(ws -> null);
            return tail;
        }

        @Override
        public void close() {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                    .whenComplete((ws, ex) -> {
                        if (ex != null) {
                            log.debug("Close handshake failed, aborting: {}", ex.getMessage());
                            webSocket.abort();
                        }
                    });
        }
    }
}
