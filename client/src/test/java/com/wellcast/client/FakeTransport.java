/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client;

import com.wellcast.client.transport.ClientTransport;
import com.wellcast.client.transport.TransportListener;
import com.wellcast.client.transport.TransportSession;
import com.wellcast.common.protocol.WireFrame;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable transport: each connect opens a {@link FakeSession} unless the next
 * attempt is set to fail or to throw.
 */
class FakeTransport implements ClientTransport {

    final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    volatile boolean refuse;
    /** 1-based connect attempt that throws instead of returning a future; 0 for none. */
    volatile int throwOnAttempt;

    @Override
    public CompletableFuture<TransportSession> connect(TransportListener listener) {
        if (throwOnAttempt == sessions.size() + 1) {
            sessions.add(null);
            throw new IllegalStateException("token refresh failed");
        }
        if (refuse) {
            sessions.add(null);
            return CompletableFuture.failedFuture(new ConnectException("Connection refused"));
        }
        FakeSession session = new FakeSession(listener);
        sessions.add(session);
        return CompletableFuture.completedFuture(session);
    }

    int attempts() { return sessions.size(); }

    FakeSession latest() { return sessions.get(sessions.size() - 1); }

    static final class FakeSession implements TransportSession {

        final TransportListener listener;
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        FakeSession(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close() { closed = true; }

        /** Wells named in subscribe-well frames, in send order. */
        List<String> subscribedWells() {
            return sent.stream().map(WireFrame::parse)
                    .filter(f -> f.type().equals("subscribe-well"))
                    .map(f -> f.text("well_id"))
                    .toList();
        }

        void serverSends(String frameJson) { listener.onText(frameJson); }

        void serverConfirms() { serverSends("{\"type\":\"connected\",\"data\":{\"tenant_id\":\"t1\"}}"); }

        void drop() { listener.onClosed(1006, "abnormal closure"); }
    }
}
