/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.common.protocol.WireFrame;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ClientChannel} that records what the gateway wrote.
 */
class RecordingChannel implements ClientChannel {

    final List<String> sent = new CopyOnWriteArrayList<>();
    final AtomicInteger pings = new AtomicInteger();
    final AtomicInteger closeCalls = new AtomicInteger();
    volatile CloseReason closedWith;
    volatile boolean failWrites;

    @Override
    public void send(String frame) throws IOException {
        if (failWrites) throw new IOException("Broken pipe");
        sent.add(frame);
    }

    @Override
    public void sendPing() throws IOException {
        if (failWrites) throw new IOException("Broken pipe");
        pings.incrementAndGet();
    }

    @Override
    public void close(CloseReason reason) {
        closeCalls.incrementAndGet();
        if (closedWith == null) closedWith = reason;
    }

    @Override
    public boolean isOpen() { return closedWith == null; }

    @Override
    public String remoteAddress() { return "127.0.0.1:50000"; }

    List<WireFrame> frames() {
        return sent.stream().map(WireFrame::parse).toList();
    }

    List<WireFrame> framesOfType(String type) {
        return frames().stream().filter(f -> f.type().equals(type)).toList();
    }

    WireFrame last() {
        List<WireFrame> all = frames();
        return all.get(all.size() - 1);
    }
}
