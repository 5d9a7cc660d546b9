/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.websocket;

import com.wellcast.server.gateway.ClientChannel;
import com.wellcast.server.gateway.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}. Writes go
 * through a {@link ConcurrentWebSocketSessionDecorator}, so a slow client
 * whose buffer overflows or whose send stalls past the time limit is
 * terminated instead of blocking fan-out for everyone else.
 */
public class WebSocketClientChannel implements ClientChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientChannel.class);

    private final WebSocketSession session;

    public WebSocketClientChannel(WebSocketSession session, int sendTimeLimitMs, int sendBufferSize) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSize,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void sendPing() throws IOException {
        session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) return;
        try {
            session.close(new CloseStatus(reason.getCode(), reason.getDescription()));
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() { return session.isOpen(); }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = session.getRemoteAddress();
        return address != null ? address.toString() : "unknown";
    }
}
