/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.websocket;

import com.wellcast.server.gateway.ClientConnection;
import com.wellcast.server.gateway.GatewayService;
import com.wellcast.server.gateway.GatewaySettings;
import com.wellcast.server.gateway.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for dashboard clients. Each socket is handed to the
 * {@link GatewayService} on open; everything after that (authentication,
 * subscriptions, heartbeats, fan-out) happens there.
 */
@Component
public class ReadingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ReadingWebSocketHandler.class);

    private final GatewayService gateway;
    private final Map<String, ClientConnection> sessions = new ConcurrentHashMap<>();

    public ReadingWebSocketHandler(GatewayService gateway) {
        this.gateway = gateway;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        GatewaySettings settings = gateway.getSettings();
        WebSocketClientChannel channel = new WebSocketClientChannel(session,
                (int) settings.getSendTimeLimit().toMillis(), settings.getSendBufferSize());
        String token = (String) session.getAttributes().get(BearerTokenHandshakeInterceptor.TOKEN_ATTRIBUTE);
        ClientConnection connection = gateway.open(channel, token);
        sessions.put(session.getId(), connection);
        if (connection.getState().compareTo(SessionState.CLOSING) >= 0) {
            // rejected before the put; the close callback may already have fired
            sessions.remove(session.getId(), connection);
        }
        log.debug("WebSocket {} bound to connection {}", session.getId(), connection.getConnectionId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = sessions.get(session.getId());
        if (connection != null) {
            gateway.onText(connection, message.getPayload());
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        ClientConnection connection = sessions.get(session.getId());
        if (connection != null) {
            gateway.onPong(connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        ClientConnection connection = sessions.remove(session.getId());
        if (connection != null) {
            gateway.onTransportClosed(connection, true);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = sessions.remove(session.getId());
        if (connection != null) {
            log.debug("WebSocket {} closed: {}", session.getId(), status);
            gateway.onTransportClosed(connection, false);
        }
    }
}
