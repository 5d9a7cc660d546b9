/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.exception.SocketWriteException;
import com.wellcast.common.model.Reading;
import com.wellcast.common.protocol.FrameTypes;
import com.wellcast.common.protocol.WireFrame;
import com.wellcast.server.auth.AuthenticatedPrincipal;
import com.wellcast.server.auth.TokenVerifier;
import com.wellcast.server.dispatch.ReadingDispatcher;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.subscriber.ReadingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the client sockets of this gateway process and drives each through
 * HANDSHAKING, AUTHENTICATED, ACTIVE, CLOSING and CLOSED.
 *
 * <p>The transport layer reports events ({@link #open}, {@link #onText},
 * {@link #onPong}, {@link #onTransportClosed}); the gateway answers through the
 * connection's {@link ClientChannel}. As the subscriber's {@link ReadingSink} it
 * also fans readings out to the recipients chosen by the dispatcher, writing to
 * each socket independently on the fan-out executor.</p>
 */
public class GatewayService implements ReadingSink {

    private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

    private final ConnectionRegistry registry;
    private final ReadingDispatcher dispatcher;
    private final TokenVerifier tokenVerifier;
    private final GatewaySettings settings;
    private final GatewayMetrics metrics;
    private final Executor fanoutExecutor;
    private final Clock clock;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public GatewayService(ConnectionRegistry registry, ReadingDispatcher dispatcher, TokenVerifier tokenVerifier,
                          GatewaySettings settings, GatewayMetrics metrics, Executor fanoutExecutor, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.tokenVerifier = tokenVerifier;
        this.settings = settings;
        this.metrics = metrics;
        this.fanoutExecutor = fanoutExecutor;
        this.clock = clock;
    }

    // ─── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Accept a new socket and start verifying its bearer token. The returned
     * connection is still HANDSHAKING; it becomes ACTIVE asynchronously.
     */
    public ClientConnection open(ClientChannel channel, String bearerToken) {
        ClientConnection connection = new ClientConnection(UUID.randomUUID().toString(), channel, clock.instant());
        connections.put(connection.getConnectionId(), connection);
        metrics.connectionOpened();
        log.debug("Connection {} opened from {}", connection.getConnectionId(), channel.remoteAddress());

        if (bearerToken == null || bearerToken.isBlank()) {
            rejectHandshake(connection, "missing", "Missing bearer token");
            return connection;
        }

        CompletableFuture<AuthenticatedPrincipal> verification;
        try {
            verification = tokenVerifier.verify(bearerToken);
        } catch (RuntimeException e) {
            verification = CompletableFuture.failedFuture(e);
        }
        verification
                .orTimeout(settings.getAuthTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((principal, ex) -> {
                    if (ex == null) {
                        activate(connection, principal);
                    } else {
                        authenticationFailed(connection, ex);
                    }
                });
        return connection;
    }

    private void activate(ClientConnection connection, AuthenticatedPrincipal principal) {
        if (!connection.authenticate(principal)) {
            log.debug("Connection {} closed before authentication completed", connection.getConnectionId());
            return;
        }
        String id = connection.getConnectionId();
        try {
            registry.addConnection(principal.tenantId(), id);
        } catch (IllegalStateException e) {
            log.error("Connection {} could not be registered", id, e);
            close(connection, CloseReason.TRANSPORT_ERROR);
            return;
        }
        if (!connection.transition(SessionState.AUTHENTICATED, SessionState.ACTIVE)) {
            // closed while registering; the close path may have run before the add
            registry.removeConnection(id);
            return;
        }
        log.info("Connection {} active (tenant={}, user={}, role={})",
                id, principal.tenantId(), principal.userId(), principal.role());
        sendFrame(connection, GatewayFrames.connected(principal.tenantId(), clock.instant()));
    }

    private void authenticationFailed(ClientConnection connection, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            rejectHandshake(connection, "timeout", "Authentication timed out");
        } else if (cause instanceof AuthenticationException) {
            rejectHandshake(connection, "invalid", cause.getMessage());
        } else {
            log.error("Token verification failed for connection {}", connection.getConnectionId(), cause);
            rejectHandshake(connection, "error", "Authentication unavailable");
        }
    }

    private void rejectHandshake(ClientConnection connection, String reason, String message) {
        if (connection.getState() != SessionState.HANDSHAKING) return;
        metrics.authFailure(reason);
        log.warn("Handshake rejected for connection {} from {}: {}",
                connection.getConnectionId(), connection.getChannel().remoteAddress(), message);
        try {
            connection.getChannel().send(GatewayFrames.error(FrameTypes.AUTH_FAILED, message));
        } catch (IOException | RuntimeException e) {
            log.debug("Could not deliver AUTH_FAILED to {}: {}", connection.getConnectionId(), e.getMessage());
        }
        close(connection, CloseReason.AUTH_FAILED);
    }

    /**
     * Tear a connection down. Only the first call for a connection has any effect.
     */
    public void close(ClientConnection connection, CloseReason reason) {
        if (!connection.beginClosing()) return;
        String id = connection.getConnectionId();
        registry.removeConnection(id);
        connections.remove(id, connection);
        try {
            connection.getChannel().close(reason);
        } catch (RuntimeException e) {
            log.debug("Error closing socket of connection {}: {}", id, e.getMessage());
        }
        connection.markClosed();
        metrics.connectionClosed(reason.tag());
        log.info("Connection {} closed: {}", id, reason.getDescription());
    }

    /** The transport noticed the socket is gone. */
    public void onTransportClosed(ClientConnection connection, boolean error) {
        close(connection, error ? CloseReason.TRANSPORT_ERROR : CloseReason.CLIENT_CLOSED);
    }

    /** Close every connection, e.g. on server shutdown. */
    public void shutdown() {
        List<ClientConnection> open = List.copyOf(connections.values());
        log.info("Closing {} client connection(s)", open.size());
        for (ClientConnection connection : open) {
            close(connection, CloseReason.SHUTDOWN);
        }
    }

    // ─── Inbound ───────────────────────────────────────────────────────────

    public void onText(ClientConnection connection, String text) {
        SessionState state = connection.getState();
        if (state == SessionState.CLOSING || state == SessionState.CLOSED) return;
        connection.recordActivity(clock.instant());

        WireFrame frame;
        try {
            frame = WireFrame.parse(text);
        } catch (IllegalArgumentException e) {
            sendFrame(connection, GatewayFrames.error(FrameTypes.INVALID_FRAME, "Malformed frame"));
            return;
        }

        switch (frame.type()) {
            case FrameTypes.PING -> sendFrame(connection, GatewayFrames.pong(clock.instant()));
            case FrameTypes.SUBSCRIBE_WELL -> onSubscribe(connection, frame, true);
            case FrameTypes.UNSUBSCRIBE_WELL -> onSubscribe(connection, frame, false);
            default -> sendFrame(connection,
                    GatewayFrames.error(FrameTypes.INVALID_FRAME, "Unknown frame type '" + frame.type() + "'"));
        }
    }

    public void onPong(ClientConnection connection) {
        connection.recordActivity(clock.instant());
    }

    private void onSubscribe(ClientConnection connection, WireFrame frame, boolean subscribe) {
        if (!connection.isActive()) {
            sendFrame(connection, GatewayFrames.error(FrameTypes.NOT_ACTIVE, "Connection is not active yet"));
            return;
        }
        String wellId = frame.text("well_id");
        if (wellId == null) {
            sendFrame(connection, GatewayFrames.error(FrameTypes.INVALID_FRAME, "well_id is required"));
            return;
        }
        String id = connection.getConnectionId();
        if (subscribe) {
            registry.subscribeWell(id, wellId);
            connection.wells().add(wellId);
            log.debug("Connection {} subscribed to well {}", id, wellId);
            sendFrame(connection, GatewayFrames.subscribed(wellId, clock.instant()));
        } else {
            registry.unsubscribeWell(id, wellId);
            connection.wells().remove(wellId);
            log.debug("Connection {} unsubscribed from well {}", id, wellId);
            sendFrame(connection, GatewayFrames.unsubscribed(wellId, clock.instant()));
        }
    }

    // ─── Fan-out ───────────────────────────────────────────────────────────

    @Override
    public void onReading(Reading reading) {
        long start = System.nanoTime();
        Set<String> recipients = dispatcher.recipientsFor(reading);
        if (recipients.isEmpty()) return;

        String frame = GatewayFrames.reading(reading);
        for (String id : recipients) {
            ClientConnection connection = connections.get(id);
            if (connection == null || !connection.isActive()) continue;
            if (!reading.tenantId().equals(connection.getTenantId())) {
                log.error("Registry routed tenant {} reading to connection {} of tenant {}; skipped",
                        reading.tenantId(), id, connection.getTenantId());
                continue;
            }
            try {
                fanoutExecutor.execute(() -> deliver(connection, frame));
            } catch (RejectedExecutionException e) {
                log.warn("Fan-out executor rejected delivery to {}: {}", id, e.getMessage());
            }
        }
        metrics.recordFanout(System.nanoTime() - start);
    }

    private void deliver(ClientConnection connection, String frame) {
        if (!connection.isActive()) return;
        if (sendFrame(connection, frame)) {
            metrics.readingDelivered();
        }
    }

    /**
     * Write one frame; a failed write closes only this connection.
     *
     * @return true if the frame was handed to the socket
     */
    private boolean sendFrame(ClientConnection connection, String frame) {
        try {
            connection.getChannel().send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            SocketWriteException failure = new SocketWriteException(connection.getConnectionId(), e);
            metrics.socketWriteFailed();
            log.warn("{}: {}", failure.getMessage(), e.getMessage());
            close(connection, CloseReason.TRANSPORT_ERROR);
            return false;
        }
    }

    // ─── Heartbeats ────────────────────────────────────────────────────────

    /**
     * One heartbeat interval elapsed: count a miss for every active connection
     * silent since the previous tick, close the ones over the limit and ping the rest.
     */
    public void checkHeartbeats() {
        for (ClientConnection connection : connections.values()) {
            if (!connection.isActive()) continue;
            int missed = connection.heartbeatTick();
            if (missed >= settings.getMaxMissedHeartbeats()) {
                log.info("Connection {} missed {} heartbeats", connection.getConnectionId(), missed);
                close(connection, CloseReason.HEARTBEAT_TIMEOUT);
                continue;
            }
            try {
                connection.getChannel().sendPing();
            } catch (IOException | RuntimeException e) {
                metrics.socketWriteFailed();
                log.warn("Ping to connection {} failed: {}", connection.getConnectionId(), e.getMessage());
                close(connection, CloseReason.TRANSPORT_ERROR);
            }
        }
    }

    // ─── Queries ───────────────────────────────────────────────────────────

    public Collection<ClientConnection> getConnections() {
        return List.copyOf(connections.values());
    }

    public int getLocalConnectionCount() { return connections.size(); }

    public GatewaySettings getSettings() { return settings; }
}
