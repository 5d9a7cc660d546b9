/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.server.auth.AuthenticatedPrincipal;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client socket as seen by the gateway: identity, lifecycle state, heartbeat
 * bookkeeping and the wells it subscribed to (empty means tenant-wide).
 *
 * <p>The identity is assigned once by {@link #authenticate} and never changes.</p>
 */
public class ClientConnection {

    private final String connectionId;
    private final ClientChannel channel;
    private final Instant createdAt;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.HANDSHAKING);
    private volatile AuthenticatedPrincipal principal;
    private volatile Instant lastHeartbeat;
    private final AtomicBoolean activitySinceTick = new AtomicBoolean(true);
    private final AtomicInteger missedHeartbeats = new AtomicInteger();
    private final Set<String> subscribedWells = ConcurrentHashMap.newKeySet();

    public ClientConnection(String connectionId, ClientChannel channel, Instant createdAt) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.createdAt = createdAt;
        this.lastHeartbeat = createdAt;
    }

    /**
     * HANDSHAKING to AUTHENTICATED, binding the identity.
     *
     * @return false if the connection already left HANDSHAKING
     */
    boolean authenticate(AuthenticatedPrincipal authenticated) {
        synchronized (this) {
            if (principal != null || state.get() != SessionState.HANDSHAKING) return false;
            principal = authenticated;
        }
        return state.compareAndSet(SessionState.HANDSHAKING, SessionState.AUTHENTICATED);
    }

    boolean transition(SessionState from, SessionState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Move to CLOSING from any earlier state.
     *
     * @return true for exactly one caller
     */
    boolean beginClosing() {
        while (true) {
            SessionState current = state.get();
            if (current == SessionState.CLOSING || current == SessionState.CLOSED) return false;
            if (state.compareAndSet(current, SessionState.CLOSING)) return true;
        }
    }

    void markClosed() {
        subscribedWells.clear();
        state.set(SessionState.CLOSED);
    }

    void recordActivity(Instant now) {
        lastHeartbeat = now;
        activitySinceTick.set(true);
    }

    /**
     * Advance the heartbeat clock by one interval.
     *
     * @return consecutive intervals without inbound activity
     */
    int heartbeatTick() {
        if (activitySinceTick.getAndSet(false)) {
            missedHeartbeats.set(0);
            return 0;
        }
        return missedHeartbeats.incrementAndGet();
    }

    Set<String> wells() { return subscribedWells; }

    public String getConnectionId() { return connectionId; }
    public ClientChannel getChannel() { return channel; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastHeartbeat() { return lastHeartbeat; }
    public SessionState getState() { return state.get(); }
    public boolean isActive() { return state.get() == SessionState.ACTIVE; }
    public AuthenticatedPrincipal getPrincipal() { return principal; }
    public String getTenantId() { return principal != null ? principal.tenantId() : null; }
    public String getUserId() { return principal != null ? principal.userId() : null; }
    public String getRole() { return principal != null ? principal.role() : null; }
    public Set<String> getSubscribedWells() { return Set.copyOf(subscribedWells); }
    public int getMissedHeartbeats() { return missedHeartbeats.get(); }

    @Override
    public String toString() {
        return "ClientConnection{id=" + connectionId + ", tenant=" + getTenantId()
                + ", user=" + getUserId() + ", state=" + state.get() + "}";
    }
}
