/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import java.time.Duration;

/**
 * Tunables of the client gateway.
 */
public class GatewaySettings {

    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_MISSED_HEARTBEATS = 3;
    public static final Duration DEFAULT_SEND_TIME_LIMIT = Duration.ofSeconds(10);
    public static final int DEFAULT_SEND_BUFFER_SIZE = 512 * 1024;

    private final Duration authTimeout;
    private final Duration heartbeatInterval;
    private final int maxMissedHeartbeats;
    private final Duration sendTimeLimit;
    private final int sendBufferSize;

    public GatewaySettings(Duration authTimeout, Duration heartbeatInterval, int maxMissedHeartbeats,
                           Duration sendTimeLimit, int sendBufferSize) {
        if (maxMissedHeartbeats < 1) throw new IllegalArgumentException("maxMissedHeartbeats must be >= 1");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        this.authTimeout = authTimeout;
        this.heartbeatInterval = heartbeatInterval;
        this.maxMissedHeartbeats = maxMissedHeartbeats;
        this.sendTimeLimit = sendTimeLimit;
        this.sendBufferSize = sendBufferSize;
    }

    public static GatewaySettings defaults() {
        return new GatewaySettings(DEFAULT_AUTH_TIMEOUT, DEFAULT_HEARTBEAT_INTERVAL,
                DEFAULT_MAX_MISSED_HEARTBEATS, DEFAULT_SEND_TIME_LIMIT, DEFAULT_SEND_BUFFER_SIZE);
    }

    public Duration getAuthTimeout() { return authTimeout; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public int getMaxMissedHeartbeats() { return maxMissedHeartbeats; }
    public Duration getSendTimeLimit() { return sendTimeLimit; }
    public int getSendBufferSize() { return sendBufferSize; }
}
