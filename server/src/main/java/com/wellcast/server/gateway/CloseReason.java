/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

/**
 * Why the gateway ended a connection, with the WebSocket close code sent to the peer.
 */
public enum CloseReason {
    CLIENT_CLOSED(1000, "Closed by client"),
    AUTH_FAILED(1008, "Authentication failed"),
    HEARTBEAT_TIMEOUT(1001, "Heartbeat timeout"),
    TRANSPORT_ERROR(1011, "Transport error"),
    SHUTDOWN(1001, "Server shutting down");

    private final int code;
    private final String description;

    CloseReason(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() { return code; }
    public String getDescription() { return description; }

    /** Lower-case name, used as a metrics tag. */
    public String tag() { return name().toLowerCase(); }
}
