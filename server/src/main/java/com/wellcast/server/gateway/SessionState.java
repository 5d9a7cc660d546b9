/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

/**
 * Lifecycle of a client connection. Transitions only move forward.
 */
public enum SessionState {
    HANDSHAKING,
    AUTHENTICATED,
    ACTIVE,
    CLOSING,
    CLOSED
}
