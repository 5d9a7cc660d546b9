/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

/**
 * Notified on every broker connection state change. {@code cause} is non-null
 * only when the change was triggered by a transport failure.
 */
@FunctionalInterface
public interface BrokerStateListener {
    void onStateChange(ConnectionState newState, Throwable cause);
}
