/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

/**
 * Callback interface for receiving messages from a pattern subscription.
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface MessageListener {
    /**
     * Called when a message arrives on a topic matching the subscribed pattern.
     * @param envelope the message envelope
     */
    void onMessage(MessageEnvelope envelope);
}
