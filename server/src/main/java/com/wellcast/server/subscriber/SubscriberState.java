/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.subscriber;

public enum SubscriberState {
    STOPPED,
    SUBSCRIBED,
    RECONNECTING,
    /** Reconnect attempts exhausted; needs operator attention. */
    FAILED
}
