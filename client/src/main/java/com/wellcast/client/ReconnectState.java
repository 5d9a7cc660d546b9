/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client;

public enum ReconnectState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
