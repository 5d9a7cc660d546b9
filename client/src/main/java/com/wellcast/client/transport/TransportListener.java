/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client.transport;

/**
 * Events from an open transport session.
 */
public interface TransportListener {

    /** One complete text frame. */
    void onText(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
