/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client;

import com.wellcast.common.model.Reading;

/**
 * Callbacks from a {@link ReconnectManager}, delivered in order on its event thread.
 */
public interface ClientListener {

    void onReading(Reading reading);

    default void onStateChange(ReconnectState previous, ReconnectState current) {}

    /** An error frame from the gateway. */
    default void onError(String code, String message) {}
}
