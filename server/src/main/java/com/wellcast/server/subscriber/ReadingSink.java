/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.subscriber;

import com.wellcast.common.model.Reading;

/**
 * Receives readings that passed validation and the topic tenant check.
 */
@FunctionalInterface
public interface ReadingSink {
    void onReading(Reading reading);
}
