/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.dispatch;

import com.wellcast.common.model.Reading;
import com.wellcast.server.registry.ConnectionRegistry;

import java.util.Set;

/**
 * Two-tier routing: connections subscribed to the reading's well receive it; if
 * nobody in the tenant subscribed to that well, every connection of the tenant
 * does. Never crosses tenants.
 */
public class ReadingDispatcher {

    private final ConnectionRegistry registry;

    public ReadingDispatcher(ConnectionRegistry registry) {
        this.registry = registry;
    }

    public Set<String> recipientsFor(Reading reading) {
        Set<String> wellSubscribers = registry.wellSubscribers(reading.tenantId(), reading.wellId());
        if (!wellSubscribers.isEmpty()) {
            return wellSubscribers;
        }
        return registry.tenantConnections(reading.tenantId());
    }
}
