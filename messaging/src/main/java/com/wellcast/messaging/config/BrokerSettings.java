/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.config;

import java.util.Locale;
import java.util.Map;

/**
 * Which transport to use and its transport-specific properties
 * ({@code broker_url}, {@code bootstrap_servers}, {@code group_id}, ...).
 */
public final class BrokerSettings {

    public enum BrokerType {
        IN_MEMORY, ACTIVEMQ, KAFKA
    }

    private final BrokerType brokerType;
    private final Map<String, Object> properties;

    public BrokerSettings(BrokerType brokerType, Map<String, Object> properties) {
        this.brokerType = brokerType;
        this.properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    /** Lenient parse of a configured type name: {@code in-memory}, {@code activemq}, {@code kafka}. */
    public static BrokerType parseType(String name) {
        if (name == null || name.isBlank()) return BrokerType.IN_MEMORY;
        return BrokerType.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public BrokerType getBrokerType() { return brokerType; }
    public Map<String, Object> getProperties() { return properties; }

    @Override
    public String toString() {
        return "BrokerSettings{type=" + brokerType + ", properties=" + properties.keySet() + "}";
    }
}
