/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.config;

import com.wellcast.messaging.activemq.ActiveMQBrokerClient;
import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.messaging.inmemory.InMemoryBrokerClient;
import com.wellcast.messaging.kafka.KafkaBrokerClient;

/**
 * Factory to create a BrokerClient based on BrokerSettings.
 * Supports: in-process, ActiveMQ, Kafka.
 */
public final class BrokerClientFactory {

    private BrokerClientFactory() {}

    public static BrokerClient create(BrokerSettings settings) {
        return switch (settings.getBrokerType()) {
            case IN_MEMORY -> InMemoryBrokerClient.standalone();
            case ACTIVEMQ -> new ActiveMQBrokerClient(settings.getProperties());
            case KAFKA -> new KafkaBrokerClient(settings.getProperties());
        };
    }
}
