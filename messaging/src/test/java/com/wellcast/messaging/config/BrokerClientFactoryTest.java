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
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BrokerClientFactoryTest {

    @Test
    void parsesTypeNamesLeniently() {
        assertThat(BrokerSettings.parseType("in-memory")).isEqualTo(BrokerSettings.BrokerType.IN_MEMORY);
        assertThat(BrokerSettings.parseType(" ActiveMQ ")).isEqualTo(BrokerSettings.BrokerType.ACTIVEMQ);
        assertThat(BrokerSettings.parseType("")).isEqualTo(BrokerSettings.BrokerType.IN_MEMORY);
    }

    @Test
    void createsClientForEachType() {
        try (BrokerClient c = BrokerClientFactory.create(new BrokerSettings(BrokerSettings.BrokerType.IN_MEMORY, null))) {
            assertThat(c).isInstanceOf(InMemoryBrokerClient.class);
        }
        try (BrokerClient c = BrokerClientFactory.create(new BrokerSettings(BrokerSettings.BrokerType.ACTIVEMQ,
                Map.of("broker_url", "tcp://localhost:61616")))) {
            assertThat(c).isInstanceOf(ActiveMQBrokerClient.class);
            assertThat(c.isConnected()).isFalse();
        }
        try (BrokerClient c = BrokerClientFactory.create(new BrokerSettings(BrokerSettings.BrokerType.KAFKA, Map.of()))) {
            assertThat(c).isInstanceOf(KafkaBrokerClient.class);
        }
    }
}
