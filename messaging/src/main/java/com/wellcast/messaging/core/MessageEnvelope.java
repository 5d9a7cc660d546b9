/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

import java.time.Instant;

/**
 * A message as delivered by the pub/sub layer: the concrete topic it arrived on
 * and its raw text payload.
 */
public final class MessageEnvelope {

    private final String topic;
    private final String payload;
    private final Instant receivedAt;

    public MessageEnvelope(String topic, String payload) {
        this.topic = topic;
        this.payload = payload;
        this.receivedAt = Instant.now();
    }

    public String getTopic() { return topic; }
    public String getPayload() { return payload; }
    public Instant getReceivedAt() { return receivedAt; }

    @Override
    public String toString() {
        return "MessageEnvelope{topic='" + topic + "', bytes=" + (payload == null ? 0 : payload.length()) + "}";
    }
}
