/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellcast.common.topic.ReadingTopics;

import java.time.Instant;

/**
 * One telemetry sample produced by a field-device adapter. Immutable; this
 * subsystem only ever reads it.
 */
public record Reading(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("well_id") String wellId,
        @JsonProperty("source_connection_id") String sourceConnectionId,
        @JsonProperty("tag_name") String tagName,
        @JsonProperty("value") double value,
        @JsonProperty("quality") Quality quality,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("source_protocol") String sourceProtocol) {

    /** Broker topic this reading is published on. */
    public String topic() {
        return ReadingTopics.topicFor(tenantId);
    }
}
