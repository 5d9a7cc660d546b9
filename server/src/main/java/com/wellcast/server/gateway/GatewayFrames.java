/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.common.model.Reading;
import com.wellcast.common.protocol.FrameTypes;
import com.wellcast.common.protocol.WireFrame;
import com.wellcast.common.util.JsonUtil;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-to-client frames.
 */
final class GatewayFrames {

    private GatewayFrames() {}

    static String connected(String tenantId, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tenant_id", tenantId);
        data.put("timestamp", now.toString());
        return WireFrame.of(FrameTypes.CONNECTED, data).toJson();
    }

    static String subscribed(String wellId, Instant now) {
        return wellAck(FrameTypes.SUBSCRIBED, wellId, now);
    }

    static String unsubscribed(String wellId, Instant now) {
        return wellAck(FrameTypes.UNSUBSCRIBED, wellId, now);
    }

    static String pong(Instant now) {
        return WireFrame.of(FrameTypes.PONG, Map.of("timestamp", now.toString())).toJson();
    }

    static String error(String code, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("code", code);
        return WireFrame.of(FrameTypes.ERROR, data).toJson();
    }

    /** Serialized once per reading and shared by every recipient. */
    static String reading(Reading reading) {
        return "{\"type\":\"" + FrameTypes.READING + "\",\"data\":" + JsonUtil.toJson(reading) + "}";
    }

    private static String wellAck(String type, String wellId, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("well_id", wellId);
        data.put("timestamp", now.toString());
        return WireFrame.of(type, data).toJson();
    }
}
