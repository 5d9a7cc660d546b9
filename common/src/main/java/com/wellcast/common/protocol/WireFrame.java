/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.protocol;

import com.wellcast.common.util.JsonUtil;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON frame on the client connection: {@code {"type": "...", "data": {...}}}.
 *
 * <p>For client frames the payload fields may also be given at top level
 * ({@code {"type":"subscribe-well","well_id":"w1"}}); {@link #parse} folds them
 * into {@code data}.</p>
 */
public record WireFrame(String type, Map<String, Object> data) {

    public WireFrame {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static WireFrame of(String type, Map<String, Object> data) {
        return new WireFrame(type, data);
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object with a string {@code type}
     */
    @SuppressWarnings("unchecked")
    public static WireFrame parse(String json) {
        Map<String, Object> raw = JsonUtil.toMap(json);
        Object type = raw.get("type");
        if (!(type instanceof String t) || t.isBlank()) {
            throw new IllegalArgumentException("Frame has no 'type'");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (!"type".equals(k) && !"data".equals(k)) data.put(k, v);
        });
        Object nested = raw.get("data");
        if (nested instanceof Map<?, ?> m) {
            data.putAll((Map<String, Object>) m);
        } else if (nested != null) {
            throw new IllegalArgumentException("Frame 'data' must be an object");
        }
        return new WireFrame(t, data);
    }

    /** String field from data, or null when absent or blank. */
    public String text(String field) {
        Object v = data.get(field);
        if (v == null) return null;
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? null : s;
    }

    public String toJson() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type);
        out.put("data", data);
        return JsonUtil.toJson(out);
    }
}
