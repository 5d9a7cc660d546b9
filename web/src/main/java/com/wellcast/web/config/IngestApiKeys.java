/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.List;

/**
 * API keys accepted from protocol adapters on the ingestion endpoints
 * ({@code X-API-Key} header).
 */
@Component
public class IngestApiKeys {

    public static final String HEADER = "X-API-Key";

    private final List<byte[]> keys;

    public IngestApiKeys(@Value("${wellcast.ingest.api-keys:}") String[] configured) {
        this.keys = Arrays.stream(configured)
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .map(k -> k.getBytes(StandardCharsets.UTF_8))
                .toList();
    }

    public boolean isValid(String presented) {
        if (presented == null || presented.isBlank()) return false;
        byte[] candidate = presented.trim().getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : keys) {
            // constant-time compare
            match |= MessageDigest.isEqual(key, candidate);
        }
        return match;
    }

    public int size() { return keys.size(); }
}
