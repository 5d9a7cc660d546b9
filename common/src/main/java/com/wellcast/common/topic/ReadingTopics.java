/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.topic;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives and parses tenant-scoped broker topic names of the form
 * {@code readings:{tenant_id}}.
 */
public final class ReadingTopics {

    public static final String PREFIX = "readings:";

    /** Pattern every gateway subscribes to once at startup. */
    public static final String ALL_TENANTS_PATTERN = PREFIX + "*";

    /** Tenant ids become part of topic names on every transport, so they stay within this set. */
    public static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private ReadingTopics() {}

    public static String topicFor(String tenantId) {
        if (!isValidTenantId(tenantId)) {
            throw new IllegalArgumentException("Invalid tenant id '" + tenantId + "'");
        }
        return PREFIX + tenantId;
    }

    /**
     * Extract the tenant encoded in a topic name; empty when the topic is not a
     * readings topic or carries a malformed tenant.
     */
    public static Optional<String> tenantOf(String topic) {
        if (topic == null || !topic.startsWith(PREFIX)) return Optional.empty();
        String tenant = topic.substring(PREFIX.length());
        return isValidTenantId(tenant) ? Optional.of(tenant) : Optional.empty();
    }

    public static boolean isValidTenantId(String tenantId) {
        return tenantId != null && TENANT_ID.matcher(tenantId).matches();
    }
}
