/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Wildcard matching and native-name mapping for logical topic names.
 *
 * <p>Logical topics use {@code :} between the prefix and the tenant
 * ({@code readings:t1}); transports that disallow {@code :} use their own
 * separator ({@code readings.t1}). In patterns {@code *} matches any run of
 * characters.</p>
 */
public final class TopicPatterns {

    public static final char LOGICAL_SEPARATOR = ':';

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private TopicPatterns() {}

    public static boolean matches(String pattern, String topic) {
        if (pattern == null || topic == null) return false;
        if (pattern.indexOf('*') < 0) return pattern.equals(topic);
        return COMPILED.computeIfAbsent(pattern, TopicPatterns::globToRegex).matcher(topic).matches();
    }

    /** Regex equivalent of a wildcard pattern, quoting everything except {@code *}. */
    public static Pattern globToRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            if (star > start) regex.append(Pattern.quote(pattern.substring(start, star)));
            regex.append(".*");
            start = star + 1;
        }
        if (start < pattern.length()) regex.append(Pattern.quote(pattern.substring(start)));
        return Pattern.compile(regex.toString());
    }

    public static String toNative(String logical, char separator) {
        return logical.replace(LOGICAL_SEPARATOR, separator);
    }

    /** Reverse of {@link #toNative}: only the first separator marks the prefix boundary. */
    public static String fromNative(String nativeName, char separator) {
        int idx = nativeName.indexOf(separator);
        if (idx < 0) return nativeName;
        return nativeName.substring(0, idx) + LOGICAL_SEPARATOR + nativeName.substring(idx + 1);
    }
}
