/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * OPC-style signal quality attached to every reading.
 */
public enum Quality {
    GOOD("Good"),
    BAD("Bad"),
    UNCERTAIN("Uncertain");

    private final String label;

    Quality(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    /** Case-insensitive lookup by wire label; empty for anything unknown. */
    public static Optional<Quality> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String trimmed = label.trim();
        for (Quality q : values()) {
            if (q.label.equalsIgnoreCase(trimmed)) return Optional.of(q);
        }
        return Optional.empty();
    }

    @JsonCreator
    static Quality fromJson(String label) {
        return fromLabel(label).orElseThrow(() ->
                new IllegalArgumentException("Unknown quality '" + label + "'"));
    }
}
