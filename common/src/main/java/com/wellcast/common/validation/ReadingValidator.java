/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.validation;

import com.wellcast.common.exception.ValidationException;
import com.wellcast.common.model.Quality;
import com.wellcast.common.model.Reading;
import com.wellcast.common.topic.ReadingTopics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Normalizes and validates inbound telemetry samples.
 *
 * <p>Pure apart from reading the injected {@link Clock}. Checks run in a fixed
 * order and the first failure is reported; a reading is either fully valid or
 * rejected, never partially accepted.</p>
 */
public class ReadingValidator {

    public static final Duration DEFAULT_MAX_FUTURE_SKEW = Duration.ofMinutes(5);

    static final List<String> REQUIRED_FIELDS = List.of(
            "tenant_id", "well_id", "source_connection_id", "tag_name",
            "value", "quality", "timestamp", "source_protocol");

    private final Clock clock;
    private final Duration maxFutureSkew;

    public ReadingValidator() {
        this(Clock.systemUTC(), DEFAULT_MAX_FUTURE_SKEW);
    }

    public ReadingValidator(Clock clock, Duration maxFutureSkew) {
        if (maxFutureSkew.isNegative()) throw new IllegalArgumentException("maxFutureSkew must be >= 0");
        this.clock = clock;
        this.maxFutureSkew = maxFutureSkew;
    }

    /**
     * Validate an untyped candidate (typically a decoded JSON object).
     *
     * @throws ValidationException naming the first failing field
     */
    public Reading validate(Map<String, ?> candidate) {
        if (candidate == null) throw new ValidationException("reading", "candidate is null");

        for (String field : REQUIRED_FIELDS) {
            Object v = candidate.get(field);
            if (v == null || (v instanceof String s && s.isBlank())) {
                throw new ValidationException(field, "required field is missing");
            }
        }

        String tenantId = text(candidate, "tenant_id");
        if (!ReadingTopics.isValidTenantId(tenantId)) {
            throw new ValidationException("tenant_id", "must match " + ReadingTopics.TENANT_ID.pattern());
        }

        double value = parseValue(candidate.get("value"));
        Quality quality = parseQuality(candidate.get("quality"));
        Instant timestamp = parseTimestamp(candidate.get("timestamp"));
        checkSkew(timestamp);

        return new Reading(
                tenantId,
                text(candidate, "well_id"),
                text(candidate, "source_connection_id"),
                text(candidate, "tag_name"),
                value,
                quality,
                timestamp,
                text(candidate, "source_protocol"));
    }

    /**
     * Re-check an already typed reading, e.g. one handed over in-process by an adapter.
     */
    public Reading validate(Reading reading) {
        if (reading == null) throw new ValidationException("reading", "candidate is null");
        requireText("tenant_id", reading.tenantId());
        requireText("well_id", reading.wellId());
        requireText("source_connection_id", reading.sourceConnectionId());
        requireText("tag_name", reading.tagName());
        if (reading.quality() == null) throw new ValidationException("quality", "required field is missing");
        if (reading.timestamp() == null) throw new ValidationException("timestamp", "required field is missing");
        requireText("source_protocol", reading.sourceProtocol());
        if (!ReadingTopics.isValidTenantId(reading.tenantId())) {
            throw new ValidationException("tenant_id", "must match " + ReadingTopics.TENANT_ID.pattern());
        }
        if (!Double.isFinite(reading.value())) throw new ValidationException("value", "must be a finite number");
        checkSkew(reading.timestamp());
        return reading;
    }

    public Duration getMaxFutureSkew() { return maxFutureSkew; }

    private void checkSkew(Instant timestamp) {
        Instant latest = clock.instant().plus(maxFutureSkew);
        if (timestamp.isAfter(latest)) {
            throw new ValidationException("timestamp", "more than " + maxFutureSkew + " in the future");
        }
    }

    private static String text(Map<String, ?> candidate, String field) {
        return String.valueOf(candidate.get(field)).trim();
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) throw new ValidationException(field, "required field is missing");
    }

    private static double parseValue(Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("value", "not a number: '" + s + "'");
            }
        } else {
            throw new ValidationException("value", "not a number");
        }
        if (!Double.isFinite(value)) throw new ValidationException("value", "must be a finite number");
        return value;
    }

    private static Quality parseQuality(Object raw) {
        if (raw instanceof Quality q) return q;
        return Quality.fromLabel(String.valueOf(raw))
                .orElseThrow(() -> new ValidationException("quality",
                        "must be one of Good, Bad, Uncertain but was '" + raw + "'"));
    }

    private static Instant parseTimestamp(Object raw) {
        if (raw instanceof Instant i) return i;
        if (raw instanceof Number n) {
            if (raw instanceof Double || raw instanceof Float) {
                throw new ValidationException("timestamp", "epoch timestamps must be integral milliseconds");
            }
            return Instant.ofEpochMilli(n.longValue());
        }
        String s = String.valueOf(raw).trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e2) {
                throw new ValidationException("timestamp", "not an ISO-8601 instant: '" + s + "'");
            }
        }
    }
}
