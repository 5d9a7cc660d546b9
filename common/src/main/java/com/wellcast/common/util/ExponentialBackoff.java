/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.util;

import java.time.Duration;

/**
 * Exponential backoff schedule: {@code base * 2^(attempt-1)} capped at {@code max}.
 * A {@code maxAttempts} of zero means unbounded.
 */
public final class ExponentialBackoff {

    private final Duration base;
    private final Duration max;
    private final int maxAttempts;

    public ExponentialBackoff(Duration base, Duration max, int maxAttempts) {
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be positive");
        if (max.compareTo(base) < 0) throw new IllegalArgumentException("max must be >= base");
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        this.base = base;
        this.max = max;
        this.maxAttempts = maxAttempts;
    }

    public static ExponentialBackoff unbounded(Duration base, Duration max) {
        return new ExponentialBackoff(base, max, 0);
    }

    /**
     * Delay before the given attempt (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-based");
        long baseMs = base.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delay = baseMs << shift;
        if (delay <= 0 || delay > max.toMillis()) delay = max.toMillis();
        return Duration.ofMillis(delay);
    }

    /** True once {@code attemptsMade} has used up a bounded budget. */
    public boolean isExhausted(int attemptsMade) {
        return maxAttempts > 0 && attemptsMade >= maxAttempts;
    }

    public boolean isBounded() { return maxAttempts > 0; }
    public Duration getBase() { return base; }
    public Duration getMax() { return max; }
    public int getMaxAttempts() { return maxAttempts; }

    @Override
    public String toString() {
        return "ExponentialBackoff{base=" + base + ", max=" + max
                + ", maxAttempts=" + (maxAttempts == 0 ? "unbounded" : maxAttempts) + "}";
    }
}
