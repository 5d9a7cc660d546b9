/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.subscriber;

import com.wellcast.common.util.ExponentialBackoff;

import java.time.Duration;

/**
 * Broker reconnect policy of the {@link ReadingSubscriber}.
 */
public class SubscriberSettings {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 20;

    private final ExponentialBackoff backoff;

    public SubscriberSettings(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        this.backoff = new ExponentialBackoff(baseDelay, maxDelay, maxAttempts);
    }

    public static SubscriberSettings defaults() {
        return new SubscriberSettings(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    public ExponentialBackoff getBackoff() { return backoff; }

    @Override
    public String toString() {
        return "SubscriberSettings{" + backoff + "}";
    }
}
