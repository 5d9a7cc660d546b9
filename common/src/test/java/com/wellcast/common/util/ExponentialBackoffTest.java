/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffTest {

    @Test
    void doublesUntilCapped() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(5), 10);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delayFor(500)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void boundedBudgetExhausts() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(10), 3);

        assertThat(backoff.isExhausted(2)).isFalse();
        assertThat(backoff.isExhausted(3)).isTrue();
    }

    @Test
    void unboundedNeverExhausts() {
        ExponentialBackoff backoff = ExponentialBackoff.unbounded(Duration.ofMillis(10), Duration.ofSeconds(1));

        assertThat(backoff.isBounded()).isFalse();
        assertThat(backoff.isExhausted(Integer.MAX_VALUE)).isFalse();
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ZERO, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
