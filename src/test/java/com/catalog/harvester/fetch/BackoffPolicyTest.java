package com.catalog.harvester.fetch;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void growsExponentiallyWithFixedJitter() {
        BackoffPolicy policy = new BackoffPolicy(2.0, Duration.ofMillis(100), 1, 1, Duration.ofSeconds(5));

        assertThat(policy.delayFor(1, 0)).isEqualTo(Duration.ofMillis(300));
        assertThat(policy.delayFor(2, 0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayFor(3, 500)).isEqualTo(Duration.ofMillis(900));
    }

    @Test
    void rateLimitStatusesAddTheFloor() {
        BackoffPolicy policy = new BackoffPolicy(2.0, Duration.ofMillis(100), 1, 1, Duration.ofSeconds(5));

        assertThat(policy.delayFor(2, 429)).isEqualTo(Duration.ofMillis(5500));
        assertThat(policy.delayFor(2, 503)).isEqualTo(Duration.ofMillis(5500));
    }

    @Test
    void challengeWaitIsDoubled() {
        BackoffPolicy policy = new BackoffPolicy(2.0, Duration.ofMillis(100), 1, 1, Duration.ofSeconds(5));

        assertThat(policy.challengeDelayFor(1)).isEqualTo(Duration.ofMillis(600));
    }

    @Test
    void jitterStaysWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(2.0, Duration.ofMillis(10), 1, 3, Duration.ZERO);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayFor(1, 0)).isBetween(Duration.ofMillis(30), Duration.ofMillis(50));
        }
    }

    @Test
    void rejectsInvertedJitterRange() {
        assertThatThrownBy(() -> new BackoffPolicy(2.0, Duration.ofSeconds(1), 3, 1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
