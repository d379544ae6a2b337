package io.github.samzhu.reach.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.0);

    @Test
    void shouldGrowDelayExponentiallyUpToCap() {
        assertThat(policy.delayBeforeRetry(1, 0.5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayBeforeRetry(2, 0.5)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayBeforeRetry(3, 0.5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayBeforeRetry(4, 0.5)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void jitterShouldStayWithinBand() {
        // Given
        RetryPolicy jittered = new RetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofMinutes(5), 0.2);

        // When
        Duration low = jittered.delayBeforeRetry(1, 0.0);
        Duration high = jittered.delayBeforeRetry(1, 0.999);

        // Then
        assertThat(low).isBetween(Duration.ofMillis(7_999), Duration.ofMillis(8_001));
        assertThat(high).isBetween(Duration.ofMillis(11_900), Duration.ofSeconds(12));
    }

    @Test
    void jitteredDelayShouldNeverExceedCap() {
        // Given
        RetryPolicy jittered = new RetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(10), 1.0);

        // When & Then
        assertThat(jittered.delayBeforeRetry(3, 0.999)).isLessThanOrEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void canRetryShouldRespectMaxAttempts() {
        assertThat(policy.canRetry(4)).isTrue();
        assertThat(policy.canRetry(5)).isFalse();
        assertThat(RetryPolicy.none().canRetry(1)).isFalse();
    }

    @Test
    void shouldClassifyRetryableStatuses() {
        assertThat(RetryPolicy.isRetryableStatus(429)).isTrue();
        assertThat(RetryPolicy.isRetryableStatus(500)).isTrue();
        assertThat(RetryPolicy.isRetryableStatus(503)).isTrue();
        assertThat(RetryPolicy.isRetryableStatus(400)).isFalse();
        assertThat(RetryPolicy.isRetryableStatus(404)).isFalse();
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.delayBeforeRetry(0, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
