package io.github.samzhu.reach.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

    private final AtomicLong now = new AtomicLong(0);
    private final List<Long> sleeps = new ArrayList<>();
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        // 容量 2，每秒補充 10 個 token；sleep 會推進假時鐘
        limiter = new TokenBucketRateLimiter(2, 10.0, now::get, nanos -> {
            sleeps.add(nanos);
            now.addAndGet(nanos);
        });
    }

    @Test
    void shouldServeBurstUpToCapacityWithoutWaiting() throws InterruptedException {
        // When
        Optional<Duration> first = limiter.acquire(Duration.ofSeconds(1));
        Optional<Duration> second = limiter.acquire(Duration.ofSeconds(1));

        // Then
        assertThat(first).contains(Duration.ZERO);
        assertThat(second).contains(Duration.ZERO);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldWaitForRefillWhenEmpty() throws InterruptedException {
        // Given
        limiter.acquire(Duration.ofSeconds(1));
        limiter.acquire(Duration.ofSeconds(1));

        // When
        Optional<Duration> waited = limiter.acquire(Duration.ofSeconds(1));

        // Then: one token every 100ms
        assertThat(waited).contains(Duration.ofMillis(100));
        assertThat(sleeps).containsExactly(TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    void queuedCallersShouldReserveSuccessiveSlots() throws InterruptedException {
        // Given: sleeps do not advance the clock, as if callers were waiting concurrently
        TokenBucketRateLimiter queued = new TokenBucketRateLimiter(1, 10.0, now::get, sleeps::add);
        queued.acquire(Duration.ofSeconds(1));

        // When
        Optional<Duration> second = queued.acquire(Duration.ofSeconds(1));
        Optional<Duration> third = queued.acquire(Duration.ofSeconds(1));

        // Then
        assertThat(second).contains(Duration.ofMillis(100));
        assertThat(third).contains(Duration.ofMillis(200));
    }

    @Test
    void shouldGiveUpWhenWaitExceedsMaxWait() throws InterruptedException {
        // Given
        limiter.acquire(Duration.ZERO);
        limiter.acquire(Duration.ZERO);

        // When
        Optional<Duration> result = limiter.acquire(Duration.ofMillis(50));

        // Then
        assertThat(result).isEmpty();
        assertThat(sleeps).isEmpty();
        assertThat(limiter.availableTokens()).isLessThan(1.0);
    }

    @Test
    void shouldNotRefillBeyondCapacity() {
        // When
        now.addAndGet(TimeUnit.SECONDS.toNanos(60));

        // Then
        assertThat(limiter.availableTokens()).isEqualTo(2.0);
        assertThat(limiter.capacity()).isEqualTo(2);
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 10.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
