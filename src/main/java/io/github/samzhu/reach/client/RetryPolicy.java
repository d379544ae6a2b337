package io.github.samzhu.reach.client;

import java.time.Duration;
import java.util.Objects;

/**
 * 暫時性錯誤的重試策略。
 *
 * <p>由 {@link ReportingApiClient} 以一般迴圈套用，第 n 次重試前的等待時間：
 * <pre>
 * delay(n) = min(maxDelay, baseDelay × multiplier^(n-1)) × (1 ± jitter)
 * </pre>
 * 抖動後的結果仍不超過 {@code maxDelay}。
 *
 * @param maxAttempts 最多嘗試次數 (含第一次)，至少 1
 * @param baseDelay 第一次重試前的等待時間
 * @param multiplier 指數退避倍數，至少 1.0
 * @param maxDelay 單次等待上限
 * @param jitter 抖動比例 (0.0 - 1.0)
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    double multiplier,
    Duration maxDelay,
    double jitter
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
        }
    }

    /**
     * 不重試的策略。
     */
    static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, 0.0);
    }

    /**
     * 判斷已嘗試 {@code attemptsMade} 次後是否還能重試。
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * 計算第 {@code retryNumber} 次重試前的等待時間。
     *
     * @param retryNumber 重試序號，從 1 開始
     * @param random 介於 [0, 1) 的亂數，決定抖動方向與大小
     * @return 等待時間
     */
    public Duration delayBeforeRetry(int retryNumber, double random) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1, got: " + retryNumber);
        }
        double capNanos = maxDelay.toNanos();
        double nanos = Math.min(capNanos, baseDelay.toNanos() * Math.pow(multiplier, retryNumber - 1));
        double factor = 1.0 - jitter + (2.0 * jitter * random);
        long jittered = (long) Math.min(capNanos, nanos * factor);
        return Duration.ofNanos(Math.max(0L, jittered));
    }

    /**
     * 判斷 HTTP 狀態碼是否值得重試 (429 與 5xx)。
     */
    public static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
