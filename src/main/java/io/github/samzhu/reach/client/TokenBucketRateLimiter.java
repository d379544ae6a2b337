package io.github.samzhu.reach.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token Bucket 限流器，所有呼叫端共用一個實例。
 *
 * <p>每次對外請求前取得一個 token。token 不足時，呼叫端在鎖內預約下一個
 * token (餘額可為負數)，再於鎖外等待；多個執行緒同時等待時會依預約順序排隊，
 * 整體請求速率不超過 {@code refillPerSecond}。
 *
 * <p>鎖只保護 token 餘額的計算，不會在持有鎖時睡眠。
 */
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    /**
     * 可替換的等待實作，測試時避免真的睡眠。
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;

        Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;
    }

    private final int capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime, Sleeper.SYSTEM);
    }

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, LongSupplier nanoClock, Sleeper sleeper) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("refillPerSecond must be positive, got: " + refillPerSecond);
        }
        this.capacity = capacity;
        this.tokensPerNano = refillPerSecond / TimeUnit.SECONDS.toNanos(1);
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * 取得一個 token，必要時等待。
     *
     * @param maxWait 最長等待時間，超過則不預約並回傳 empty
     * @return 實際等待時間；無法在 {@code maxWait} 內取得時回傳 empty
     * @throws InterruptedException 等待期間被中斷
     */
    public Optional<Duration> acquire(Duration maxWait) throws InterruptedException {
        long waitNanos;
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return Optional.of(Duration.ZERO);
            }
            waitNanos = (long) Math.ceil((1.0 - tokens) / tokensPerNano);
            if (waitNanos > maxWait.toNanos()) {
                log.debug("Rate limit wait {}ms exceeds max wait {}ms",
                    TimeUnit.NANOSECONDS.toMillis(waitNanos), maxWait.toMillis());
                return Optional.empty();
            }
            tokens -= 1.0;
        } finally {
            lock.unlock();
        }

        sleeper.sleep(waitNanos);
        return Optional.of(Duration.ofNanos(waitNanos));
    }

    /**
     * 目前可用的 token 數 (可能為負，表示已有呼叫端排隊)。
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
