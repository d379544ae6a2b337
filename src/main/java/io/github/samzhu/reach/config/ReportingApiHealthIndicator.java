package io.github.samzhu.reach.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.reach.client.ClientStats;
import io.github.samzhu.reach.client.ReportingApiClient;
import io.github.samzhu.reach.client.TokenBucketRateLimiter;

/**
 * 上游報表 API 的健康檢查，顯示於 {@code /actuator/health} 的 {@code reportingApi} 項目。
 *
 * <p>除連線狀態外，另外列出用戶端統計與共用限流器目前剩餘的 token 數。
 */
@Component("reportingApi")
public class ReportingApiHealthIndicator implements HealthIndicator {

    private final ReportingApiClient client;
    private final TokenBucketRateLimiter rateLimiter;

    public ReportingApiHealthIndicator(ReportingApiClient client, TokenBucketRateLimiter rateLimiter) {
        this.client = client;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Health health() {
        Health.Builder builder = client.healthCheck() ? Health.up() : Health.down();
        ClientStats stats = client.stats();
        return builder
            .withDetail("totalRequests", stats.totalRequests())
            .withDetail("totalErrors", stats.totalErrors())
            .withDetail("errorRate", stats.errorRate())
            .withDetail("rateLimitWaitMs", stats.rateLimitWaitMs())
            .withDetail("rateLimitTokens", Math.floor(rateLimiter.availableTokens()))
            .withDetail("rateLimitCapacity", rateLimiter.capacity())
            .build();
    }
}
