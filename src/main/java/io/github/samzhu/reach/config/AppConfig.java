package io.github.samzhu.reach.config;

import java.net.http.HttpClient;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.reach.anomaly.AnomalyConfig;
import io.github.samzhu.reach.client.ReportingApiClient;
import io.github.samzhu.reach.client.RetryPolicy;
import io.github.samzhu.reach.client.TokenBucketRateLimiter;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link ReachProperties} 的型別安全配置綁定，並由配置值建立核心元件：
 * <ul>
 *   <li>{@link Clock} - 所有時間戳記的來源 (UTC)</li>
 *   <li>{@link TokenBucketRateLimiter} - 所有擷取執行緒共用的單一限流器</li>
 *   <li>{@link RetryPolicy} - 上游 API 的重試策略</li>
 *   <li>{@link AnomalyConfig} - 異常偵測門檻，啟動時驗證</li>
 *   <li>{@link ReportingApiClient} - 上游報表 API 用戶端</li>
 * </ul>
 *
 * @see ReachProperties
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html#features.external-config.typesafe-configuration-properties.enabling-annotated-types">Enabling @ConfigurationProperties</a>
 */
@Configuration
@EnableConfigurationProperties(ReachProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(ReachProperties properties) {
        ReachProperties.RateLimitConfig rateLimit = properties.rateLimit();
        log.info("Rate limiter: capacity={}, refillPerSecond={}, maxWait={}",
            rateLimit.capacity(), rateLimit.refillPerSecond(), rateLimit.maxWait());
        return new TokenBucketRateLimiter(rateLimit.capacity(), rateLimit.refillPerSecond());
    }

    @Bean
    public RetryPolicy retryPolicy(ReachProperties properties) {
        return properties.retry().toPolicy();
    }

    @Bean
    public AnomalyConfig anomalyConfig(ReachProperties properties) {
        return properties.anomaly().toConfig();
    }

    /**
     * 上游報表 API 的 RestClient，連線逾時與讀取逾時皆為有限值。
     */
    @Bean
    public RestClient reportingRestClient(RestClient.Builder builder, ReachProperties properties) {
        ReachProperties.ApiConfig api = properties.api();
        if (api.apiKey().isBlank()) {
            log.warn("reach.api.api-key is empty, upstream requests will be rejected");
        }

        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(api.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(api.readTimeout());

        return builder
            .baseUrl(api.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader("authorization", api.apiKey())
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader("User-Agent", "reach/0.0.1")
            .build();
    }

    @Bean
    public ReportingApiClient reportingApiClient(
            RestClient reportingRestClient,
            TokenBucketRateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            ObjectMapper objectMapper,
            ReachProperties properties) {
        log.info("Reporting API client: baseUrl={}, retry={}", properties.api().baseUrl(), retryPolicy);
        return new ReportingApiClient(reportingRestClient, rateLimiter, retryPolicy,
            properties.rateLimit().maxWait(), objectMapper);
    }
}
