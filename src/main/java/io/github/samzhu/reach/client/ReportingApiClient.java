package io.github.samzhu.reach.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.reach.client.dto.MetricResponse;
import io.github.samzhu.reach.client.dto.MetricResponse.ValueNode;

/**
 * 上游報表 API 用戶端。
 *
 * <p>每次抓取的處理流程：
 * <ol>
 *   <li>向共用的 {@link TokenBucketRateLimiter} 取得 token</li>
 *   <li>送出 {@code GET /api/v1/{metric}?site=&date=&aggregation=&returntype=json}</li>
 *   <li>依狀態碼分類：200 解析、404 視為尚無資料、401/403 立即失敗、
 *       429/5xx/連線錯誤依 {@link RetryPolicy} 重試</li>
 *   <li>將回應解析為 {@link ParsedMetric}，缺少資料節點視為尚無資料</li>
 * </ol>
 *
 * <p>底層 {@link RestClient} 由 {@code AppConfig} 建立，已設定 base URL、
 * {@code authorization} header 與連線 / 讀取逾時，並重用連線。
 *
 * <p>此類別為 thread-safe，統計計數使用 {@link AtomicLong}。
 */
public class ReportingApiClient implements MetricSourceClient {

    private static final Logger log = LoggerFactory.getLogger(ReportingApiClient.class);

    private final RestClient restClient;
    private final TokenBucketRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration maxRateLimitWait;
    private final ObjectMapper objectMapper;
    private final TokenBucketRateLimiter.Sleeper backoffSleeper;
    private final DoubleSupplier jitterSource;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong rateLimitWaitNanos = new AtomicLong();

    public ReportingApiClient(
            RestClient restClient,
            TokenBucketRateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            Duration maxRateLimitWait,
            ObjectMapper objectMapper) {
        this(restClient, rateLimiter, retryPolicy, maxRateLimitWait, objectMapper,
            TokenBucketRateLimiter.Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReportingApiClient(
            RestClient restClient,
            TokenBucketRateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            Duration maxRateLimitWait,
            ObjectMapper objectMapper,
            TokenBucketRateLimiter.Sleeper backoffSleeper,
            DoubleSupplier jitterSource) {
        this.restClient = restClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.maxRateLimitWait = maxRateLimitWait;
        this.objectMapper = objectMapper;
        this.backoffSleeper = backoffSleeper;
        this.jitterSource = jitterSource;
    }

    @Override
    public FetchResult fetch(Metric metric, String siteId, LocalDate date, Aggregation aggregation) {
        int attempt = 0;
        int lastStatus = 0;
        String lastError = null;

        while (true) {
            attempt++;

            Optional<Duration> waited;
            try {
                waited = rateLimiter.acquire(maxRateLimitWait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(FailureKind.TRANSIENT, "Interrupted while waiting for rate limit",
                    lastStatus, attempt - 1);
            }
            if (waited.isEmpty()) {
                log.warn("Rate limit budget exhausted: metric={}, site={}, date={}, maxWait={}ms",
                    metric.code(), siteId, date, maxRateLimitWait.toMillis());
                return FetchResult.failure(FailureKind.RATE_LIMITED,
                    "No rate limit token within " + maxRateLimitWait.toMillis() + "ms", lastStatus, attempt - 1);
            }
            long waitNanos = waited.get().toNanos();
            rateLimitWaitNanos.addAndGet(waitNanos);
            if (waitNanos > TimeUnit.MILLISECONDS.toNanos(10)) {
                log.debug("Rate limit: waited {}ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            }

            try {
                long start = System.nanoTime();
                requestCount.incrementAndGet();
                RawResponse response = execute(metric, siteId, date, aggregation);
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

                int status = response.status();
                if (status == 200) {
                    log.debug("API OK: {} | {} | {} | {}ms", metric.endpoint(), siteId, date, elapsedMs);
                    return parse(response.body(), metric, siteId, date, aggregation, attempt);
                }

                errorCount.incrementAndGet();
                if (status == 404) {
                    log.debug("No data published yet: metric={}, site={}, date={}", metric.code(), siteId, date);
                    return FetchResult.noData("HTTP 404", status, attempt);
                }
                if (status == 401 || status == 403) {
                    log.error("API credential rejected: HTTP {} for {} (site={}, date={})",
                        status, metric.endpoint(), siteId, date);
                    return FetchResult.failure(FailureKind.AUTH, "HTTP " + status + ": credential rejected",
                        status, attempt);
                }
                if (!RetryPolicy.isRetryableStatus(status)) {
                    log.warn("API client error: HTTP {} for {} (site={}, date={}): {}",
                        status, metric.endpoint(), siteId, date, abbreviate(response.body()));
                    return FetchResult.failure(FailureKind.CLIENT_ERROR,
                        "HTTP " + status + ": " + abbreviate(response.body()), status, attempt);
                }

                lastStatus = status;
                lastError = "HTTP " + status;
            } catch (RestClientException e) {
                errorCount.incrementAndGet();
                lastStatus = 0;
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            }

            if (!retryPolicy.canRetry(attempt)) {
                log.error("Retries exhausted after {} attempts: metric={}, site={}, date={}, lastError={}",
                    attempt, metric.code(), siteId, date, lastError);
                return FetchResult.failure(FailureKind.TRANSIENT,
                    "Retries exhausted after " + attempt + " attempts: " + lastError, lastStatus, attempt);
            }

            Duration delay = retryPolicy.delayBeforeRetry(attempt, jitterSource.getAsDouble());
            log.warn("Transient API failure ({}), retry {}/{} in {}ms: metric={}, site={}, date={}",
                lastError, attempt, retryPolicy.maxAttempts() - 1, delay.toMillis(), metric.code(), siteId, date);
            try {
                backoffSleeper.sleep(delay.toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(FailureKind.TRANSIENT, "Interrupted during backoff: " + lastError,
                    lastStatus, attempt);
            }
        }
    }

    /**
     * 檢查 API 是否可連線，200 或 404 皆視為可連線。
     *
     * <p>與 {@link #fetch} 共用同一個限流預算並計入統計；
     * 無法在 {@code maxRateLimitWait} 內取得 token 時視為不可連線，不送出請求。
     *
     * @return true 表示可連線
     */
    public boolean healthCheck() {
        Optional<Duration> waited;
        try {
            waited = rateLimiter.acquire(maxRateLimitWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (waited.isEmpty()) {
            log.warn("Health check skipped: no rate limit token within {}ms", maxRateLimitWait.toMillis());
            return false;
        }
        rateLimitWaitNanos.addAndGet(waited.get().toNanos());

        requestCount.incrementAndGet();
        try {
            int status = restClient.get()
                .uri("/health")
                .exchange((request, response) -> response.getStatusCode().value());
            if (status == 200 || status == 404) {
                return true;
            }
            errorCount.incrementAndGet();
            log.warn("Health check failed: HTTP {}", status);
            return false;
        } catch (RestClientException e) {
            errorCount.incrementAndGet();
            log.error("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @return 目前的使用統計
     */
    public ClientStats stats() {
        return new ClientStats(
            requestCount.get(),
            errorCount.get(),
            TimeUnit.NANOSECONDS.toMillis(rateLimitWaitNanos.get()));
    }

    private RawResponse execute(Metric metric, String siteId, LocalDate date, Aggregation aggregation) {
        return restClient.get()
            .uri(uriBuilder -> uriBuilder
                .path(metric.endpoint())
                .queryParam("site", siteId)
                .queryParam("aggregation", aggregation.name())
                .queryParam("date", date.toString())
                .queryParam("returntype", "json")
                .build())
            .exchange((request, response) -> new RawResponse(
                response.getStatusCode().value(),
                readBody(response.getBody())));
    }

    FetchResult parse(String body, Metric metric, String siteId, LocalDate date,
                      Aggregation aggregation, int attempts) {
        if (body == null || body.isBlank()) {
            return FetchResult.noData("Empty response body", 200, attempts);
        }

        MetricResponse response;
        try {
            response = objectMapper.readValue(body, MetricResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed API response: metric={}, site={}, date={}, size={} bytes, error={}",
                metric.code(), siteId, date, body.length(), e.getOriginalMessage());
            return FetchResult.failure(FailureKind.MALFORMED_RESPONSE,
                "Malformed response (" + body.length() + " bytes): " + e.getOriginalMessage(), 200, attempts);
        }

        if (response == null || response.data() == null) {
            log.warn("No data node in response: metric={}, site={}, date={}", metric.code(), siteId, date);
            return FetchResult.noData("No data node in response", 200, attempts);
        }

        ValueNode iom = MetricResponse.first(response.data().iom());
        if (iom == null || iom.total() == null) {
            log.debug("No IOM data: metric={}, site={}, date={}", metric.code(), siteId, date);
            return FetchResult.noData("No IOM total in response", 200, attempts);
        }

        ValueNode iomp = MetricResponse.first(response.data().iomp());
        ValueNode iomb = MetricResponse.first(response.data().iomb());
        MetricResponse.Metadata metadata = response.metadata();

        ParsedMetric parsed = new ParsedMetric(
            siteId,
            metric,
            date,
            aggregation,
            iom.total(),
            iom.national(),
            iom.international(),
            iom.preliminary() == null || iom.preliminary(),
            iomp != null ? iomp.total() : null,
            iomb != null ? iomb.pis() : null,
            metadata != null ? parseExportedAt(metadata.exportedAt()) : null,
            metadata != null ? metadata.version() : null
        );
        return FetchResult.success(parsed, attempts);
    }

    private static Instant parseExportedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Could not parse exported_at '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static String readBody(java.io.InputStream body) throws IOException {
        if (body == null) {
            return "";
        }
        return StreamUtils.copyToString(body, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200);
    }

    private record RawResponse(int status, String body) {}
}
