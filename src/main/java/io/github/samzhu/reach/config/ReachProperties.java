package io.github.samzhu.reach.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.reach.anomaly.AnomalyConfig;
import io.github.samzhu.reach.client.RetryPolicy;

/**
 * Reach 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link ApiConfig} - 上游報表 API 連線設定</li>
 *   <li>{@link RateLimitConfig} - Token Bucket 限流設定</li>
 *   <li>{@link RetryConfig} - 暫時性錯誤的重試策略</li>
 *   <li>{@link IngestionConfig} - 擷取批次與平行度設定</li>
 *   <li>{@link AnomalyProperties} - 異常偵測門檻</li>
 *   <li>{@link SiteConfig} - 需擷取的網站清單，依 siteId 去除重複</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * reach:
 *   api:
 *     base-url: https://reportingapi.infonline.de
 *     api-key: ${REACH_API_KEY}
 *     connect-timeout: 10s
 *     read-timeout: 30s
 *   rate-limit:
 *     capacity: 10
 *     refill-per-second: 10
 *     max-wait: 30s
 *   retry:
 *     max-attempts: 3
 *     base-delay: 1s
 *   anomaly:
 *     lookback-days: 56
 *     min-data-points: 7
 *   metrics: pageimpressions,visits
 *   sites:
 *     - site-id: at_w_atvol
 *       brand: vol
 *       surface: web
 *       name: VOL.at Web
 * </pre>
 *
 * <p>核心元件不直接讀取環境變數，所有值皆由此處注入。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "reach")
public record ReachProperties(
    ApiConfig api,
    RateLimitConfig rateLimit,
    RetryConfig retry,
    IngestionConfig ingestion,
    AnomalyProperties anomaly,
    List<SiteConfig> sites,
    List<String> metrics
) {
    public ReachProperties {
        if (api == null) {
            api = ApiConfig.defaults();
        }
        if (rateLimit == null) {
            rateLimit = RateLimitConfig.defaults();
        }
        if (retry == null) {
            retry = RetryConfig.defaults();
        }
        if (ingestion == null) {
            ingestion = IngestionConfig.defaults();
        }
        if (anomaly == null) {
            anomaly = AnomalyProperties.defaults();
        }
        sites = sites == null ? List.of() : distinctSites(sites);
        metrics = metrics == null || metrics.isEmpty()
            ? List.of("pageimpressions", "visits")
            : List.copyOf(metrics);
    }

    /**
     * 依 siteId 去除重複的網站設定，保留第一筆。
     *
     * <p>同一個 siteId 對應到不同的 brand 或 surface 時無法判斷何者正確，直接拒絕。
     */
    private static List<SiteConfig> distinctSites(List<SiteConfig> sites) {
        Map<String, SiteConfig> bySiteId = new LinkedHashMap<>();
        for (SiteConfig site : sites) {
            SiteConfig existing = bySiteId.putIfAbsent(site.siteId(), site);
            if (existing != null
                    && (!existing.brand().equals(site.brand()) || !existing.surface().equals(site.surface()))) {
                throw new IllegalArgumentException("site " + site.siteId() + " is configured as both "
                    + existing.brand() + "/" + existing.surface() + " and " + site.brand() + "/" + site.surface());
            }
        }
        return List.copyOf(bySiteId.values());
    }

    /**
     * 上游報表 API 連線設定。
     *
     * @param baseUrl API 基底網址
     * @param apiKey 共用憑證，放在 {@code authorization} header
     * @param connectTimeout 連線逾時
     * @param readTimeout 讀取逾時
     */
    public record ApiConfig(
        String baseUrl,
        String apiKey,
        Duration connectTimeout,
        Duration readTimeout
    ) {
        public ApiConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://reportingapi.infonline.de";
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (apiKey == null) {
                apiKey = "";
            }
            if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (readTimeout == null || readTimeout.isZero() || readTimeout.isNegative()) {
                readTimeout = Duration.ofSeconds(30);
            }
        }

        /**
         * 建立預設 API 設定。
         */
        public static ApiConfig defaults() {
            return new ApiConfig(null, null, null, null);
        }
    }

    /**
     * Token Bucket 限流設定。
     *
     * <p>同一個 bucket 由所有擷取執行緒共用，限制對外請求速率。
     *
     * @param capacity bucket 容量 (可瞬間發出的請求數)
     * @param refillPerSecond 每秒補充的 token 數
     * @param maxWait 單次請求最長等待 token 的時間
     */
    public record RateLimitConfig(
        int capacity,
        double refillPerSecond,
        Duration maxWait
    ) {
        public RateLimitConfig {
            if (capacity <= 0) {
                capacity = 10;
            }
            if (refillPerSecond <= 0) {
                refillPerSecond = 10.0;
            }
            if (maxWait == null || maxWait.isNegative()) {
                maxWait = Duration.ofSeconds(30);
            }
        }

        /**
         * 建立預設限流設定 (每秒 10 個請求)。
         */
        public static RateLimitConfig defaults() {
            return new RateLimitConfig(10, 10.0, Duration.ofSeconds(30));
        }
    }

    /**
     * 重試策略設定，轉換為 {@link RetryPolicy}。
     *
     * @param maxAttempts 最多嘗試次數 (含第一次)
     * @param baseDelay 第一次重試前的等待時間
     * @param multiplier 指數退避倍數
     * @param maxDelay 單次等待上限
     * @param jitter 抖動比例 (0.0 - 1.0)
     */
    public record RetryConfig(
        int maxAttempts,
        Duration baseDelay,
        double multiplier,
        Duration maxDelay,
        double jitter
    ) {
        public RetryConfig {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (baseDelay == null || baseDelay.isNegative()) {
                baseDelay = Duration.ofSeconds(1);
            }
            if (multiplier < 1.0) {
                multiplier = 2.0;
            }
            if (maxDelay == null || maxDelay.isNegative() || maxDelay.isZero()) {
                maxDelay = Duration.ofSeconds(30);
            }
            if (jitter < 0 || jitter > 1) {
                jitter = 0.2;
            }
        }

        /**
         * 建立預設重試設定。
         */
        public static RetryConfig defaults() {
            return new RetryConfig(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 0.2);
        }

        /**
         * 轉換為用戶端使用的重試策略。
         */
        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, multiplier, maxDelay, jitter);
        }
    }

    /**
     * 擷取設定。
     *
     * @param batchSize 每次 upsert 的最大筆數
     * @param fetchParallelism 單日內同時進行的抓取數，1 表示循序
     * @param maxWorkers 日期區間平行擷取的預設 worker 數
     */
    public record IngestionConfig(
        int batchSize,
        int fetchParallelism,
        int maxWorkers
    ) {
        public IngestionConfig {
            if (batchSize <= 0) {
                batchSize = 500;
            }
            if (fetchParallelism <= 0) {
                fetchParallelism = 1;
            }
            if (maxWorkers <= 0) {
                maxWorkers = 4;
            }
        }

        /**
         * 建立預設擷取設定。
         */
        public static IngestionConfig defaults() {
            return new IngestionConfig(500, 1, 4);
        }
    }

    /**
     * 異常偵測門檻設定，轉換為 {@link AnomalyConfig}。
     *
     * @param lookbackDays 回溯天數
     * @param minDataPoints 最少歷史資料點
     * @param warningZscore Warning z-score 門檻
     * @param warningPctDelta Warning 百分比門檻
     * @param criticalZscore Critical z-score 門檻
     * @param criticalPctDelta Critical 百分比門檻
     * @param useWeekday 是否只與同一星期幾比較
     */
    public record AnomalyProperties(
        int lookbackDays,
        int minDataPoints,
        double warningZscore,
        double warningPctDelta,
        double criticalZscore,
        double criticalPctDelta,
        Boolean useWeekday
    ) {
        public AnomalyProperties {
            AnomalyConfig d = AnomalyConfig.defaults();
            if (lookbackDays <= 0) {
                lookbackDays = d.lookbackDays();
            }
            if (minDataPoints <= 0) {
                minDataPoints = d.minDataPoints();
            }
            if (warningZscore <= 0) {
                warningZscore = d.warningZscore();
            }
            if (warningPctDelta <= 0) {
                warningPctDelta = d.warningPctDelta();
            }
            if (criticalZscore <= 0) {
                criticalZscore = d.criticalZscore();
            }
            if (criticalPctDelta <= 0) {
                criticalPctDelta = d.criticalPctDelta();
            }
            if (useWeekday == null) {
                useWeekday = Boolean.TRUE;
            }
        }

        /**
         * 建立預設異常偵測設定 (8 週回溯、同星期幾比較)。
         */
        public static AnomalyProperties defaults() {
            return new AnomalyProperties(0, 0, 0, 0, 0, 0, null);
        }

        /**
         * 轉換為偵測器使用的不可變設定，並驗證門檻。
         */
        public AnomalyConfig toConfig() {
            return new AnomalyConfig(lookbackDays, minDataPoints,
                warningZscore, warningPctDelta, criticalZscore, criticalPctDelta);
        }
    }

    /**
     * 網站設定。
     *
     * <p>brand 與 surface 一律轉為小寫，確保識別鍵一致。
     *
     * @param siteId 上游 API 的網站識別碼，例如 {@code at_w_atvol}
     * @param brand 品牌，例如 {@code vol}
     * @param surface 平台，例如 {@code web}、{@code ios}、{@code android}
     * @param name 顯示名稱
     */
    public record SiteConfig(
        String siteId,
        String brand,
        String surface,
        String name
    ) {
        public SiteConfig {
            if (siteId == null || siteId.isBlank()) {
                throw new IllegalArgumentException("siteId must not be blank");
            }
            if (brand == null || brand.isBlank()) {
                throw new IllegalArgumentException("brand must not be blank for site " + siteId);
            }
            if (surface == null || surface.isBlank()) {
                throw new IllegalArgumentException("surface must not be blank for site " + siteId);
            }
            brand = brand.toLowerCase(Locale.ROOT);
            surface = surface.toLowerCase(Locale.ROOT);
            if (name == null || name.isBlank()) {
                name = siteId;
            }
        }
    }
}
