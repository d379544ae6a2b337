package io.github.samzhu.reach.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.reach.client.FailureKind;
import io.github.samzhu.reach.client.FetchResult;
import io.github.samzhu.reach.client.Metric;
import io.github.samzhu.reach.client.MetricSourceClient;
import io.github.samzhu.reach.client.ParsedMetric;
import io.github.samzhu.reach.config.ReachProperties;
import io.github.samzhu.reach.config.ReachProperties.SiteConfig;
import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.dto.api.IngestionStats;
import io.github.samzhu.reach.repository.MeasurementStore;
import io.github.samzhu.reach.repository.MeasurementStore.UpsertResult;
import io.github.samzhu.reach.util.DateRanges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 量測擷取服務。
 *
 * <p>單日擷取流程：
 * <ol>
 *   <li>對每一組 (site, metric) 呼叫 {@link MetricSourceClient}</li>
 *   <li>成功的結果轉為 {@link Measurement} 放入緩衝區</li>
 *   <li>緩衝區達到 {@code reach.ingestion.batch-size} 時透過 {@link MeasurementStore} 批次 upsert</li>
 *   <li>當日結束時寫入剩餘資料，回傳 {@link IngestionStats}</li>
 * </ol>
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>上游尚無資料 → {@code skipped}</li>
 *   <li>抓取失敗 → {@code errors}，記錄 site/metric/date/kind 後繼續</li>
 *   <li>批次寫入失敗 → 該批筆數計入 {@code errors}，當日繼續</li>
 * </ul>
 *
 * <p>重複執行同一天不會產生重複資料，第二次的結果為全部更新。
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final MetricSourceClient client;
    private final MeasurementStore store;
    private final ReachProperties properties;
    private final List<Metric> configuredMetrics;

    private final Counter insertedCounter;
    private final Counter updatedCounter;
    private final Counter errorCounter;
    private final Counter skippedCounter;

    public IngestionService(
            MetricSourceClient client,
            MeasurementStore store,
            ReachProperties properties,
            MeterRegistry meterRegistry) {
        this.client = client;
        this.store = store;
        this.properties = properties;
        this.configuredMetrics = resolveMetrics(properties.metrics());
        this.insertedCounter = meterRegistry.counter("reach_ingestion_measurements_total", "outcome", "inserted");
        this.updatedCounter = meterRegistry.counter("reach_ingestion_measurements_total", "outcome", "updated");
        this.errorCounter = meterRegistry.counter("reach_ingestion_measurements_total", "outcome", "error");
        this.skippedCounter = meterRegistry.counter("reach_ingestion_measurements_total", "outcome", "skipped");
        log.info("IngestionService initialized: sites={}, metrics={}, batchSize={}, fetchParallelism={}",
            properties.sites().size(), configuredMetrics, properties.ingestion().batchSize(),
            properties.ingestion().fetchParallelism());
    }

    /**
     * 以設定的網站與指標擷取單日資料。
     */
    public IngestionStats ingestDay(LocalDate date) {
        return ingestDay(date, properties.sites(), configuredMetrics);
    }

    /**
     * 擷取單日資料。
     *
     * @param date 日期
     * @param sites 網站清單
     * @param metrics 指標清單
     * @return 當日統計
     */
    public IngestionStats ingestDay(LocalDate date, List<SiteConfig> sites, List<Metric> metrics) {
        long startTime = System.currentTimeMillis();

        List<FetchTask> tasks = new ArrayList<>(sites.size() * metrics.size());
        for (SiteConfig site : sites) {
            for (Metric metric : metrics) {
                tasks.add(new FetchTask(site, metric));
            }
        }
        log.info("Ingesting {}: {} sites x {} metrics", date, sites.size(), metrics.size());

        DayBatch batch = new DayBatch(date, properties.ingestion().batchSize());
        int parallelism = Math.min(properties.ingestion().fetchParallelism(), tasks.size());

        if (parallelism <= 1) {
            for (FetchTask task : tasks) {
                batch.accept(task, fetchSafely(task, date));
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(parallelism);
            try {
                List<Future<FetchResult>> futures = new ArrayList<>(tasks.size());
                for (FetchTask task : tasks) {
                    futures.add(executor.submit(() -> fetchSafely(task, date)));
                }
                for (int i = 0; i < tasks.size(); i++) {
                    batch.accept(tasks.get(i), await(futures.get(i)));
                }
            } finally {
                executor.shutdownNow();
            }
        }
        batch.flush();

        IngestionStats stats = batch.stats();
        insertedCounter.increment(stats.inserted());
        updatedCounter.increment(stats.updated());
        errorCounter.increment(stats.errors());
        skippedCounter.increment(stats.skipped());

        long duration = System.currentTimeMillis() - startTime;
        log.info("Ingestion completed for {}: inserted={}, updated={}, errors={}, skipped={} in {}ms",
            date, stats.inserted(), stats.updated(), stats.errors(), stats.skipped(), duration);
        return stats;
    }

    /**
     * 以設定的網站與指標擷取日期區間。
     */
    public IngestionStats ingestDateRange(LocalDate start, LocalDate end, boolean parallel, int maxWorkers) {
        return ingestDateRange(start, end, properties.sites(), configuredMetrics, parallel, maxWorkers);
    }

    /**
     * 擷取日期區間，每一天呼叫一次 {@link #ingestDay}。
     *
     * <p>平行模式使用固定大小的執行緒池，等待所有日期完成後加總；
     * 某一天失敗時計為一個錯誤，其他日期照常進行。
     *
     * @param start 起始日期（含）
     * @param end 結束日期（含）
     * @param sites 網站清單
     * @param metrics 指標清單
     * @param parallel 是否平行
     * @param maxWorkers 平行 worker 數，小於 1 時使用設定值
     * @return 合計統計
     * @throws IllegalArgumentException 起始日期晚於結束日期
     */
    public IngestionStats ingestDateRange(LocalDate start, LocalDate end, List<SiteConfig> sites,
                                          List<Metric> metrics, boolean parallel, int maxWorkers) {
        List<LocalDate> dates = DateRanges.datesBetween(start, end);
        long startTime = System.currentTimeMillis();
        log.info("Ingesting range {} to {} ({} days, parallel={})", start, end, dates.size(), parallel);

        IngestionStats total = IngestionStats.empty();
        if (!parallel || dates.size() == 1) {
            for (LocalDate date : dates) {
                total = total.plus(ingestDaySafely(date, sites, metrics));
            }
        } else {
            int workers = maxWorkers > 0 ? maxWorkers : properties.ingestion().maxWorkers();
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, dates.size()));
            try {
                List<Future<IngestionStats>> futures = new ArrayList<>(dates.size());
                for (LocalDate date : dates) {
                    futures.add(executor.submit(() -> ingestDay(date, sites, metrics)));
                }
                for (int i = 0; i < dates.size(); i++) {
                    total = total.plus(awaitDay(dates.get(i), futures.get(i)));
                }
            } finally {
                executor.shutdownNow();
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Range ingestion completed {} to {}: inserted={}, updated={}, errors={}, skipped={} in {}ms",
            start, end, total.inserted(), total.updated(), total.errors(), total.skipped(), duration);
        return total;
    }

    /**
     * @return 設定中有效的指標
     */
    public List<Metric> configuredMetrics() {
        return configuredMetrics;
    }

    private IngestionStats ingestDaySafely(LocalDate date, List<SiteConfig> sites, List<Metric> metrics) {
        try {
            return ingestDay(date, sites, metrics);
        } catch (RuntimeException e) {
            log.error("Ingestion failed for {}: {}", date, e.getMessage(), e);
            return new IngestionStats(0, 0, 1, 0);
        }
    }

    private IngestionStats awaitDay(LocalDate date, Future<IngestionStats> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Ingestion failed for {}: {}", date, e.getCause().getMessage(), e.getCause());
            return new IngestionStats(0, 0, 1, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for ingestion of {}", date);
            return new IngestionStats(0, 0, 1, 0);
        }
    }

    private FetchResult fetchSafely(FetchTask task, LocalDate date) {
        try {
            return client.fetch(task.metric(), task.site().siteId(), date);
        } catch (RuntimeException e) {
            log.error("Unexpected fetch error: site={}, metric={}, date={}",
                task.site().siteId(), task.metric().code(), date, e);
            return FetchResult.failure(FailureKind.TRANSIENT, e.getClass().getSimpleName() + ": " + e.getMessage(),
                0, 0);
        }
    }

    private static FetchResult await(Future<FetchResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return FetchResult.failure(FailureKind.TRANSIENT, String.valueOf(e.getCause()), 0, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(FailureKind.TRANSIENT, "Interrupted", 0, 0);
        }
    }

    private static List<Metric> resolveMetrics(List<String> codes) {
        List<Metric> metrics = new ArrayList<>();
        for (String code : codes) {
            Optional<Metric> metric = Metric.fromCode(code);
            if (metric.isEmpty()) {
                log.warn("Unknown metric code '{}' in configuration, ignoring", code);
            } else if (!metrics.contains(metric.get())) {
                metrics.add(metric.get());
            }
        }
        return List.copyOf(metrics);
    }

    static Measurement toMeasurement(SiteConfig site, ParsedMetric parsed) {
        return Measurement.of(
            site.brand(),
            site.surface(),
            parsed.metric().code(),
            parsed.date(),
            site.siteId(),
            parsed.iomTotal(),
            parsed.iomNational(),
            parsed.iomInternational(),
            parsed.iompTotal(),
            parsed.iombTotal(),
            parsed.preliminary(),
            parsed.exportedAt(),
            parsed.version());
    }

    private record FetchTask(SiteConfig site, Metric metric) {}

    /**
     * 單日的結果累計與寫入緩衝，只在呼叫端執行緒上使用。
     */
    private final class DayBatch {

        private final LocalDate date;
        private final int batchSize;
        private final List<Measurement> buffer = new ArrayList<>();

        private int inserted;
        private int updated;
        private int errors;
        private int skipped;

        DayBatch(LocalDate date, int batchSize) {
            this.date = date;
            this.batchSize = batchSize;
        }

        void accept(FetchTask task, FetchResult result) {
            String siteId = task.site().siteId();
            String metric = task.metric().code();

            switch (result.status()) {
                case SUCCESS -> {
                    ParsedMetric parsed = result.metric();
                    if (parsed == null || !parsed.hasTotal()) {
                        log.debug("No total in response: site={}, metric={}, date={}", siteId, metric, date);
                        skipped++;
                        return;
                    }
                    buffer.add(toMeasurement(task.site(), parsed));
                    if (buffer.size() >= batchSize) {
                        flush();
                    }
                }
                case NO_DATA -> {
                    log.debug("No data: site={}, metric={}, date={}, reason={}",
                        siteId, metric, date, result.message());
                    skipped++;
                }
                case FAILURE -> {
                    log.warn("Fetch failed: site={}, metric={}, date={}, kind={}, httpStatus={}, attempts={}, message={}",
                        siteId, metric, date, result.failureKind(), result.httpStatus(), result.attempts(),
                        result.message());
                    errors++;
                }
            }
        }

        void flush() {
            if (buffer.isEmpty()) {
                return;
            }
            List<Measurement> pending = List.copyOf(buffer);
            buffer.clear();
            try {
                UpsertResult result = store.upsertAll(pending);
                inserted += result.inserted();
                updated += result.updated();
            } catch (RuntimeException e) {
                log.error("Failed to store {} measurements for {}: {}", pending.size(), date, e.getMessage(), e);
                errors += pending.size();
            }
        }

        IngestionStats stats() {
            return new IngestionStats(inserted, updated, errors, skipped);
        }
    }
}
