package io.github.samzhu.reach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.reach.client.Aggregation;
import io.github.samzhu.reach.client.FailureKind;
import io.github.samzhu.reach.client.FetchResult;
import io.github.samzhu.reach.client.Metric;
import io.github.samzhu.reach.client.MetricSourceClient;
import io.github.samzhu.reach.client.ParsedMetric;
import io.github.samzhu.reach.config.ReachProperties;
import io.github.samzhu.reach.config.ReachProperties.IngestionConfig;
import io.github.samzhu.reach.config.ReachProperties.SiteConfig;
import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.dto.api.IngestionStats;
import io.github.samzhu.reach.repository.InMemoryMeasurementStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class IngestionServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 14);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T06:00:00Z"), ZoneOffset.UTC);

    private static final List<SiteConfig> SITES = List.of(
        new SiteConfig("at_w_atvol", "vol", "web", "VOL.at Web"),
        new SiteConfig("at_i_volat", "vol", "ios", "VOL.at iOS"),
        new SiteConfig("at_w_atvienna", "vienna", "web", "Vienna.at Web"));

    private ScriptedClient client;
    private InMemoryMeasurementStore store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        client = new ScriptedClient();
        store = new InMemoryMeasurementStore(CLOCK);
        meterRegistry = new SimpleMeterRegistry();
    }

    private IngestionService service(int batchSize, int fetchParallelism, List<String> metrics) {
        ReachProperties properties = new ReachProperties(null, null, null,
            new IngestionConfig(batchSize, fetchParallelism, 4), null, SITES, metrics);
        return new IngestionService(client, store, properties, meterRegistry);
    }

    private IngestionService service() {
        return service(500, 1, List.of("pageimpressions", "visits"));
    }

    @Test
    void shouldStoreOneMeasurementPerSiteAndMetric() {
        // Given
        IngestionService service = service();

        // When
        IngestionStats stats = service.ingestDay(DATE);

        // Then
        assertThat(stats).isEqualTo(new IngestionStats(6, 0, 0, 0));
        assertThat(store.size()).isEqualTo(6);
        assertThat(store.all())
            .extracting(Measurement::brand, Measurement::surface, Measurement::siteId)
            .contains(
                tuple("vol", "web", "at_w_atvol"),
                tuple("vienna", "web", "at_w_atvienna"));
        assertThat(meterRegistry.counter("reach_ingestion_measurements_total", "outcome", "inserted").count())
            .isEqualTo(6.0);
    }

    @Test
    void rerunningSameDayShouldOnlyUpdate() {
        // Given
        IngestionService service = service();
        service.ingestDay(DATE);

        // When
        IngestionStats second = service.ingestDay(DATE);

        // Then
        assertThat(second).isEqualTo(new IngestionStats(0, 6, 0, 0));
        assertThat(store.size()).isEqualTo(6);
    }

    @Test
    void missingDataAndFailuresShouldNotAbortTheDay() {
        // Given
        client.script("at_i_volat", Metric.VISITS, FetchResult.noData("HTTP 404", 404, 1));
        client.script("at_w_atvienna", Metric.PAGE_IMPRESSIONS,
            FetchResult.failure(FailureKind.TRANSIENT, "Retries exhausted after 3 attempts: HTTP 503", 503, 3));
        client.throwFor("at_w_atvienna", Metric.VISITS, new IllegalStateException("boom"));
        IngestionService service = service();

        // When
        IngestionStats stats = service.ingestDay(DATE);

        // Then
        assertThat(stats).isEqualTo(new IngestionStats(3, 0, 2, 1));
        assertThat(stats.total()).isEqualTo(6);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void successWithoutTotalShouldBeSkipped() {
        // Given
        client.script("at_w_atvol", Metric.PAGE_IMPRESSIONS, FetchResult.success(
            new ParsedMetric("at_w_atvol", Metric.PAGE_IMPRESSIONS, DATE, Aggregation.DAY,
                null, null, null, true, null, null, null, null), 1));
        IngestionService service = service();

        // When
        IngestionStats stats = service.ingestDay(DATE);

        // Then
        assertThat(stats.skipped()).isEqualTo(1);
        assertThat(stats.inserted()).isEqualTo(5);
    }

    @Test
    void shouldFlushInBatches() {
        // Given
        IngestionService service = service(4, 1, List.of("pageimpressions", "visits"));

        // When
        service.ingestDay(DATE);

        // Then
        assertThat(store.upsertCalls()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(6);
    }

    @Test
    void failedFlushShouldCountWholeBatchAsErrors() {
        // Given
        store.failNextUpserts(1);
        IngestionService service = service(4, 1, List.of("pageimpressions", "visits"));

        // When
        IngestionStats stats = service.ingestDay(DATE);

        // Then
        assertThat(stats).isEqualTo(new IngestionStats(2, 0, 4, 0));
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void parallelFetchShouldMatchSequentialFetch() {
        // Given
        IngestionService service = service(500, 4, List.of("pageimpressions", "visits"));

        // When
        IngestionStats stats = service.ingestDay(DATE);

        // Then
        assertThat(stats).isEqualTo(new IngestionStats(6, 0, 0, 0));
        assertThat(client.calls()).isEqualTo(6);
    }

    @Test
    void rangeTotalsShouldNotDependOnParallelism() {
        // Given
        IngestionService service = service();
        LocalDate start = DATE.minusDays(4);

        // When
        IngestionStats sequential = service.ingestDateRange(start, DATE, false, 1);
        InMemoryMeasurementStore sequentialStore = store;
        store = new InMemoryMeasurementStore(CLOCK);
        IngestionStats parallel = service().ingestDateRange(start, DATE, true, 3);

        // Then
        assertThat(sequential).isEqualTo(new IngestionStats(30, 0, 0, 0));
        assertThat(parallel).isEqualTo(sequential);
        assertThat(store.size()).isEqualTo(sequentialStore.size());
    }

    @Test
    void singleDayRangeShouldEqualIngestDay() {
        // When
        IngestionStats stats = service().ingestDateRange(DATE, DATE, true, 4);

        // Then
        assertThat(stats).isEqualTo(new IngestionStats(6, 0, 0, 0));
    }

    @Test
    void rangeWithStartAfterEndShouldBeRejected() {
        // Given
        IngestionService service = service();

        // When & Then
        assertThatThrownBy(() -> service.ingestDateRange(DATE, DATE.minusDays(1), false, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(client.calls()).isZero();
    }

    @Test
    void overlappingRunsShouldNotCreateDuplicates() throws Exception {
        // Given
        IngestionService service = service(5, 2, List.of("pageimpressions", "visits"));
        LocalDate start = DATE.minusDays(6);
        Callable<IngestionStats> run = () -> service.ingestDateRange(start, DATE, true, 3);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        // When
        IngestionStats first;
        IngestionStats second;
        try {
            Future<IngestionStats> a = executor.submit(run);
            Future<IngestionStats> b = executor.submit(run);
            first = a.get();
            second = b.get();
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(store.size()).isEqualTo(7 * 6);
        assertThat(first.inserted() + second.inserted()).isEqualTo(7 * 6);
        assertThat(first.updated() + second.updated()).isEqualTo(7 * 6);
        assertThat(first.errors() + second.errors()).isZero();
    }

    @Test
    void unknownMetricCodesShouldBeIgnored() {
        // When
        IngestionService service = service(500, 1, List.of("pi", "bogus", "pageimpressions", "visits"));

        // Then
        assertThat(service.configuredMetrics()).containsExactly(Metric.PAGE_IMPRESSIONS, Metric.VISITS);
    }

    @Test
    void measurementShouldCarrySiteIdentityAndPreliminaryFlag() {
        // Given
        SiteConfig site = SITES.get(1);
        ParsedMetric parsed = new ParsedMetric("at_i_volat", Metric.VISITS, DATE, Aggregation.DAY,
            800L, 700L, 100L, true, 600L, 200L, Instant.parse("2025-01-15T04:00:00Z"), "1.0");

        // When
        Measurement measurement = IngestionService.toMeasurement(site, parsed);

        // Then
        assertThat(measurement.id()).isEqualTo("2025-01-14_vol_ios_visits_at_i_volat_P");
        assertThat(measurement.valueTotal()).isEqualTo(800L);
        assertThat(measurement.valueIomb()).isEqualTo(200L);
        assertThat(measurement.preliminary()).isTrue();
    }

    /**
     * 依 (site, metric) 回傳預先設定的結果，未設定者回傳固定值的成功結果。
     */
    private static final class ScriptedClient implements MetricSourceClient {

        private final Map<String, FetchResult> scripted = new ConcurrentHashMap<>();
        private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
        private final AtomicInteger calls = new AtomicInteger();

        void script(String siteId, Metric metric, FetchResult result) {
            scripted.put(siteId + "|" + metric.code(), result);
        }

        void throwFor(String siteId, Metric metric, RuntimeException e) {
            failures.put(siteId + "|" + metric.code(), e);
        }

        int calls() {
            return calls.get();
        }

        @Override
        public FetchResult fetch(Metric metric, String siteId, LocalDate date, Aggregation aggregation) {
            calls.incrementAndGet();
            String key = siteId + "|" + metric.code();
            RuntimeException failure = failures.get(key);
            if (failure != null) {
                throw failure;
            }
            FetchResult result = scripted.get(key);
            if (result != null) {
                return result;
            }
            long value = 1000L + date.getDayOfMonth() * 10L + siteId.length();
            return FetchResult.success(new ParsedMetric(siteId, metric, date, aggregation,
                value, value - 100, 100L, false, null, null, null, "1.0"), 1);
        }
    }
}
