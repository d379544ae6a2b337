package io.github.samzhu.reach.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.reach.anomaly.AnomalyConfig;
import io.github.samzhu.reach.anomaly.AnomalyDetector;
import io.github.samzhu.reach.anomaly.AnomalyResult;
import io.github.samzhu.reach.anomaly.DailyValue;
import io.github.samzhu.reach.anomaly.MetricSubject;
import io.github.samzhu.reach.client.Metric;
import io.github.samzhu.reach.config.ReachProperties;
import io.github.samzhu.reach.config.ReachProperties.SiteConfig;
import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.dto.api.AnomalyCheckResult;
import io.github.samzhu.reach.event.AlertEventPublisher;

/**
 * 單日異常檢查服務。
 *
 * <p>對每一組設定的 (brand, surface, metric)：
 * <ol>
 *   <li>查詢回溯期間的歷史序列</li>
 *   <li>以 {@link AnomalyDetector} 分析目標日期 (依設定決定是否只比較同一星期幾)</li>
 *   <li>異常時新增告警並發佈事件，發佈成功後加上通知戳記</li>
 * </ol>
 *
 * <p>單一組別失敗只記錄錯誤，不影響其他組別。
 */
@Service
public class AnomalyCheckService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyCheckService.class);

    private final ReachProperties properties;
    private final IngestionService ingestionService;
    private final MeasurementQueryService queryService;
    private final AnomalyDetector detector;
    private final AnomalyConfig anomalyConfig;
    private final AlertService alertService;
    private final AlertEventPublisher alertEventPublisher;
    private final Clock clock;

    public AnomalyCheckService(
            ReachProperties properties,
            IngestionService ingestionService,
            MeasurementQueryService queryService,
            AnomalyDetector detector,
            AnomalyConfig anomalyConfig,
            AlertService alertService,
            AlertEventPublisher alertEventPublisher,
            Clock clock) {
        this.properties = properties;
        this.ingestionService = ingestionService;
        this.queryService = queryService;
        this.detector = detector;
        this.anomalyConfig = anomalyConfig;
        this.alertService = alertService;
        this.alertEventPublisher = alertEventPublisher;
        this.clock = clock;
    }

    /**
     * 檢查指定日期。
     *
     * @param date 目標日期
     * @return 檢查結果，包含新建立的告警
     */
    public AnomalyCheckResult checkDate(LocalDate date) {
        long startTime = System.currentTimeMillis();
        boolean useWeekday = properties.anomaly().useWeekday();
        List<MetricSubject> subjects = subjects();

        List<Alert> alerts = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int evaluated = 0;

        for (MetricSubject subject : subjects) {
            try {
                List<DailyValue> history = queryService.findHistory(
                    subject.brand(), subject.surface(), subject.metric(), date, anomalyConfig.lookbackDays());
                AnomalyResult result = detector.analyzeSeries(history, date, useWeekday, anomalyConfig);

                if (!result.evaluated()) {
                    log.debug("Not evaluated: subject={}, date={}, reason={}", subject, date, result.message());
                    continue;
                }
                evaluated++;

                Alert alert = alertService.saveAlert(subject, date, result);
                if (alert != null) {
                    alerts.add(alert);
                    if (alertEventPublisher.publish(alert)) {
                        alertService.markNotified(alert.id(), clock.instant());
                    }
                }
            } catch (RuntimeException e) {
                log.error("Anomaly check failed: subject={}, date={}: {}", subject, date, e.getMessage(), e);
                errors.add(subject + ": " + e.getMessage());
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Anomaly check completed for {}: subjects={}, evaluated={}, alerts={}, errors={} in {}ms",
            date, subjects.size(), evaluated, alerts.size(), errors.size(), duration);
        return new AnomalyCheckResult(date, subjects.size(), evaluated, alerts, errors);
    }

    /**
     * 由設定的網站與指標推導出的偵測對象，同品牌同平台的多個網站只算一組。
     */
    public List<MetricSubject> subjects() {
        Set<MetricSubject> subjects = new LinkedHashSet<>();
        for (SiteConfig site : properties.sites()) {
            for (Metric metric : ingestionService.configuredMetrics()) {
                subjects.add(new MetricSubject(site.brand(), site.surface(), metric.code()));
            }
        }
        return List.copyOf(subjects);
    }
}
