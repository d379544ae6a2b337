package io.github.samzhu.reach.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.reach.anomaly.AnomalyResult;
import io.github.samzhu.reach.anomaly.MetricSubject;
import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.exception.AlertNotFoundException;
import io.github.samzhu.reach.repository.AlertRepository;

/**
 * 告警生命週期服務。
 *
 * <p>告警只會被新增、確認與加上通知戳記，不會被刪除。
 * 同一對象同一天可以有多筆告警，寫入時不做去重。
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertRepository alertRepository;
    private final Clock clock;

    public AlertService(AlertRepository alertRepository, Clock clock) {
        this.alertRepository = alertRepository;
        this.clock = clock;
    }

    /**
     * 偵測結果為異常時新增告警。
     *
     * @param subject 偵測對象
     * @param targetDate 目標日期
     * @param result 偵測結果
     * @return 新增的告警；非異常時回傳 null
     */
    public Alert saveAlert(MetricSubject subject, LocalDate targetDate, AnomalyResult result) {
        if (!result.outlier()) {
            return null;
        }

        Alert alert = new Alert(
            null,
            subject.brand(),
            subject.surface(),
            subject.metric(),
            targetDate,
            result.severity().value(),
            result.zscore(),
            result.pctDelta(),
            result.evaluated() ? result.median() : null,
            result.evaluated() ? result.mad() : null,
            result.actualValue(),
            result.dataPoints(),
            result.weekdayAdjusted(),
            result.message(),
            false,
            null,
            null,
            null,
            clock.instant());

        Alert saved = alertRepository.save(alert);
        log.info("Alert created: id={}, subject={}, date={}, severity={}, zscore={}, pctDelta={}",
            saved.id(), subject, targetDate, saved.severity(),
            String.format("%+.2f", saved.zscore()), result.pctDeltaFormatted());
        return saved;
    }

    /**
     * 確認告警。
     *
     * <p>已確認的告警原樣回傳，不覆寫原確認者。
     *
     * @param alertId 告警 ID
     * @param acknowledgedBy 確認者
     * @return 確認後的告警
     * @throws AlertNotFoundException 找不到告警
     */
    public Alert acknowledge(String alertId, String acknowledgedBy) {
        Alert alert = alertRepository.findById(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));

        if (alert.acknowledged()) {
            log.debug("Alert {} already acknowledged by {}", alertId, alert.acknowledgedBy());
            return alert;
        }

        Alert acknowledged = alertRepository.save(alert.acknowledge(acknowledgedBy, clock.instant()));
        log.info("Alert acknowledged: id={}, by={}", alertId, acknowledgedBy);
        return acknowledged;
    }

    /**
     * 設定通知戳記，由告警發佈成功後呼叫。
     *
     * @throws AlertNotFoundException 找不到告警
     */
    public Alert markNotified(String alertId, Instant notifiedAt) {
        Alert alert = alertRepository.findById(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        return alertRepository.save(alert.withNotifiedAt(notifiedAt));
    }

    public List<Alert> getAlertsForDate(LocalDate date) {
        return alertRepository.findByDateOrderByCreatedAtDesc(date);
    }

    /**
     * 查詢最近 N 天 (含今天) 的告警。
     */
    public List<Alert> getRecentAlerts(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        LocalDate from = LocalDate.now(clock).minusDays(days - 1L);
        return alertRepository.findByDateGreaterThanEqualOrderByDateDescCreatedAtDesc(from);
    }

    public List<Alert> getUnacknowledgedAlerts() {
        return alertRepository.findByAcknowledgedFalseOrderByDateDescCreatedAtDesc();
    }
}
