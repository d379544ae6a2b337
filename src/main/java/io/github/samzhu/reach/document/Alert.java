package io.github.samzhu.reach.document;

import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 異常告警文件。
 *
 * <p>每次偵測到異常就新增一筆，不做去重，也不會被刪除。
 * 建立後只有兩種寫入：
 * <ul>
 *   <li>確認 (acknowledge) - 設定 {@code acknowledged}、{@code acknowledgedBy}、{@code acknowledgedAt}</li>
 *   <li>通知戳記 - 告警交付下游後設定 {@code notifiedAt}</li>
 * </ul>
 *
 * <p>{@code severity} 以小寫字串儲存：{@code warning} 或 {@code critical}。
 *
 * @see io.github.samzhu.reach.anomaly.Severity
 */
@Document(collection = "alerts")
@CompoundIndex(name = "idx_alert_date", def = "{'date': -1, 'createdAt': -1}")
public record Alert(
    @Id String id,
    String brand,
    String surface,
    String metric,
    LocalDate date,

    String severity,
    double zscore,
    double pctDelta,
    Double baselineMedian,
    Double baselineMad,
    double actualValue,
    int dataPoints,
    boolean weekdayAdjusted,
    String message,

    boolean acknowledged,
    String acknowledgedBy,
    Instant acknowledgedAt,
    Instant notifiedAt,
    Instant createdAt
) {

    /**
     * 標記為已確認。
     *
     * @param by 確認者
     * @param at 確認時間
     * @return 已確認的副本
     */
    public Alert acknowledge(String by, Instant at) {
        return new Alert(id, brand, surface, metric, date, severity, zscore, pctDelta,
            baselineMedian, baselineMad, actualValue, dataPoints, weekdayAdjusted, message,
            true, by, at, notifiedAt, createdAt);
    }

    /**
     * 設定通知戳記。
     */
    public Alert withNotifiedAt(Instant at) {
        return new Alert(id, brand, surface, metric, date, severity, zscore, pctDelta,
            baselineMedian, baselineMad, actualValue, dataPoints, weekdayAdjusted, message,
            acknowledged, acknowledgedBy, acknowledgedAt, at, createdAt);
    }
}
