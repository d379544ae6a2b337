package io.github.samzhu.reach.event;

import java.time.Instant;
import java.time.LocalDate;

import io.github.samzhu.reach.document.Alert;

/**
 * 告警事件的 CloudEvent data。
 */
public record AlertEvent(
    String alertId,
    String brand,
    String surface,
    String metric,
    LocalDate date,
    String severity,
    double zscore,
    double pctDelta,
    Double baselineMedian,
    double actualValue,
    int dataPoints,
    boolean weekdayAdjusted,
    String message,
    Instant createdAt
) {

    public static AlertEvent from(Alert alert) {
        return new AlertEvent(
            alert.id(),
            alert.brand(),
            alert.surface(),
            alert.metric(),
            alert.date(),
            alert.severity(),
            alert.zscore(),
            alert.pctDelta(),
            alert.baselineMedian(),
            alert.actualValue(),
            alert.dataPoints(),
            alert.weekdayAdjusted(),
            alert.message(),
            alert.createdAt());
    }
}
