package io.github.samzhu.reach.anomaly;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 單日的量測值，作為異常偵測的歷史序列元素。
 *
 * @param date 日期
 * @param value 當日數值
 */
public record DailyValue(LocalDate date, double value) {

    public DailyValue {
        Objects.requireNonNull(date, "date must not be null");
    }
}
