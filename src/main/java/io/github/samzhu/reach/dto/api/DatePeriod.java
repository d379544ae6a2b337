package io.github.samzhu.reach.dto.api;

import java.time.LocalDate;

import io.github.samzhu.reach.util.DateRanges;

/**
 * API 回應中的日期區間，頭尾皆包含。
 *
 * @param start 起始日期
 * @param end 結束日期
 */
public record DatePeriod(
    LocalDate start,
    LocalDate end
) {
    public DatePeriod {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid period: " + start + " to " + end);
        }
    }

    public long days() {
        return DateRanges.daysInclusive(start, end);
    }
}
