package io.github.samzhu.reach.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 日期區間工具類。
 */
public final class DateRanges {

    private DateRanges() {
        // 工具類不允許實例化
    }

    /**
     * 列出區間內的每一天。
     *
     * @param start 起始日期（含）
     * @param end 結束日期（含）
     * @return 升冪排列的日期
     * @throws IllegalArgumentException 起始日期晚於結束日期
     */
    public static List<LocalDate> datesBetween(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        List<LocalDate> dates = new ArrayList<>((int) daysInclusive(start, end));
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    /**
     * 區間天數（含頭尾）。
     */
    public static long daysInclusive(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * 每日作業的預設目標日期：昨天。
     */
    public static LocalDate yesterday(Clock clock) {
        return LocalDate.now(clock).minusDays(1);
    }
}
