package io.github.samzhu.reach.dto.api;

/**
 * 日期區間擷取回應。
 *
 * @param period 擷取區間
 * @param days 天數
 * @param parallel 是否平行擷取
 * @param stats 合計統計
 */
public record IngestionRangeResponse(
    DatePeriod period,
    long days,
    boolean parallel,
    IngestionStats stats
) {}
