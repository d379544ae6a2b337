package io.github.samzhu.reach.client;

import java.time.LocalDate;

/**
 * 上游指標來源。
 *
 * <p>實作必須可由多個執行緒同時呼叫，並共用同一個限流預算。
 * 失敗以 {@link FetchResult} 回傳而非拋出例外。
 *
 * @see ReportingApiClient
 */
public interface MetricSourceClient {

    /**
     * 抓取單一網站、單一指標、單一日期的資料。
     *
     * @param metric 指標
     * @param siteId 網站識別碼
     * @param date 日期
     * @param aggregation 彙總層級
     * @return 抓取結果
     */
    FetchResult fetch(Metric metric, String siteId, LocalDate date, Aggregation aggregation);

    /**
     * 以日彙總抓取。
     */
    default FetchResult fetch(Metric metric, String siteId, LocalDate date) {
        return fetch(metric, siteId, date, Aggregation.DAY);
    }
}
