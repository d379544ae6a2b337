package io.github.samzhu.reach.client;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 解析後的單日指標資料。
 *
 * <p>欄位分類：
 * <ul>
 *   <li>IOM - 上游推估的正式總量，含國內 / 國際拆分</li>
 *   <li>IOMp - 同意 (pseudonym) 範圍的總量</li>
 *   <li>IOMb - 普查 (consentless) 範圍的總量</li>
 * </ul>
 *
 * @param siteId 網站識別碼
 * @param metric 指標
 * @param date 日期
 * @param aggregation 彙總層級
 * @param iomTotal IOM 總量
 * @param iomNational IOM 國內量
 * @param iomInternational IOM 國際量
 * @param preliminary 上游是否標記為暫定值
 * @param iompTotal IOMp 總量
 * @param iombTotal IOMb 總量
 * @param exportedAt 上游產生時間
 * @param version 上游 schema 版本
 */
public record ParsedMetric(
    String siteId,
    Metric metric,
    LocalDate date,
    Aggregation aggregation,
    Long iomTotal,
    Long iomNational,
    Long iomInternational,
    boolean preliminary,
    Long iompTotal,
    Long iombTotal,
    Instant exportedAt,
    String version
) {
    public boolean hasTotal() {
        return iomTotal != null;
    }
}
