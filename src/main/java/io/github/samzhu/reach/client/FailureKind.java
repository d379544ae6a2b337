package io.github.samzhu.reach.client;

/**
 * 抓取失敗的分類。
 */
public enum FailureKind {
    /** 401/403，憑證問題，不重試。 */
    AUTH,
    /** 5xx、429、逾時或連線錯誤，重試用盡。 */
    TRANSIENT,
    /** 其他 4xx，不重試。 */
    CLIENT_ERROR,
    /** 200 但內容無法解析。 */
    MALFORMED_RESPONSE,
    /** 在等待上限內取不到限流 token。 */
    RATE_LIMITED
}
