package io.github.samzhu.reach.client;

/**
 * API 用戶端的使用統計。
 *
 * @param totalRequests 已送出的 HTTP 請求數 (含重試)
 * @param totalErrors 非 2xx 或連線失敗的請求數
 * @param rateLimitWaitMs 累計等待限流 token 的毫秒數
 */
public record ClientStats(
    long totalRequests,
    long totalErrors,
    long rateLimitWaitMs
) {
    /**
     * @return 錯誤率 (0.0 - 1.0)
     */
    public double errorRate() {
        return (double) totalErrors / Math.max(1, totalRequests);
    }
}
