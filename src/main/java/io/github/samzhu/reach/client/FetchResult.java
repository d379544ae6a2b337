package io.github.samzhu.reach.client;

/**
 * 單次指標抓取的結果。
 *
 * <p>三種狀態：
 * <ul>
 *   <li>{@link Status#SUCCESS} - 取得資料，{@link #metric()} 不為 null</li>
 *   <li>{@link Status#NO_DATA} - 上游尚未發布 (404 或空資料)，不是錯誤</li>
 *   <li>{@link Status#FAILURE} - 失敗，{@link #failureKind()} 說明原因</li>
 * </ul>
 *
 * @param status 狀態
 * @param metric 解析後資料
 * @param failureKind 失敗分類
 * @param message 說明訊息
 * @param httpStatus 最後一次 HTTP 狀態碼，0 表示沒有回應
 * @param attempts 實際嘗試次數
 */
public record FetchResult(
    Status status,
    ParsedMetric metric,
    FailureKind failureKind,
    String message,
    int httpStatus,
    int attempts
) {
    public enum Status {
        SUCCESS,
        NO_DATA,
        FAILURE
    }

    public static FetchResult success(ParsedMetric metric, int attempts) {
        return new FetchResult(Status.SUCCESS, metric, null, null, 200, attempts);
    }

    public static FetchResult noData(String message, int httpStatus, int attempts) {
        return new FetchResult(Status.NO_DATA, null, null, message, httpStatus, attempts);
    }

    public static FetchResult failure(FailureKind kind, String message, int httpStatus, int attempts) {
        return new FetchResult(Status.FAILURE, null, kind, message, httpStatus, attempts);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isNoData() {
        return status == Status.NO_DATA;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }
}
