package io.github.samzhu.reach.anomaly;

/**
 * 異常偵測結果。
 *
 * <p>{@code evaluated=false} 表示資料不足無法評估，與「評估後無異常」不同，
 * 呼叫端可由 {@link #evaluated()} 或 {@link #message()} 區分兩者。
 *
 * @param outlier 是否為異常值
 * @param severity 嚴重程度
 * @param zscore 穩健 z-score
 * @param pctDelta 相對中位數的百分比差異 (有正負號，0.2 = +20%)
 * @param median 基準中位數
 * @param mad 基準 MAD
 * @param actualValue 實際值
 * @param dataPoints 基準使用的資料點數
 * @param evaluated 是否有足夠資料完成評估
 * @param weekdayAdjusted 是否只與同一星期幾比較
 * @param message 說明訊息
 */
public record AnomalyResult(
    boolean outlier,
    Severity severity,
    double zscore,
    double pctDelta,
    double median,
    double mad,
    double actualValue,
    int dataPoints,
    boolean evaluated,
    boolean weekdayAdjusted,
    String message
) {
    /**
     * 建立「資料不足」結果。
     */
    public static AnomalyResult insufficientData(double actualValue, int dataPoints, int required,
                                                 boolean weekdayAdjusted) {
        String scope = weekdayAdjusted ? " same-weekday" : "";
        return new AnomalyResult(false, Severity.NONE, 0.0, 0.0, 0.0, 0.0, actualValue, dataPoints,
            false, weekdayAdjusted,
            String.format("Insufficient data: %d of %d required%s data points", dataPoints, required, scope));
    }

    /**
     * @return 格式化的百分比差異，例如 {@code +20.0%}
     */
    public String pctDeltaFormatted() {
        return String.format("%+.1f%%", pctDelta * 100);
    }
}
