package io.github.samzhu.reach.anomaly;

/**
 * 異常偵測的不可變設定，每次評估由呼叫端提供。
 *
 * <p>判定規則 (兩項條件獨立檢查，取較嚴重者)：
 * <pre>
 * CRITICAL: |z| ≥ criticalZscore 或 |%Δ| ≥ criticalPctDelta
 * WARNING : |z| ≥ warningZscore  或 |%Δ| ≥ warningPctDelta
 * </pre>
 *
 * @param lookbackDays 回溯天數，至少 7
 * @param minDataPoints 評估所需的最少歷史資料點，至少 3
 * @param warningZscore Warning 的穩健 z-score 門檻
 * @param warningPctDelta Warning 的百分比門檻 (0.15 = 15%)
 * @param criticalZscore Critical 的穩健 z-score 門檻
 * @param criticalPctDelta Critical 的百分比門檻 (0.20 = 20%)
 */
public record AnomalyConfig(
    int lookbackDays,
    int minDataPoints,
    double warningZscore,
    double warningPctDelta,
    double criticalZscore,
    double criticalPctDelta
) {
    /** 預設回溯 8 週。 */
    public static final int DEFAULT_LOOKBACK_DAYS = 56;
    public static final int DEFAULT_MIN_DATA_POINTS = 7;
    public static final double DEFAULT_WARNING_ZSCORE = 2.0;
    public static final double DEFAULT_WARNING_PCT_DELTA = 0.15;
    public static final double DEFAULT_CRITICAL_ZSCORE = 2.5;
    public static final double DEFAULT_CRITICAL_PCT_DELTA = 0.20;

    public AnomalyConfig {
        if (lookbackDays < 7) {
            throw new IllegalArgumentException("lookbackDays must be >= 7, got: " + lookbackDays);
        }
        if (minDataPoints < 3) {
            throw new IllegalArgumentException("minDataPoints must be >= 3, got: " + minDataPoints);
        }
        if (warningZscore >= criticalZscore) {
            throw new IllegalArgumentException(
                "warningZscore must be lower than criticalZscore: " + warningZscore + " >= " + criticalZscore);
        }
        if (warningPctDelta >= criticalPctDelta) {
            throw new IllegalArgumentException(
                "warningPctDelta must be lower than criticalPctDelta: " + warningPctDelta + " >= " + criticalPctDelta);
        }
    }

    /**
     * 建立預設設定：56 天、7 點、Warning 2.0 / 15%、Critical 2.5 / 20%。
     */
    public static AnomalyConfig defaults() {
        return new AnomalyConfig(
            DEFAULT_LOOKBACK_DAYS,
            DEFAULT_MIN_DATA_POINTS,
            DEFAULT_WARNING_ZSCORE,
            DEFAULT_WARNING_PCT_DELTA,
            DEFAULT_CRITICAL_ZSCORE,
            DEFAULT_CRITICAL_PCT_DELTA);
    }
}
