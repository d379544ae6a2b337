package io.github.samzhu.reach.anomaly;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 基於中位數 / MAD (Median Absolute Deviation) 的穩健異常偵測器。
 *
 * <p>計算方式：
 * <pre>
 * median = median(X)
 * MAD    = median(|Xi - median|)
 * z      = (actual - median) / (1.4826 × MAD)      MAD = 0 時 z = 0
 * %Δ     = (actual - median) / median              median = 0 時 %Δ = 0
 * </pre>
 *
 * <p>常數 1.4826 使 MAD 在常態分布下成為標準差的一致估計量。
 *
 * <p>流量有明顯的週期性，週一與同週週六比較會產生誤報，因此
 * {@link #analyzeByWeekday} 只與同一星期幾的歷史資料比較；若過濾後資料不足，
 * 回傳「資料不足」結果，不會退回使用未過濾的序列。
 *
 * <p>此類別無狀態、不依賴時鐘，相同輸入必得相同結果，可在多執行緒間共用。
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    /** MAD 常態一致性係數。 */
    public static final double MAD_CONSISTENCY_FACTOR = 1.4826;

    /**
     * 分析目標值相對歷史序列是否為異常。
     *
     * <p>歷史序列中日期不早於 {@code targetDate} 的資料不列入基準。
     *
     * @param history 歷史資料 (日期, 數值)
     * @param targetDate 目標日期
     * @param targetValue 目標日期的實際值
     * @param config 偵測設定
     * @return 偵測結果
     */
    public AnomalyResult analyze(List<DailyValue> history, LocalDate targetDate, double targetValue,
                                 AnomalyConfig config) {
        Objects.requireNonNull(targetDate, "targetDate must not be null");
        double[] baseline = baselineValues(history, targetDate, null);
        return evaluate(baseline, targetValue, config, false);
    }

    /**
     * 只與同一星期幾的歷史資料比較的分析。
     *
     * @param history 歷史資料 (日期, 數值)
     * @param targetDate 目標日期
     * @param targetValue 目標日期的實際值
     * @param config 偵測設定
     * @return 偵測結果，{@code weekdayAdjusted=true}
     */
    public AnomalyResult analyzeByWeekday(List<DailyValue> history, LocalDate targetDate, double targetValue,
                                          AnomalyConfig config) {
        Objects.requireNonNull(targetDate, "targetDate must not be null");
        double[] baseline = baselineValues(history, targetDate, targetDate.getDayOfWeek());
        return evaluate(baseline, targetValue, config, true);
    }

    /**
     * 分析一段包含目標日期的量測序列。
     *
     * <p>目標值取自序列中 {@code targetDate} 那一筆；若序列中沒有該日資料，
     * 回傳未評估結果。
     *
     * @param series 含目標日期的序列
     * @param targetDate 目標日期
     * @param useWeekday 是否只與同一星期幾比較
     * @param config 偵測設定
     * @return 偵測結果
     */
    public AnomalyResult analyzeSeries(List<DailyValue> series, LocalDate targetDate, boolean useWeekday,
                                       AnomalyConfig config) {
        Optional<DailyValue> target = series.stream()
            .filter(v -> v.date().equals(targetDate))
            .findFirst();

        if (target.isEmpty()) {
            log.warn("No value for target date {} in a series of {} points", targetDate, series.size());
            return new AnomalyResult(false, Severity.NONE, 0.0, 0.0, 0.0, 0.0, 0.0, series.size(),
                false, useWeekday, "No value for target date " + targetDate);
        }

        double targetValue = target.get().value();
        return useWeekday
            ? analyzeByWeekday(series, targetDate, targetValue, config)
            : analyze(series, targetDate, targetValue, config);
    }

    private AnomalyResult evaluate(double[] baseline, double actual, AnomalyConfig config, boolean weekdayAdjusted) {
        Objects.requireNonNull(config, "AnomalyConfig must not be null");

        if (baseline.length < config.minDataPoints()) {
            log.debug("Insufficient data for anomaly detection: {} points (min: {}, weekday={})",
                baseline.length, config.minDataPoints(), weekdayAdjusted);
            return AnomalyResult.insufficientData(actual, baseline.length, config.minDataPoints(), weekdayAdjusted);
        }

        double median = median(baseline);
        double mad = mad(baseline);
        double zscore = robustZScore(actual, median, mad);
        double pctDelta = pctDelta(actual, median);

        if (median == 0) {
            // 基準為 0 時 %Δ 固定為 0，從無流量變為有流量不會被判定為異常
            log.warn("Zero baseline median over {} points, pct delta forced to 0 (actual={})",
                baseline.length, actual);
        }

        Severity severity = classify(zscore, pctDelta, config);
        boolean outlier = severity != Severity.NONE;

        String direction = pctDelta >= 0 ? "above" : "below";
        String message = outlier
            ? String.format("%s: %.1f%% %s median (z = %+.2f)",
                severity.name(), Math.abs(pctDelta) * 100, direction, zscore)
            : String.format("No anomaly: %+.1f%% vs median (z = %+.2f)", pctDelta * 100, zscore);

        return new AnomalyResult(outlier, severity, zscore, pctDelta, median, mad, actual,
            baseline.length, true, weekdayAdjusted, message);
    }

    /**
     * 依 z-score 與百分比差異判定嚴重程度，兩項條件獨立檢查。
     */
    static Severity classify(double zscore, double pctDelta, AnomalyConfig config) {
        double absZ = Math.abs(zscore);
        double absPct = Math.abs(pctDelta);

        if (absZ >= config.criticalZscore() || absPct >= config.criticalPctDelta()) {
            return Severity.CRITICAL;
        }
        if (absZ >= config.warningZscore() || absPct >= config.warningPctDelta()) {
            return Severity.WARNING;
        }
        return Severity.NONE;
    }

    private static double[] baselineValues(List<DailyValue> history, LocalDate targetDate, DayOfWeek weekday) {
        if (history == null || history.isEmpty()) {
            return new double[0];
        }
        return history.stream()
            .filter(Objects::nonNull)
            .filter(v -> v.date().isBefore(targetDate))
            .filter(v -> weekday == null || v.date().getDayOfWeek() == weekday)
            .filter(v -> Double.isFinite(v.value()))
            .mapToDouble(DailyValue::value)
            .toArray();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    /**
     * 計算中位數，偶數個元素時取中間兩值平均。
     *
     * @param values 數值陣列 (不會被修改)
     * @return 中位數，空陣列回傳 0
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * 計算 MAD：{@code median(|Xi - median(X)|)}。
     *
     * @param values 數值陣列
     * @return MAD，空陣列回傳 0
     */
    public static double mad(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * 計算穩健 z-score。
     *
     * @param value 實際值
     * @param median 基準中位數
     * @param mad 基準 MAD
     * @return z-score，MAD 為 0 時回傳 0
     */
    public static double robustZScore(double value, double median, double mad) {
        if (mad == 0) {
            return 0.0;
        }
        return (value - median) / (MAD_CONSISTENCY_FACTOR * mad);
    }

    /**
     * 計算相對中位數的百分比差異。
     *
     * @param value 實際值
     * @param median 基準中位數
     * @return 百分比差異 (0.2 = +20%)，中位數為 0 時回傳 0
     */
    public static double pctDelta(double value, double median) {
        if (median == 0) {
            return 0.0;
        }
        return (value - median) / median;
    }
}
