package io.github.samzhu.reach.dto.api;

import java.time.LocalDate;
import java.util.List;

import io.github.samzhu.reach.document.Alert;

/**
 * 單日異常檢查結果。
 *
 * @param date 檢查日期
 * @param subjectsChecked 檢查的 (brand, surface, metric) 組數
 * @param evaluated 資料充足、實際完成評估的組數
 * @param alerts 新建立的告警
 * @param errors 個別組別的錯誤訊息
 */
public record AnomalyCheckResult(
    LocalDate date,
    int subjectsChecked,
    int evaluated,
    List<Alert> alerts,
    List<String> errors
) {
    public AnomalyCheckResult {
        alerts = List.copyOf(alerts);
        errors = List.copyOf(errors);
    }
}
