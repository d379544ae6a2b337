package io.github.samzhu.reach.dto.api;

import java.time.LocalDate;
import java.util.List;

/**
 * 每日作業結果。
 *
 * <p>{@code status}：
 * <ul>
 *   <li>{@code success} - 擷取與檢查皆無錯誤</li>
 *   <li>{@code partial} - 有部分錯誤，但仍有資料寫入或完成檢查</li>
 *   <li>{@code failed} - 擷取沒有任何成功寫入且有錯誤，或作業中斷</li>
 * </ul>
 *
 * @param date 目標日期
 * @param status 作業狀態
 * @param ingestion 擷取統計
 * @param alertsCreated 新建立的告警數
 * @param errors 錯誤訊息
 */
public record DailyJobResult(
    LocalDate date,
    String status,
    IngestionStats ingestion,
    int alertsCreated,
    List<String> errors
) {
    public static final String SUCCESS = "success";
    public static final String PARTIAL = "partial";
    public static final String FAILED = "failed";

    public DailyJobResult {
        errors = List.copyOf(errors);
    }
}
