package io.github.samzhu.reach.dto.api;

import java.time.LocalDate;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 日期區間擷取請求。
 *
 * <p>用於 POST /api/v1/ingestion/range 端點。
 *
 * @param start 起始日期（含）
 * @param end 結束日期（含）
 * @param parallel 是否平行擷取，預設循序
 * @param maxWorkers 平行擷取的 worker 數，未指定時使用設定值
 */
public record IngestionRangeRequest(
    @NotNull(message = "start is required")
    LocalDate start,

    @NotNull(message = "end is required")
    LocalDate end,

    Boolean parallel,

    @Positive(message = "maxWorkers must be positive")
    @Max(value = 32, message = "maxWorkers must not exceed 32")
    Integer maxWorkers
) {}
