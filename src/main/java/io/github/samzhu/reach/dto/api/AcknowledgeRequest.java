package io.github.samzhu.reach.dto.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 告警確認請求。
 *
 * <p>用於 PUT /api/v1/alerts/{id}/acknowledge 端點。
 */
public record AcknowledgeRequest(
    @NotBlank(message = "acknowledgedBy is required")
    @Size(max = 100, message = "acknowledgedBy must be at most 100 characters")
    String acknowledgedBy
) {}
