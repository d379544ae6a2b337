package io.github.samzhu.reach.controller;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.dto.api.AcknowledgeRequest;
import io.github.samzhu.reach.exception.AlertNotFoundException;
import io.github.samzhu.reach.service.AlertService;

/**
 * 告警 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/alerts?date=} - 指定日期的告警</li>
 *   <li>{@code GET /api/v1/alerts/recent?days=} - 最近 N 天的告警</li>
 *   <li>{@code GET /api/v1/alerts/unacknowledged} - 未確認的告警</li>
 *   <li>{@code PUT /api/v1/alerts/{id}/acknowledge} - 確認告警</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/alerts")
public class AlertApiController {

    private static final Logger log = LoggerFactory.getLogger(AlertApiController.class);

    private final AlertService alertService;

    public AlertApiController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public ResponseEntity<List<Alert>> getAlertsForDate(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(alertService.getAlertsForDate(date));
    }

    @GetMapping("/recent")
    public ResponseEntity<List<Alert>> getRecentAlerts(@RequestParam(defaultValue = "7") int days) {
        if (days < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(alertService.getRecentAlerts(days));
    }

    @GetMapping("/unacknowledged")
    public ResponseEntity<List<Alert>> getUnacknowledgedAlerts() {
        return ResponseEntity.ok(alertService.getUnacknowledgedAlerts());
    }

    /**
     * 確認告警。
     *
     * <p>端點：{@code PUT /api/v1/alerts/{id}/acknowledge}
     *
     * @return 確認後的告警；找不到時回傳 404
     */
    @PutMapping("/{id}/acknowledge")
    public ResponseEntity<Alert> acknowledge(
            @PathVariable String id,
            @RequestBody @Validated AcknowledgeRequest request) {
        log.info("API request: acknowledge alert id={}, by={}", id, request.acknowledgedBy());
        try {
            return ResponseEntity.ok(alertService.acknowledge(id, request.acknowledgedBy()));
        } catch (AlertNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
