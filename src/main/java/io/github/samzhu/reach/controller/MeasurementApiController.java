package io.github.samzhu.reach.controller;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.reach.anomaly.AnomalyConfig;
import io.github.samzhu.reach.anomaly.DailyValue;
import io.github.samzhu.reach.config.ReachProperties;
import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.dto.api.DailySummary;
import io.github.samzhu.reach.service.MeasurementQueryService;

/**
 * 量測查詢 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/measurements/summary?date=&brand=} - 每日摘要</li>
 *   <li>{@code GET /api/v1/measurements/history?brand=&surface=&metric=&endDate=&lookbackDays=} - 歷史序列</li>
 *   <li>{@code GET /api/v1/measurements/range-summary?start=&end=&brand=} - 區間摘要</li>
 *   <li>{@code GET /api/v1/measurements/latest?brand=&surface=&metric=} - 最新一筆</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/measurements")
public class MeasurementApiController {

    private static final Logger log = LoggerFactory.getLogger(MeasurementApiController.class);

    private final MeasurementQueryService queryService;
    private final ReachProperties properties;
    private final AnomalyConfig anomalyConfig;

    public MeasurementApiController(MeasurementQueryService queryService, ReachProperties properties,
                                    AnomalyConfig anomalyConfig) {
        this.queryService = queryService;
        this.properties = properties;
        this.anomalyConfig = anomalyConfig;
    }

    /**
     * 每日摘要，未指定品牌時回傳所有設定的品牌。
     */
    @GetMapping("/summary")
    public ResponseEntity<Map<String, DailySummary>> getDailySummary(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String brand) {
        log.debug("API request: getDailySummary date={}, brand={}", date, brand);
        List<String> brands = brand != null
            ? List.of(brand)
            : properties.sites().stream().map(ReachProperties.SiteConfig::brand).distinct().toList();
        return ResponseEntity.ok(queryService.getDailySummaryBatch(date, brands));
    }

    @GetMapping("/history")
    public ResponseEntity<List<DailyValue>> getHistory(
            @RequestParam String brand,
            @RequestParam String surface,
            @RequestParam String metric,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer lookbackDays) {
        int days = lookbackDays != null ? lookbackDays : anomalyConfig.lookbackDays();
        if (days < 1) {
            return ResponseEntity.badRequest().build();
        }
        log.debug("API request: getHistory {}/{}/{} endDate={}, lookbackDays={}", brand, surface, metric, endDate, days);
        return ResponseEntity.ok(queryService.findHistory(brand, surface, metric, endDate, days));
    }

    @GetMapping("/range-summary")
    public ResponseEntity<Map<String, Map<String, Long>>> getRangeSummary(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String brand) {
        if (start.isAfter(end)) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(queryService.getDateRangeSummary(start, end, brand));
    }

    @GetMapping("/latest")
    public ResponseEntity<Measurement> getLatest(
            @RequestParam String brand,
            @RequestParam String surface,
            @RequestParam String metric) {
        return queryService.getLatestMeasurement(brand, surface, metric)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
