package io.github.samzhu.reach.controller;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.dto.api.DailyJobResult;
import io.github.samzhu.reach.dto.api.DatePeriod;
import io.github.samzhu.reach.dto.api.IngestionRangeRequest;
import io.github.samzhu.reach.dto.api.IngestionRangeResponse;
import io.github.samzhu.reach.dto.api.IngestionStats;
import io.github.samzhu.reach.service.AnomalyCheckService;
import io.github.samzhu.reach.service.DailyJobService;
import io.github.samzhu.reach.service.IngestionService;

/**
 * 作業觸發 REST API 控制器，供外部排程器呼叫。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/jobs/daily?date=} - 每日作業 (擷取 + 異常檢查)</li>
 *   <li>{@code POST /api/v1/ingestion/range} - 日期區間擷取 (回補)</li>
 *   <li>{@code POST /api/v1/anomalies/check?date=} - 單日異常檢查</li>
 * </ul>
 *
 * <p>日期參數使用 ISO 格式：{@code YYYY-MM-DD}
 */
@RestController
@RequestMapping("/api/v1")
public class JobApiController {

    private static final Logger log = LoggerFactory.getLogger(JobApiController.class);

    private final DailyJobService dailyJobService;
    private final IngestionService ingestionService;
    private final AnomalyCheckService anomalyCheckService;

    public JobApiController(DailyJobService dailyJobService,
                            IngestionService ingestionService,
                            AnomalyCheckService anomalyCheckService) {
        this.dailyJobService = dailyJobService;
        this.ingestionService = ingestionService;
        this.anomalyCheckService = anomalyCheckService;
    }

    /**
     * 執行每日作業，未指定日期時為昨天。
     */
    @PostMapping("/jobs/daily")
    public ResponseEntity<DailyJobResult> runDailyJob(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("API request: runDailyJob date={}", date);
        return ResponseEntity.ok(dailyJobService.run(date));
    }

    /**
     * 擷取日期區間。
     *
     * <p>端點：{@code POST /api/v1/ingestion/range}
     *
     * @param request 區間與平行設定
     * @return 區間與合計統計；起始日期晚於結束日期時回傳 400
     */
    @PostMapping("/ingestion/range")
    public ResponseEntity<IngestionRangeResponse> ingestRange(@RequestBody @Validated IngestionRangeRequest request) {
        boolean parallel = Boolean.TRUE.equals(request.parallel());
        int maxWorkers = request.maxWorkers() != null ? request.maxWorkers() : 0;
        log.info("API request: ingestRange {} to {}, parallel={}, maxWorkers={}",
            request.start(), request.end(), parallel, maxWorkers);

        if (request.start().isAfter(request.end())) {
            return ResponseEntity.badRequest().build();
        }

        DatePeriod period = new DatePeriod(request.start(), request.end());
        IngestionStats stats = ingestionService.ingestDateRange(period.start(), period.end(), parallel, maxWorkers);
        return ResponseEntity.ok(new IngestionRangeResponse(period, period.days(), parallel, stats));
    }

    /**
     * 執行單日異常檢查。
     *
     * @return 新建立的告警
     */
    @PostMapping("/anomalies/check")
    public ResponseEntity<List<Alert>> checkAnomalies(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("API request: checkAnomalies date={}", date);
        return ResponseEntity.ok(anomalyCheckService.checkDate(date).alerts());
    }
}
