package io.github.samzhu.reach.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.reach.dto.api.AnomalyCheckResult;
import io.github.samzhu.reach.dto.api.DailyJobResult;
import io.github.samzhu.reach.dto.api.IngestionStats;
import io.github.samzhu.reach.util.DateRanges;

/**
 * 每日作業服務，由外部排程器透過 REST 端點觸發。
 *
 * <p>流程：擷取目標日期 → 執行異常檢查 → 回傳結構化結果。
 * 任何步驟的例外都轉為結果中的錯誤訊息，呼叫端一定會收到結果物件。
 */
@Service
public class DailyJobService {

    private static final Logger log = LoggerFactory.getLogger(DailyJobService.class);

    private final IngestionService ingestionService;
    private final AnomalyCheckService anomalyCheckService;
    private final Clock clock;

    public DailyJobService(IngestionService ingestionService, AnomalyCheckService anomalyCheckService,
                           Clock clock) {
        this.ingestionService = ingestionService;
        this.anomalyCheckService = anomalyCheckService;
        this.clock = clock;
    }

    /**
     * 執行每日作業。
     *
     * @param date 目標日期，null 時為昨天
     * @return 作業結果
     */
    public DailyJobResult run(LocalDate date) {
        LocalDate target = date != null ? date : DateRanges.yesterday(clock);
        long startTime = System.currentTimeMillis();
        log.info("Daily job started for {}", target);

        List<String> errors = new ArrayList<>();
        IngestionStats ingestion = IngestionStats.empty();

        try {
            ingestion = ingestionService.ingestDay(target);
        } catch (RuntimeException e) {
            log.error("Daily job ingestion failed for {}: {}", target, e.getMessage(), e);
            errors.add("Ingestion failed: " + e.getMessage());
            return finish(target, DailyJobResult.FAILED, ingestion, 0, errors, startTime);
        }
        if (ingestion.errors() > 0) {
            errors.add(ingestion.errors() + " measurements failed during ingestion");
        }

        int alertsCreated = 0;
        try {
            AnomalyCheckResult check = anomalyCheckService.checkDate(target);
            alertsCreated = check.alerts().size();
            errors.addAll(check.errors());
        } catch (RuntimeException e) {
            log.error("Daily job anomaly check failed for {}: {}", target, e.getMessage(), e);
            errors.add("Anomaly check failed: " + e.getMessage());
        }

        return finish(target, status(ingestion, errors), ingestion, alertsCreated, errors, startTime);
    }

    static String status(IngestionStats ingestion, List<String> errors) {
        if (errors.isEmpty()) {
            return DailyJobResult.SUCCESS;
        }
        boolean stored = ingestion.inserted() + ingestion.updated() > 0;
        return stored ? DailyJobResult.PARTIAL : DailyJobResult.FAILED;
    }

    private DailyJobResult finish(LocalDate date, String status, IngestionStats ingestion, int alertsCreated,
                                  List<String> errors, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        log.info("Daily job finished for {}: status={}, inserted={}, updated={}, errors={}, skipped={}, alerts={} in {}ms",
            date, status, ingestion.inserted(), ingestion.updated(), ingestion.errors(), ingestion.skipped(),
            alertsCreated, duration);
        return new DailyJobResult(date, status, ingestion, alertsCreated, errors);
    }
}
