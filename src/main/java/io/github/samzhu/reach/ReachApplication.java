package io.github.samzhu.reach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Reach Service - 網站流量指標擷取與異常偵測服務。
 *
 * <p>此服務定期從計量型報表 API 取得各網站的每日流量指標，負責：
 * <ul>
 *   <li>以限流與重試機制呼叫上游指標 API</li>
 *   <li>以冪等 upsert 寫入正規化的量測資料 (每個識別鍵僅一筆)</li>
 *   <li>以中位數 / MAD 的穩健統計方法偵測異常日</li>
 *   <li>建立告警紀錄並交由下游通知服務處理</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * External Scheduler → REST trigger → IngestionService → MetricSourceClient → Reporting API
 *                                           ↓
 *                                     measurements (量測資料)
 *                                           ↓
 *                                  AnomalyCheckService → alerts (告警) → Stream (CloudEvents)
 * </pre>
 *
 * <p>服務本身不包含排程器，由外部排程 (cron) 呼叫觸發端點。
 */
@SpringBootApplication
public class ReachApplication {

    private static final Logger log = LoggerFactory.getLogger(ReachApplication.class);

    public static void main(String[] args) {
        log.info("Starting Reach Service - Traffic Metrics Ingestion");
        SpringApplication.run(ReachApplication.class, args);
    }
}
