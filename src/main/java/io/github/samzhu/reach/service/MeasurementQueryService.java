package io.github.samzhu.reach.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.reach.anomaly.DailyValue;
import io.github.samzhu.reach.client.Metric;
import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.dto.api.DailySummary;
import io.github.samzhu.reach.repository.MeasurementStore;
import io.github.samzhu.reach.repository.MeasurementStore.GroupTotal;

/**
 * 量測查詢服務。
 *
 * <p>提供異常偵測所需的歷史序列，以及每日摘要、區間摘要等讀取功能。
 * 所有查詢都是單次資料庫往返。
 */
@Service
public class MeasurementQueryService {

    private static final Logger log = LoggerFactory.getLogger(MeasurementQueryService.class);

    public static final Set<String> WEB_SURFACES = Set.of("web", "web_desktop", "web_mobile");
    public static final Set<String> APP_SURFACES = Set.of("app", "ios", "android");

    private final MeasurementStore store;

    public MeasurementQueryService(MeasurementStore store) {
        this.store = store;
    }

    /**
     * 查詢偵測用的歷史序列。
     *
     * <p>日期範圍為 {@code [endDate - lookbackDays, endDate]}，每天一個值：
     * <ul>
     *   <li>同一網站同一天有最終值時取最終值，否則取暫定值</li>
     *   <li>同一 (brand, surface) 下多個網站的值加總</li>
     * </ul>
     *
     * <p>結束日若缺少窗口內任何一天出現過的網站，視為資料不完整，不回傳該日的值；
     * 偵測端會因此回報「目標日無值」而不評估，而非產生誤報。
     *
     * @param brand 品牌
     * @param surface 平台
     * @param metric 指標代碼
     * @param endDate 結束日期（含）
     * @param lookbackDays 回溯天數
     * @return 依日期升冪排列的序列
     */
    public List<DailyValue> findHistory(String brand, String surface, String metric,
                                        LocalDate endDate, int lookbackDays) {
        LocalDate from = endDate.minusDays(lookbackDays);
        List<Measurement> rows = store.findSeries(brand, surface, metric, from, endDate);

        // date -> siteId -> 選定的量測
        Map<LocalDate, Map<String, Measurement>> byDate = new TreeMap<>();
        for (Measurement m : rows) {
            Map<String, Measurement> sites = byDate.computeIfAbsent(m.date(), d -> new LinkedHashMap<>());
            Measurement current = sites.get(m.siteId());
            if (current == null || (current.preliminary() && !m.preliminary())) {
                sites.put(m.siteId(), m);
            }
        }

        // 結束日缺少窗口內出現過的網站時，部分加總會被誤判為下跌，該日不列入序列
        Map<String, Measurement> endSites = byDate.get(endDate);
        if (endSites != null) {
            Set<String> missing = new TreeSet<>();
            byDate.values().forEach(sites -> missing.addAll(sites.keySet()));
            missing.removeAll(endSites.keySet());
            if (!missing.isEmpty()) {
                log.warn("Incomplete day {}/{}/{} on {}: missing sites {}, excluded from history",
                    brand, surface, metric, endDate, missing);
                byDate.remove(endDate);
            }
        }

        List<DailyValue> history = new ArrayList<>(byDate.size());
        byDate.forEach((date, sites) -> {
            long sum = sites.values().stream().mapToLong(Measurement::valueTotal).sum();
            history.add(new DailyValue(date, sum));
        });

        log.debug("History {}/{}/{} from {} to {}: {} rows, {} days",
            brand, surface, metric, from, endDate, rows.size(), history.size());
        return history;
    }

    /**
     * 以單次分組查詢取得多個品牌的每日摘要。
     *
     * @param date 日期
     * @param brands 品牌清單，空集合表示全部品牌
     * @return 品牌 → 摘要；查詢範圍內沒有資料的品牌對應空摘要
     */
    public Map<String, DailySummary> getDailySummaryBatch(LocalDate date, Collection<String> brands) {
        List<GroupTotal> totals = store.sumByDay(date, brands);

        Map<String, long[]> buckets = new TreeMap<>();
        brands.forEach(b -> buckets.put(b, new long[4]));

        for (GroupTotal total : totals) {
            long[] bucket = buckets.computeIfAbsent(total.brand(), b -> new long[4]);
            boolean web = WEB_SURFACES.contains(total.surface());
            boolean app = APP_SURFACES.contains(total.surface());
            if (Metric.PAGE_IMPRESSIONS.code().equals(total.metric())) {
                if (web) {
                    bucket[0] += total.total();
                } else if (app) {
                    bucket[1] += total.total();
                }
            } else if (Metric.VISITS.code().equals(total.metric())) {
                if (web) {
                    bucket[2] += total.total();
                } else if (app) {
                    bucket[3] += total.total();
                }
            }
        }

        Map<String, DailySummary> result = new LinkedHashMap<>();
        buckets.forEach((brand, b) -> result.put(brand, new DailySummary(b[0], b[1], b[2], b[3])));
        return result;
    }

    /**
     * 單一品牌的每日摘要。
     */
    public DailySummary getDailySummary(LocalDate date, String brand) {
        return getDailySummaryBatch(date, List.of(brand)).getOrDefault(brand, DailySummary.empty());
    }

    /**
     * 區間摘要。
     *
     * @param start 起始日期（含）
     * @param end 結束日期（含）
     * @param brand 品牌，null 表示全部
     * @return 指標 → (平台 → 總量)
     */
    public Map<String, Map<String, Long>> getDateRangeSummary(LocalDate start, LocalDate end, String brand) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        Map<String, Map<String, Long>> summary = new TreeMap<>();
        for (GroupTotal total : store.sumByRange(start, end, brand)) {
            summary.computeIfAbsent(total.metric(), m -> new TreeMap<>())
                .merge(total.surface(), total.total(), Long::sum);
        }
        return summary;
    }

    /**
     * 最新一筆量測。
     */
    public Optional<Measurement> getLatestMeasurement(String brand, String surface, String metric) {
        return store.findLatest(brand, surface, metric);
    }
}
