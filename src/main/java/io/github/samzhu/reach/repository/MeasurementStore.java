package io.github.samzhu.reach.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import io.github.samzhu.reach.document.Measurement;

/**
 * 量測儲存介面。
 *
 * <p>寫入語意：以識別鍵 upsert，識別鍵不存在時新增 (設定 {@code ingestedAt})，
 * 存在時更新數值欄位與 {@code updatedAt}，絕不產生重複識別鍵。
 * 同一識別鍵的並行寫入由儲存層序列化。
 *
 * <p>實作透過建構子注入傳給使用者，不使用全域實例。
 */
public interface MeasurementStore {

    /**
     * 批次 upsert。
     *
     * @param measurements 要寫入的量測，同一批中重複的識別鍵以最後一筆為準
     * @return 新增與更新筆數
     * @throws io.github.samzhu.reach.exception.MeasurementStoreException 寫入失敗
     */
    UpsertResult upsertAll(List<Measurement> measurements);

    /**
     * 查詢單一 (brand, surface, metric) 在日期區間內的所有量測，依日期升冪。
     *
     * @param from 起日 (含)
     * @param to 迄日 (含)
     */
    List<Measurement> findSeries(String brand, String surface, String metric, LocalDate from, LocalDate to);

    /**
     * 以單次分組查詢加總指定日期的量測。
     *
     * <p>同一網站同一天同時有暫定值與最終值時只計最終值。
     *
     * @param date 日期
     * @param brands 品牌清單，空集合表示全部
     * @return 依 (brand, surface, metric) 分組的總量
     */
    List<GroupTotal> sumByDay(LocalDate date, Collection<String> brands);

    /**
     * 以單次分組查詢加總日期區間內的量測。
     *
     * @param from 起日 (含)
     * @param to 迄日 (含)
     * @param brand 品牌，null 表示全部
     * @return 依 (surface, metric) 分組的總量，{@code brand} 欄位為 null
     */
    List<GroupTotal> sumByRange(LocalDate from, LocalDate to, String brand);

    /**
     * 查詢最新一筆量測，同日期時最終值優先。
     */
    Optional<Measurement> findLatest(String brand, String surface, String metric);

    /**
     * upsert 結果。
     *
     * @param inserted 新增筆數
     * @param updated 更新筆數
     */
    record UpsertResult(int inserted, int updated) {

        public static UpsertResult empty() {
            return new UpsertResult(0, 0);
        }

        public UpsertResult plus(UpsertResult other) {
            return new UpsertResult(inserted + other.inserted, updated + other.updated);
        }
    }

    /**
     * 分組加總結果。
     */
    record GroupTotal(String brand, String surface, String metric, long total) {}
}
