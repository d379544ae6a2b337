package io.github.samzhu.reach.document;

import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 每日流量量測文件。
 *
 * <p>識別鍵為 {@code (brand, surface, metric, date, siteId, preliminary)}，
 * 同一識別鍵只會有一筆文件：
 * <ul>
 *   <li>文件 ID 由識別鍵推導，upsert 以 {@code _id} 為條件，單筆操作具原子性</li>
 *   <li>唯一複合索引 {@code uq_measurement_identity} 防止不同寫入路徑產生重複</li>
 * </ul>
 *
 * <p>暫定值 (preliminary) 與最終值 (final) 為不同識別鍵，兩者可同時存在。
 *
 * <p>文件 ID 格式：{@code {date}_{brand}_{surface}_{metric}_{siteId}_{P|F}}，
 * 例如 {@code 2025-01-14_vol_web_pageimpressions_at_w_atvol_F}
 *
 * @param id 由識別鍵推導的文件 ID
 * @param brand 品牌 (小寫)
 * @param surface 平台 (小寫)
 * @param metric 指標代碼，例如 {@code pageimpressions}
 * @param date 量測日期
 * @param siteId 上游網站識別碼
 * @param valueTotal 總量
 * @param valueNational 國內量，可為 null
 * @param valueInternational 國外量，可為 null
 * @param valueIomp 同意制 (pseudonymous) 總量，可為 null
 * @param valueIomb 普查制 (consentless) 總量，可為 null
 * @param preliminary 是否為暫定值
 * @param exportedAt 上游匯出時間，可為 null
 * @param version 上游資料版本，可為 null
 * @param ingestedAt 首次寫入時間
 * @param updatedAt 最後寫入時間
 */
@Document(collection = "measurements")
@CompoundIndex(
    name = "uq_measurement_identity",
    def = "{'brand': 1, 'surface': 1, 'metric': 1, 'date': 1, 'siteId': 1, 'preliminary': 1}",
    unique = true)
public record Measurement(
    @Id String id,
    String brand,
    String surface,
    String metric,
    LocalDate date,
    String siteId,

    long valueTotal,
    Long valueNational,
    Long valueInternational,
    Long valueIomp,
    Long valueIomb,

    boolean preliminary,
    Instant exportedAt,
    String version,

    Instant ingestedAt,
    Instant updatedAt
) {

    /**
     * 建立待寫入的量測，系統時間欄位由儲存層指定。
     */
    public static Measurement of(
            String brand, String surface, String metric, LocalDate date, String siteId,
            long valueTotal, Long valueNational, Long valueInternational, Long valueIomp, Long valueIomb,
            boolean preliminary, Instant exportedAt, String version) {
        return new Measurement(
            createId(date, brand, surface, metric, siteId, preliminary),
            brand, surface, metric, date, siteId,
            valueTotal, valueNational, valueInternational, valueIomp, valueIomb,
            preliminary, exportedAt, version,
            null, null);
    }

    /**
     * 產生複合主鍵。
     *
     * @param date 日期
     * @param brand 品牌
     * @param surface 平台
     * @param metric 指標代碼
     * @param siteId 網站識別碼
     * @param preliminary 是否為暫定值
     * @return 複合 ID，格式為 {@code YYYY-MM-DD_brand_surface_metric_siteId_P|F}
     */
    public static String createId(LocalDate date, String brand, String surface, String metric,
                                  String siteId, boolean preliminary) {
        return date.toString() + "_" + brand + "_" + surface + "_" + metric + "_" + siteId
            + "_" + (preliminary ? "P" : "F");
    }

    /**
     * 以新的系統時間欄位建立副本。
     */
    public Measurement withTimestamps(Instant ingestedAt, Instant updatedAt) {
        return new Measurement(id, brand, surface, metric, date, siteId,
            valueTotal, valueNational, valueInternational, valueIomp, valueIomb,
            preliminary, exportedAt, version, ingestedAt, updatedAt);
    }
}
