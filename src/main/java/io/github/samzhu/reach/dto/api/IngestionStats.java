package io.github.samzhu.reach.dto.api;

/**
 * 擷取統計。
 *
 * <p>每一組 (site, metric) 只會落在其中一個計數：
 * 新增、更新、錯誤或略過 (上游尚無資料)。
 *
 * @param inserted 新增的量測筆數
 * @param updated 更新的量測筆數
 * @param errors 失敗筆數 (抓取失敗或寫入失敗)
 * @param skipped 上游尚無資料的筆數
 */
public record IngestionStats(
    int inserted,
    int updated,
    int errors,
    int skipped
) {

    public static IngestionStats empty() {
        return new IngestionStats(0, 0, 0, 0);
    }

    /**
     * 合併兩份統計。
     */
    public IngestionStats plus(IngestionStats other) {
        return new IngestionStats(
            inserted + other.inserted,
            updated + other.updated,
            errors + other.errors,
            skipped + other.skipped);
    }

    public int total() {
        return inserted + updated + errors + skipped;
    }
}
