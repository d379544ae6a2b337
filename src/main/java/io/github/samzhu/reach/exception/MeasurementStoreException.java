package io.github.samzhu.reach.exception;

/**
 * 量測寫入或查詢失敗時拋出，包裝底層的資料存取例外。
 *
 * <p>擷取流程捕捉此例外後，將該批次筆數計入錯誤數並繼續處理。
 */
public class MeasurementStoreException extends RuntimeException {

    public MeasurementStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
