package io.github.samzhu.reach.client;

import java.util.Locale;
import java.util.Optional;

/**
 * 上游報表 API 支援的指標。
 *
 * <p>每個指標對應一個端點 {@code /api/v1/{code}}，{@link #code()} 同時也是
 * 量測文件中的 {@code metric} 欄位值。
 */
public enum Metric {
    PAGE_IMPRESSIONS("pageimpressions"),
    VISITS("visits"),
    CLIENTS("clients"),
    UNIQUE_CLIENTS("uniqueclients"),
    USETIME("usetime"),
    DEVICES("devices");

    private final String code;

    Metric(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * @return API 端點路徑，例如 {@code /api/v1/pageimpressions}
     */
    public String endpoint() {
        return "/api/v1/" + code;
    }

    /**
     * 由設定中的代碼解析指標，接受 {@code pi} 作為 page impressions 的別名。
     *
     * @param code 指標代碼 (不分大小寫)
     * @return 對應的指標，未知代碼回傳 empty
     */
    public static Optional<Metric> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if ("pi".equals(normalized)) {
            return Optional.of(PAGE_IMPRESSIONS);
        }
        for (Metric metric : values()) {
            if (metric.code.equals(normalized)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
