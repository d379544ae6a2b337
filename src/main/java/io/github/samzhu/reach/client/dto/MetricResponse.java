package io.github.samzhu.reach.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 上游報表 API 的回應結構。
 *
 * <p>回應範例：
 * <pre>
 * {
 *   "metadata": { "exported_at": "2025-12-02T06:15:00Z", "version": "1.2" },
 *   "data": {
 *     "iom":  [ { "pis": 812345, "pisnat": 700000, "pisint": 112345, "preliminary": false } ],
 *     "iomp": [ { "pis": 512000 } ],
 *     "iomb": [ { "pis": 90000 } ]
 *   }
 * }
 * </pre>
 *
 * <p>各資料節點可能是陣列或單一物件，兩種格式皆接受。
 *
 * @param metadata 匯出資訊
 * @param data 量測資料
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricResponse(
    Metadata metadata,
    Data data
) {
    /**
     * @param exportedAt 上游產生時間 (ISO-8601)
     * @param version 上游 schema 版本
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
        @JsonProperty("exported_at") String exportedAt,
        String version
    ) {}

    /**
     * @param iom 推估總量
     * @param iomp 同意範圍總量
     * @param iomb 普查範圍總量
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<ValueNode> iom,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<ValueNode> iomp,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<ValueNode> iomb
    ) {}

    /**
     * 單一資料節點，依指標不同只會出現部分欄位。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueNode(
        Long pis,
        Long pisnat,
        Long pisint,
        Long visits,
        Long visitsnat,
        Long visitsint,
        Long clients,
        Long uniqueclients,
        Boolean preliminary
    ) {
        /**
         * @return 第一個存在的總量欄位
         */
        public Long total() {
            return firstNonNull(pis, visits, clients, uniqueclients);
        }

        public Long national() {
            return firstNonNull(pisnat, visitsnat);
        }

        public Long international() {
            return firstNonNull(pisint, visitsint);
        }

        private static Long firstNonNull(Long... values) {
            for (Long value : values) {
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
    }

    /**
     * 取得節點清單中的第一個節點。
     *
     * @param nodes 節點清單，可能為 null
     * @return 第一個節點，沒有時回傳 null
     */
    public static ValueNode first(List<ValueNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return null;
        }
        return nodes.get(0);
    }
}
