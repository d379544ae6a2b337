package io.github.samzhu.reach.anomaly;

/**
 * 偵測對象：(brand, surface, metric)。
 *
 * @param brand 品牌
 * @param surface 平台
 * @param metric 指標代碼
 */
public record MetricSubject(String brand, String surface, String metric) {

    @Override
    public String toString() {
        return brand + "/" + surface + "/" + metric;
    }
}
