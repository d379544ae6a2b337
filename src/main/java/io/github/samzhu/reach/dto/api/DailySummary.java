package io.github.samzhu.reach.dto.api;

/**
 * 單一品牌的每日摘要。
 *
 * <p>Web 包含 {@code web}、{@code web_desktop}、{@code web_mobile}；
 * App 包含 {@code app}、{@code ios}、{@code android}。
 *
 * @param webPi Web page impressions
 * @param appPi App page impressions
 * @param webVisits Web visits
 * @param appVisits App visits
 */
public record DailySummary(
    long webPi,
    long appPi,
    long webVisits,
    long appVisits
) {

    public static DailySummary empty() {
        return new DailySummary(0, 0, 0, 0);
    }

    public long totalPi() {
        return webPi + appPi;
    }

    public long totalVisits() {
        return webVisits + appVisits;
    }
}
