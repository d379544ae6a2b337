package io.github.samzhu.reach.client;

/**
 * 上游 API 的彙總層級。
 */
public enum Aggregation {
    DAY,
    MONTH
}
