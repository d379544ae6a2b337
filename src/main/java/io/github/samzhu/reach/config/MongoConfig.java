package io.github.samzhu.reach.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用 Repository 自動掃描，註冊 {@code io.github.samzhu.reach.repository} 下的介面。
 * 時間欄位 ({@code ingestedAt}、{@code updatedAt}、{@code createdAt}) 由服務以注入的
 * {@link java.time.Clock} 設定，不使用 auditing。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code measurements} - 每日量測，唯一索引 {@code uq_measurement_identity}</li>
 *   <li>{@code alerts} - 異常告警</li>
 * </ul>
 *
 * <p>索引由 {@code spring.data.mongodb.auto-index-creation=true} 在啟動時建立。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.reach.repository")
public class MongoConfig {
}
