package io.github.samzhu.reach.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.reach.document.Measurement;

/**
 * 量測資料存取介面。
 *
 * <p>寫入與分組查詢透過 {@link MongoMeasurementStore} 使用 MongoTemplate 完成，
 * 此介面只提供簡單的衍生查詢。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface MeasurementRepository extends MongoRepository<Measurement, String> {

    /**
     * 查詢最新一筆量測，日期降冪，同日期時最終值 ({@code preliminary=false}) 排在前面。
     */
    Optional<Measurement> findFirstByBrandAndSurfaceAndMetricOrderByDateDescPreliminaryAsc(
        String brand, String surface, String metric);
}
