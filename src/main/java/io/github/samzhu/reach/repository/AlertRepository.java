package io.github.samzhu.reach.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.reach.document.Alert;

/**
 * 告警資料存取介面。
 *
 * <p>提供對 {@code alerts} 集合的 CRUD 與查詢。
 */
public interface AlertRepository extends MongoRepository<Alert, String> {

    List<Alert> findByDateOrderByCreatedAtDesc(LocalDate date);

    /**
     * 查詢指定日期之後 (含) 的告警，最新的排在前面。
     */
    List<Alert> findByDateGreaterThanEqualOrderByDateDescCreatedAtDesc(LocalDate from);

    List<Alert> findByAcknowledgedFalseOrderByDateDescCreatedAtDesc();
}
