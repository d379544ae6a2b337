package io.github.samzhu.reach.repository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;

import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.exception.MeasurementStoreException;

/**
 * 以 MongoDB 實作的量測儲存。
 *
 * <p>寫入使用 {@link BulkOperations} UNORDERED 模式，每筆以 {@code _id} 為條件 upsert：
 * <ul>
 *   <li>{@code $setOnInsert} - 識別欄位與 {@code ingestedAt}</li>
 *   <li>{@code $set} - 數值欄位與 {@code updatedAt}</li>
 * </ul>
 *
 * <p>兩個寫入者同時新增同一識別鍵時，落敗者會收到 duplicate key (11000) 錯誤，
 * 此時該筆改以更新重試一次。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/template-update.html">Spring Data MongoDB Update Operations</a>
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/aggregation-framework.html">Aggregation Framework Support</a>
 */
@Repository
public class MongoMeasurementStore implements MeasurementStore {

    private static final Logger log = LoggerFactory.getLogger(MongoMeasurementStore.class);

    static final int DUPLICATE_KEY = 11000;

    private final MongoTemplate mongoTemplate;
    private final MeasurementRepository measurementRepository;
    private final Clock clock;

    public MongoMeasurementStore(MongoTemplate mongoTemplate, MeasurementRepository measurementRepository,
                                 Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.measurementRepository = measurementRepository;
        this.clock = clock;
    }

    @Override
    public UpsertResult upsertAll(List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            return UpsertResult.empty();
        }

        // 同一批中重複的識別鍵只保留最後一筆
        Map<String, Measurement> byId = new LinkedHashMap<>();
        measurements.forEach(m -> byId.put(m.id(), m));
        List<Measurement> batch = new ArrayList<>(byId.values());

        Instant now = clock.instant();
        BulkOperations bulkOps = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Measurement.class);
        batch.forEach(m -> bulkOps.upsert(idQuery(m), toUpdate(m, now)));

        try {
            BulkWriteResult result = bulkOps.execute();
            UpsertResult upsertResult = new UpsertResult(result.getUpserts().size(), result.getMatchedCount());
            log.debug("Bulk upsert: {} measurements, inserted={}, updated={}",
                batch.size(), upsertResult.inserted(), upsertResult.updated());
            return upsertResult;
        } catch (BulkOperationException e) {
            return retryLostRaces(e, batch, now);
        } catch (DataAccessException e) {
            throw new MeasurementStoreException("Bulk upsert of " + batch.size() + " measurements failed", e);
        }
    }

    private UpsertResult retryLostRaces(BulkOperationException e, List<Measurement> batch, Instant now) {
        List<BulkWriteError> errors = e.getErrors();
        boolean onlyDuplicates = !errors.isEmpty()
            && errors.stream().allMatch(error -> error.getCode() == DUPLICATE_KEY);
        if (!onlyDuplicates) {
            throw new MeasurementStoreException(
                "Bulk upsert of " + batch.size() + " measurements failed: " + errors.size() + " write errors", e);
        }

        BulkWriteResult partial = e.getResult();
        int inserted = partial.getUpserts().size();
        int updated = partial.getMatchedCount();

        log.warn("Lost upsert race on {} of {} measurements, retrying as update", errors.size(), batch.size());
        BulkOperations retryOps = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Measurement.class);
        errors.forEach(error -> {
            Measurement m = batch.get(error.getIndex());
            retryOps.upsert(idQuery(m), toUpdate(m, now));
        });

        try {
            BulkWriteResult retried = retryOps.execute();
            inserted += retried.getUpserts().size();
            updated += retried.getMatchedCount();
        } catch (DataAccessException retryFailure) {
            throw new MeasurementStoreException(
                "Retry of " + errors.size() + " conflicting measurements failed", retryFailure);
        }
        return new UpsertResult(inserted, updated);
    }

    private static Query idQuery(Measurement m) {
        return Query.query(Criteria.where("_id").is(m.id()));
    }

    private static Update toUpdate(Measurement m, Instant now) {
        return new Update()
            .setOnInsert("brand", m.brand())
            .setOnInsert("surface", m.surface())
            .setOnInsert("metric", m.metric())
            .setOnInsert("date", m.date())
            .setOnInsert("siteId", m.siteId())
            .setOnInsert("preliminary", m.preliminary())
            .setOnInsert("ingestedAt", now)
            .set("valueTotal", m.valueTotal())
            .set("valueNational", m.valueNational())
            .set("valueInternational", m.valueInternational())
            .set("valueIomp", m.valueIomp())
            .set("valueIomb", m.valueIomb())
            .set("exportedAt", m.exportedAt())
            .set("version", m.version())
            .set("updatedAt", now);
    }

    @Override
    public List<Measurement> findSeries(String brand, String surface, String metric,
                                        LocalDate from, LocalDate to) {
        Query query = Query.query(Criteria.where("brand").is(brand)
                .and("surface").is(surface)
                .and("metric").is(metric)
                .and("date").gte(from).lte(to))
            .with(Sort.by(Sort.Direction.ASC, "date"));
        return mongoTemplate.find(query, Measurement.class);
    }

    @Override
    public List<GroupTotal> sumByDay(LocalDate date, Collection<String> brands) {
        Criteria criteria = Criteria.where("date").is(date);
        if (brands != null && !brands.isEmpty()) {
            criteria = criteria.and("brand").in(brands);
        }

        // 先依網站與日期取一筆 (最終值優先)，再依 (brand, surface, metric) 加總
        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(criteria),
            Aggregation.sort(Sort.by(Sort.Direction.ASC, "preliminary")),
            Aggregation.group("brand", "surface", "metric", "siteId", "date")
                .first("valueTotal").as("valueTotal"),
            Aggregation.group("brand", "surface", "metric")
                .sum("valueTotal").as("total"));

        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, Measurement.class, Document.class);
        return results.getMappedResults().stream()
            .map(doc -> toGroupTotal(doc, true))
            .toList();
    }

    @Override
    public List<GroupTotal> sumByRange(LocalDate from, LocalDate to, String brand) {
        Criteria criteria = Criteria.where("date").gte(from).lte(to);
        if (brand != null) {
            criteria = criteria.and("brand").is(brand);
        }

        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(criteria),
            Aggregation.sort(Sort.by(Sort.Direction.ASC, "preliminary")),
            Aggregation.group("brand", "surface", "metric", "siteId", "date")
                .first("valueTotal").as("valueTotal"),
            Aggregation.group("surface", "metric")
                .sum("valueTotal").as("total"));

        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, Measurement.class, Document.class);
        return results.getMappedResults().stream()
            .map(doc -> toGroupTotal(doc, false))
            .toList();
    }

    private static GroupTotal toGroupTotal(Document doc, boolean withBrand) {
        Document id = doc.get("_id", Document.class);
        Number total = (Number) doc.get("total");
        return new GroupTotal(
            withBrand ? id.getString("brand") : null,
            id.getString("surface"),
            id.getString("metric"),
            total != null ? total.longValue() : 0L);
    }

    @Override
    public Optional<Measurement> findLatest(String brand, String surface, String metric) {
        return measurementRepository.findFirstByBrandAndSurfaceAndMetricOrderByDateDescPreliminaryAsc(
            brand, surface, metric);
    }
}
