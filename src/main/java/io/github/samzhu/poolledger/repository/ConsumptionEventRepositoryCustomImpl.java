package io.github.samzhu.poolledger.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.util.QuotaUnits;

/**
 * {@link ConsumptionEventRepositoryCustom} 的 MongoTemplate 實作。
 *
 * <p>加總在資料庫端以 {@code $group/$sum} 完成，Decimal128 欄位加總結果仍為 Decimal128，
 * 不經過浮點運算。
 */
public class ConsumptionEventRepositoryCustomImpl implements ConsumptionEventRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionEventRepositoryCustomImpl.class);

    private static final String COLLECTION = "consumption_events";

    private final MongoTemplate mongoTemplate;

    public ConsumptionEventRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public BigDecimal sumQuotaConsumed(String poolId, Instant since) {
        Criteria criteria = Criteria.where("poolId").is(poolId);
        if (since != null) {
            criteria = criteria.and("consumedAt").gte(since);
        }

        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(criteria),
            Aggregation.group().sum("quotaConsumed").as("total")
        );

        AggregationResults<Document> results =
            mongoTemplate.aggregate(aggregation, ConsumptionEvent.class, Document.class);
        Document result = results.getUniqueMappedResult();

        BigDecimal total = result == null ? BigDecimal.ZERO : toBigDecimal(result.get("total"));
        log.debug("Summed consumption: poolId={}, since={}, total={}", poolId, since, total);
        return total.setScale(QuotaUnits.SCALE);
    }

    @Override
    public Set<String> findExistingEventIds(Collection<String> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            return Set.of();
        }
        Query query = Query.query(Criteria.where("eventId").in(eventIds));
        query.fields().include("eventId");

        Set<String> existing = new HashSet<>();
        for (Document doc : mongoTemplate.find(query, Document.class, COLLECTION)) {
            existing.add(doc.getString("eventId"));
        }
        return existing;
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return BigDecimal.ZERO;
    }
}
