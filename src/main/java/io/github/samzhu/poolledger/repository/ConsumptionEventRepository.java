package io.github.samzhu.poolledger.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.poolledger.document.ConsumptionEvent;

/**
 * 消耗事件資料存取介面。
 *
 * <p>提供對 {@code consumption_events} 集合的存取。集合只增不改：
 * 寫入一律使用 {@code insert}，不提供更新方法。
 *
 * <p>此資料主要用於：
 * <ul>
 *   <li>計數器校正 - 當期消耗加總（見 {@link ConsumptionEventRepositoryCustom}）</li>
 *   <li>趨勢聚合 - 以串流讀取區間事件並分桶</li>
 *   <li>報表 - 最新消耗紀錄列表</li>
 * </ul>
 *
 * <p>Stream 回傳值需在 try-with-resources 內使用，以釋放資料庫游標。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface ConsumptionEventRepository
        extends MongoRepository<ConsumptionEvent, String>, ConsumptionEventRepositoryCustom {

    Optional<ConsumptionEvent> findByEventId(String eventId);

    /**
     * 串流讀取所有池在 {@code [start, end)} 內的事件。
     */
    Stream<ConsumptionEvent> findByConsumedAtGreaterThanEqualAndConsumedAtLessThanOrderByConsumedAtAsc(
            Instant start, Instant end);

    /**
     * 串流讀取單一池在 {@code [start, end)} 內的事件。
     */
    Stream<ConsumptionEvent> findByPoolIdAndConsumedAtGreaterThanEqualAndConsumedAtLessThanOrderByConsumedAtAsc(
            String poolId, Instant start, Instant end);

    /**
     * 分頁查詢所有池在 {@code [start, end)} 內的事件，排序由 {@link Pageable} 指定。
     */
    List<ConsumptionEvent> findByConsumedAtGreaterThanEqualAndConsumedAtLessThan(
            Instant start, Instant end, Pageable pageable);

    /**
     * 分頁查詢單一池在 {@code [start, end)} 內的事件，排序由 {@link Pageable} 指定。
     */
    List<ConsumptionEvent> findByPoolIdAndConsumedAtGreaterThanEqualAndConsumedAtLessThan(
            String poolId, Instant start, Instant end, Pageable pageable);
}
