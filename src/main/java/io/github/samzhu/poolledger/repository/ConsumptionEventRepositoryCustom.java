package io.github.samzhu.poolledger.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * 消耗事件的自訂查詢，以 MongoTemplate 聚合實作。
 */
public interface ConsumptionEventRepositoryCustom {

    /**
     * 加總單一池自 {@code since} 起的消耗額度。
     *
     * @param poolId 配額池 ID
     * @param since 起始時間（含），null 表示全部
     * @return 消耗總額，沒有事件時為 0
     */
    BigDecimal sumQuotaConsumed(String poolId, Instant since);

    /**
     * 找出已持久化的事件 ID。
     *
     * @param eventIds 待確認的事件 ID
     * @return 其中已存在於資料庫的 ID
     */
    Set<String> findExistingEventIds(Collection<String> eventIds);
}
