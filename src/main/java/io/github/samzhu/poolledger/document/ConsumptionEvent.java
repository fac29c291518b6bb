package io.github.samzhu.poolledger.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.util.QuotaUnits;

/**
 * 配額消耗事件文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只增不改：寫入後不再修改或刪除，任一池/時間區間的加總即為權威消耗值</li>
 *   <li>冪等寫入：{@code eventId} 唯一索引，重複寫入會被資料庫拒絕而不會重複計算</li>
 *   <li>聚合效能：{@code (poolId, consumedAt)} 複合索引支援區間加總與趨勢分桶</li>
 * </ul>
 *
 * <p>由預留結算產生的事件，{@code eventId} 由預留 ID 推導，
 * 崩潰復原時重新寫入也會落在同一筆。
 */
@Document(collection = "consumption_events")
@CompoundIndexes({
    @CompoundIndex(name = "pool_consumed_idx", def = "{'poolId': 1, 'consumedAt': 1}"),
    @CompoundIndex(name = "consumed_idx", def = "{'consumedAt': -1}")
})
public record ConsumptionEvent(
    @Id String id,

    /** 事件唯一識別碼 */
    @Indexed(unique = true) String eventId,
    /** 所屬配額池 */
    String poolId,
    /** 實際消耗額度，≥ 0 */
    @Field(targetType = FieldType.DECIMAL128) BigDecimal quotaConsumed,
    /** 消耗時間 (UTC) */
    Instant consumedAt,
    /** 被扣款的上游憑證 */
    String sourceKeyId,
    /** 上游模型名稱，可為 null */
    String modelName,
    /** 請求數增量，通常為 1 */
    int requestCountIncrement,
    /** 來源預留 ID，直接記錄的事件為 null */
    String reservationId,
    /** 寫入資料庫的時間 */
    Instant recordedAt
) {

    /**
     * 建立消耗事件，金額正規化為 {@value QuotaUnits#SCALE} 位小數。
     */
    public static ConsumptionEvent create(
            String eventId,
            String poolId,
            BigDecimal quotaConsumed,
            Instant consumedAt,
            String sourceKeyId,
            String modelName,
            int requestCountIncrement,
            String reservationId,
            Instant recordedAt) {

        return new ConsumptionEvent(
            null, // ID 自動產生
            eventId,
            poolId,
            QuotaUnits.normalize(quotaConsumed),
            consumedAt,
            sourceKeyId,
            modelName,
            requestCountIncrement,
            reservationId,
            recordedAt
        );
    }

    /**
     * 由已結算的預留建立消耗事件。
     *
     * <p>所有欄位都取自預留紀錄，崩潰復原時重建的事件與原本要寫入的完全相同。
     */
    public static ConsumptionEvent forReservation(Reservation committed, Instant recordedAt) {
        return create(
            committed.eventId(),
            committed.poolId(),
            committed.actualAmount(),
            committed.resolvedAt(),
            committed.sourceKeyId(),
            committed.modelName(),
            1,
            committed.reservationId(),
            recordedAt
        );
    }

    public long quotaUnits() {
        return QuotaUnits.toUnits(quotaConsumed);
    }
}
