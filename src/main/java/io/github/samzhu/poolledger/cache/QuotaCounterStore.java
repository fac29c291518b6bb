package io.github.samzhu.poolledger.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import io.github.samzhu.poolledger.dto.Reservation;

/**
 * 快取層的配額計數器與預留表。
 *
 * <p>每個配額池在快取中維護：
 * <ul>
 *   <li>剩餘額度計數器（微單位），存活到配額視窗結束</li>
 *   <li>pending 表 - 尚未結算的預留</li>
 *   <li>committing 表 - 已扣款但尚未確認寫入資料庫的消耗事件</li>
 * </ul>
 *
 * <p>所有修改方法都是單一原子步驟：對同一配額池的併發呼叫不會觀察到中間狀態。
 * 計數器不存在時，扣款/退款只更新預留表，不建立計數器，等待下一次重建。
 *
 * <p>實作：
 * <ul>
 *   <li>{@link RedisQuotaCounterStore} - 多實例共享（預設）</li>
 *   <li>{@link InMemoryQuotaCounterStore} - 單節點與測試</li>
 * </ul>
 */
public interface QuotaCounterStore {

    /**
     * 檢查並預留額度。
     *
     * @param reservation PENDING 預留
     * @param retention 預留紀錄保留時間
     * @return 結果；計數器不存在時不做任何修改
     */
    ReserveOutcome reserve(Reservation reservation, Duration retention);

    /**
     * 結算預留：計數器調整 {@code reserved − actual}，並把預留移入 committing 表。
     *
     * @param reservationId 預留 ID
     * @param actualUnits 實際消耗（微單位）
     * @param eventId 將寫入的消耗事件 ID
     * @param now 結算時間
     * @return 結果
     */
    ResolveOutcome commit(String reservationId, long actualUnits, String eventId, Instant now);

    /**
     * 釋放預留並退回額度。
     *
     * @param reservationId 預留 ID
     * @param now 釋放時間
     * @param expired 是否為逾時釋放
     * @return 結果
     */
    ResolveOutcome release(String reservationId, Instant now, boolean expired);

    /**
     * 直接扣款（外部計量事件），並登記到 committing 表。
     *
     * @return false 表示同一事件已在 committing 表中，未重複扣款
     */
    boolean debit(String poolId, String eventId, long units, Instant now);

    /**
     * 讀取剩餘額度計數器。
     */
    OptionalLong remaining(String poolId);

    Optional<Reservation> findReservation(String reservationId);

    /**
     * 找出建立時間早於 {@code createdBefore} 的 PENDING 預留，依建立時間遞增。
     */
    List<String> findExpired(Instant createdBefore, int limit);

    /**
     * pending 表快照：預留 ID → 預留額度（微單位）。
     */
    Map<String, Long> pending(String poolId);

    /**
     * committing 表快照。
     */
    List<CommittingEntry> committing(String poolId);

    /**
     * 重建計數器。
     *
     * <p>單一原子步驟完成：
     * <ol>
     *   <li>從 committing 表移除 {@code settledEventIds}</li>
     *   <li>移除建立時間早於 {@code stalePendingBefore} 的 pending 項目（預留紀錄已過期）</li>
     *   <li>{@code remaining = baseUnits − Σ pending − Σ committing}</li>
     *   <li>覆寫計數器，存活時間 {@code ttl}</li>
     * </ol>
     *
     * @param poolId 配額池 ID
     * @param baseUnits 總額度減去資料庫中當期已消耗（微單位）
     * @param settledEventIds 已確認寫入資料庫，或確定放棄的事件 ID
     * @param ttl 計數器存活時間
     * @param stalePendingBefore pending 項目過期門檻
     * @param onlyIfAbsent true 表示計數器已存在時不做任何修改
     * @return 結果
     */
    RebuildResult rebuild(
        String poolId,
        long baseUnits,
        Collection<String> settledEventIds,
        Duration ttl,
        Instant stalePendingBefore,
        boolean onlyIfAbsent);

    /**
     * 刪除計數器（不影響預留表），下一次預留會觸發重建。
     */
    void evict(String poolId);
}
