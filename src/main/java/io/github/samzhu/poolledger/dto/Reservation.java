package io.github.samzhu.poolledger.dto;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

import io.github.samzhu.poolledger.util.QuotaUnits;

/**
 * 配額預留紀錄（存於快取）。
 *
 * <p>金額以微單位儲存，見 {@link QuotaUnits}。
 *
 * @param reservationId 預留 ID
 * @param poolId 所屬配額池
 * @param reservedUnits 預留額度（微單位）
 * @param state 狀態
 * @param createdAt 建立時間
 * @param resolvedAt 結算或釋放時間，PENDING 時為 null
 * @param actualUnits 實際消耗（微單位），僅 COMMITTED 有值
 * @param eventId 結算產生的消耗事件 ID，僅 COMMITTED 有值
 * @param sourceKeyId 被扣款的上游憑證
 * @param modelName 上游模型名稱
 * @param expired 是否因逾時被清掃器釋放
 */
public record Reservation(
    String reservationId,
    String poolId,
    long reservedUnits,
    ReservationState state,
    Instant createdAt,
    Instant resolvedAt,
    Long actualUnits,
    String eventId,
    String sourceKeyId,
    String modelName,
    boolean expired
) {

    /**
     * 建立新的 PENDING 預留。
     */
    public static Reservation pending(
            String reservationId,
            String poolId,
            long reservedUnits,
            Instant createdAt,
            String sourceKeyId,
            String modelName) {
        return new Reservation(reservationId, poolId, reservedUnits, ReservationState.PENDING,
            createdAt, null, null, null, sourceKeyId, modelName, false);
    }

    /**
     * 結算事件 ID 由預留 ID 推導（name-based UUID），同一預留永遠對應同一事件。
     */
    public static String eventIdFor(String reservationId) {
        return UUID.nameUUIDFromBytes(("reservation:" + reservationId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public Reservation committed(long actual, String event, Instant at) {
        return new Reservation(reservationId, poolId, reservedUnits, ReservationState.COMMITTED,
            createdAt, at, actual, event, sourceKeyId, modelName, false);
    }

    public Reservation released(Instant at, boolean byExpiry) {
        return new Reservation(reservationId, poolId, reservedUnits, ReservationState.RELEASED,
            createdAt, at, null, null, sourceKeyId, modelName, byExpiry);
    }

    public BigDecimal reservedAmount() {
        return QuotaUnits.toAmount(reservedUnits);
    }

    public BigDecimal actualAmount() {
        return actualUnits == null ? null : QuotaUnits.toAmount(actualUnits);
    }
}
