package io.github.samzhu.poolledger.cache;

import java.time.Instant;

/**
 * committing 表項目：已扣款、尚未確認寫入資料庫的消耗事件。
 *
 * @param eventId 消耗事件 ID
 * @param units 消耗額度（微單位）
 * @param reservationId 來源預留 ID，直接記錄的事件為 null
 * @param committedAt 扣款時間
 */
public record CommittingEntry(String eventId, long units, String reservationId, Instant committedAt) {

    /**
     * 編碼為快取字串：{@code units:reservationId:committedAtMillis}。
     */
    public String encode() {
        return units + ":" + (reservationId == null ? "" : reservationId) + ":" + committedAt.toEpochMilli();
    }

    /**
     * 解析快取字串。
     *
     * @throws IllegalArgumentException 格式錯誤
     */
    public static CommittingEntry decode(String eventId, String value) {
        String[] parts = value.split(":", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed committing entry: eventId=" + eventId + ", value=" + value);
        }
        try {
            return new CommittingEntry(
                eventId,
                Long.parseLong(parts[0]),
                parts[1].isEmpty() ? null : parts[1],
                Instant.ofEpochMilli(Long.parseLong(parts[2])));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed committing entry: eventId=" + eventId + ", value=" + value, e);
        }
    }

    public boolean fromReservation() {
        return reservationId != null;
    }
}
