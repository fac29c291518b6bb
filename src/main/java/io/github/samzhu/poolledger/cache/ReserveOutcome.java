package io.github.samzhu.poolledger.cache;

/**
 * 預留腳本的結果。
 *
 * @param status 結果狀態
 * @param remainingUnits GRANTED 時為扣款後剩餘額度，INSUFFICIENT 時為目前剩餘額度
 */
public record ReserveOutcome(Status status, long remainingUnits) {

    public enum Status {
        GRANTED,
        INSUFFICIENT,
        COUNTER_MISSING
    }

    public static ReserveOutcome granted(long remainingUnits) {
        return new ReserveOutcome(Status.GRANTED, remainingUnits);
    }

    public static ReserveOutcome insufficient(long remainingUnits) {
        return new ReserveOutcome(Status.INSUFFICIENT, remainingUnits);
    }

    public static ReserveOutcome counterMissing() {
        return new ReserveOutcome(Status.COUNTER_MISSING, 0);
    }
}
