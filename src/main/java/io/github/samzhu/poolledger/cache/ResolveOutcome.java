package io.github.samzhu.poolledger.cache;

import io.github.samzhu.poolledger.dto.Reservation;

/**
 * 結算/釋放腳本的結果。
 *
 * @param status 結果狀態
 * @param reservation 操作後的預留紀錄，NOT_FOUND 時為 null
 * @param sameCommit ALREADY_RESOLVED 時，是否為金額相同的重複 commit
 */
public record ResolveOutcome(Status status, Reservation reservation, boolean sameCommit) {

    public enum Status {
        RESOLVED,
        NOT_FOUND,
        ALREADY_RESOLVED
    }

    public static ResolveOutcome resolved(Reservation reservation) {
        return new ResolveOutcome(Status.RESOLVED, reservation, false);
    }

    public static ResolveOutcome notFound() {
        return new ResolveOutcome(Status.NOT_FOUND, null, false);
    }

    public static ResolveOutcome alreadyResolved(Reservation reservation, boolean sameCommit) {
        return new ResolveOutcome(Status.ALREADY_RESOLVED, reservation, sameCommit);
    }
}
