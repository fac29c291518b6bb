package io.github.samzhu.poolledger.exception;

import io.github.samzhu.poolledger.dto.ReservationState;

/**
 * 預留已結算（COMMITTED）或已釋放（RELEASED），本次操作未改變帳本。
 *
 * <p>{@code sameCommit} 為 true 表示這是一次金額相同的重複 commit，
 * 呼叫端的重試可視為成功。
 */
public class AlreadyResolvedException extends LedgerException {

    private final String reservationId;
    private final ReservationState state;
    private final boolean sameCommit;

    public AlreadyResolvedException(String reservationId, ReservationState state, boolean sameCommit) {
        super(ErrorCode.ALREADY_RESOLVED, String.format("Reservation already resolved: reservationId='%s', state=%s",
            reservationId, state));
        this.reservationId = reservationId;
        this.state = state;
        this.sameCommit = sameCommit;
    }

    public String getReservationId() {
        return reservationId;
    }

    public ReservationState getState() {
        return state;
    }

    public boolean isSameCommit() {
        return sameCommit;
    }
}
