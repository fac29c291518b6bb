package io.github.samzhu.poolledger.exception;

/**
 * 預留不存在，或已超過保留時間被清除。
 */
public class ReservationNotFoundException extends LedgerException {

    private final String reservationId;

    public ReservationNotFoundException(String reservationId) {
        super(ErrorCode.RESERVATION_NOT_FOUND, String.format("Reservation not found: reservationId='%s'", reservationId));
        this.reservationId = reservationId;
    }

    public String getReservationId() {
        return reservationId;
    }
}
