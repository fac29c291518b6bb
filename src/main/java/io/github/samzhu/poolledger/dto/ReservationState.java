package io.github.samzhu.poolledger.dto;

/**
 * 預留狀態。
 *
 * <p>只允許 PENDING → COMMITTED 或 PENDING → RELEASED，結算後不可再變更。
 */
public enum ReservationState {
    PENDING,
    COMMITTED,
    RELEASED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
