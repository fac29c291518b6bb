package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.poolledger.dto.Reservation;

/**
 * 預留 API 回應。
 */
public record ReservationResponse(
    @JsonProperty("reservation_id") String reservationId,
    @JsonProperty("pool_id") String poolId,
    @JsonProperty("reserved_amount") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal reservedAmount,
    String state,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("resolved_at") Instant resolvedAt,
    @JsonProperty("actual_amount") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal actualAmount,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("source_key_id") String sourceKeyId,
    @JsonProperty("model_name") String modelName,
    boolean expired
) {

    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
            reservation.reservationId(),
            reservation.poolId(),
            reservation.reservedAmount(),
            reservation.state().name(),
            reservation.createdAt(),
            reservation.resolvedAt(),
            reservation.actualAmount(),
            reservation.eventId(),
            reservation.sourceKeyId(),
            reservation.modelName(),
            reservation.expired()
        );
    }
}
