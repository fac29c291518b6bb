package io.github.samzhu.poolledger.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.api.CommitRequest;
import io.github.samzhu.poolledger.dto.api.ConsumptionRecord;
import io.github.samzhu.poolledger.dto.api.ReservationResponse;
import io.github.samzhu.poolledger.dto.api.ReserveRequest;
import io.github.samzhu.poolledger.service.LedgerEngine;

/**
 * 配額帳本 API 控制器（代理端呼叫）。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/ledger/reservations} - 檢查並預留額度</li>
 *   <li>{@code POST /api/v1/ledger/reservations/{id}/commit} - 以實際額度結算</li>
 *   <li>{@code POST /api/v1/ledger/reservations/{id}/release} - 釋放預留</li>
 *   <li>{@code GET /api/v1/ledger/reservations/{id}} - 查詢預留</li>
 *   <li>{@code POST /api/v1/ledger/consumptions} - 直接記錄外部計量的消耗</li>
 * </ul>
 *
 * <p>額度不足回應 429（{@code code=QUOTA_EXHAUSTED}），見 {@link ApiExceptionHandler}。
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerApiController {

    private static final Logger log = LoggerFactory.getLogger(LedgerApiController.class);

    private final LedgerEngine ledgerEngine;

    public LedgerApiController(LedgerEngine ledgerEngine) {
        this.ledgerEngine = ledgerEngine;
    }

    @PostMapping("/reservations")
    public ResponseEntity<ReservationResponse> reserve(@RequestBody @Validated ReserveRequest request) {
        log.debug("API request: reserve poolId={}, amount={}", request.poolId(), request.amount());

        Reservation reservation = ledgerEngine.reserve(
            request.poolId(), request.amount(), request.sourceKeyId(), request.modelName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReservationResponse.from(reservation));
    }

    @PostMapping("/reservations/{reservationId}/commit")
    public ResponseEntity<ConsumptionRecord> commit(
            @PathVariable String reservationId,
            @RequestBody @Validated CommitRequest request) {
        log.debug("API request: commit reservationId={}, actualAmount={}", reservationId, request.actualAmount());

        ConsumptionEvent event = ledgerEngine.commit(reservationId, request.actualAmount());
        return ResponseEntity.ok(ConsumptionRecord.from(event));
    }

    @PostMapping("/reservations/{reservationId}/release")
    public ResponseEntity<ReservationResponse> release(@PathVariable String reservationId) {
        log.debug("API request: release reservationId={}", reservationId);

        return ResponseEntity.ok(ReservationResponse.from(ledgerEngine.release(reservationId)));
    }

    @GetMapping("/reservations/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable String reservationId) {
        return ResponseEntity.ok(ReservationResponse.from(ledgerEngine.getReservation(reservationId)));
    }

    @PostMapping("/consumptions")
    public ResponseEntity<ConsumptionRecord> recordConsumption(@RequestBody ConsumptionEventData request) {
        log.debug("API request: recordConsumption eventId={}, poolId={}", request.eventId(), request.poolId());

        ConsumptionEvent event = ledgerEngine.recordConsumption(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConsumptionRecord.from(event));
    }
}
