package io.github.samzhu.poolledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.ReservationState;
import io.github.samzhu.poolledger.exception.AlreadyResolvedException;
import io.github.samzhu.poolledger.exception.InsufficientQuotaException;
import io.github.samzhu.poolledger.exception.PoolUnknownException;
import io.github.samzhu.poolledger.exception.ReservationNotFoundException;
import io.github.samzhu.poolledger.support.LedgerFixture;
import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.ResetPolicy;

class LedgerEngineTest {

    private static final String POOL = "team-a";

    private LedgerFixture fixture;
    private LedgerEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        engine = fixture.engine;
        fixture.givenPool(POOL, "100", ResetPolicy.MONTHLY);
    }

    @Test
    void shouldRebuildMissingCounterOnFirstReserve() {
        // Given: 本月已有 30 的消耗
        fixture.givenEvent("e-old", POOL, "30", LedgerFixture.START.minus(Duration.ofHours(1)));

        // When
        Reservation reservation = engine.reserve(POOL, new BigDecimal("20"), "key-1", "model-x");

        // Then
        assertThat(reservation.state()).isEqualTo(ReservationState.PENDING);
        assertThat(reservation.reservedAmount()).isEqualByComparingTo("20");
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("50")));
    }

    @Test
    void shouldRejectReservationExceedingRemaining() {
        // Given
        engine.reserve(POOL, new BigDecimal("70"), null, null);

        // When & Then
        assertThatThrownBy(() -> engine.reserve(POOL, new BigDecimal("30.000001"), null, null))
            .isInstanceOfSatisfying(InsufficientQuotaException.class, e -> {
                assertThat(e.getReason()).isEqualTo(InsufficientQuotaException.Reason.INSUFFICIENT);
                assertThat(e.getRemaining()).isEqualByComparingTo("30");
                assertThat(e.getRequested()).isEqualByComparingTo("30.000001");
            });
    }

    @Test
    void shouldGrantReservationThatExactlyExhaustsPool() {
        // When
        engine.reserve(POOL, new BigDecimal("100"), null, null);

        // Then
        assertThat(fixture.cachedRemainingUnits(POOL)).isZero();
        assertThatThrownBy(() -> engine.reserve(POOL, new BigDecimal("0.000001"), null, null))
            .isInstanceOf(InsufficientQuotaException.class);
    }

    @Test
    void shouldRejectUnknownPool() {
        assertThatThrownBy(() -> engine.reserve("missing", BigDecimal.ONE, null, null))
            .isInstanceOf(PoolUnknownException.class);
    }

    @Test
    void shouldRejectNegativeEstimate() {
        assertThatThrownBy(() -> engine.reserve(POOL, new BigDecimal("-1"), null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailClosedWhenDurableStoreUnavailableForRebuild() {
        // Given: 計數器不存在且資料庫無法連線
        fixture.durableDown.set(true);

        // When & Then
        assertThatThrownBy(() -> engine.reserve(POOL, BigDecimal.ONE, null, null))
            .isInstanceOfSatisfying(InsufficientQuotaException.class, e -> {
                assertThat(e.getReason()).isEqualTo(InsufficientQuotaException.Reason.STORE_UNAVAILABLE);
                assertThat(e.getRemaining()).isNull();
            });
    }

    @Test
    void shouldPersistActualAmountOnCommit() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("10"), "key-1", "model-x");
        fixture.clock.advance(Duration.ofSeconds(3));

        // When
        ConsumptionEvent event = engine.commit(reservation.reservationId(), new BigDecimal("4.5"));

        // Then
        assertThat(event.eventId()).isEqualTo(Reservation.eventIdFor(reservation.reservationId()));
        assertThat(event.quotaConsumed()).isEqualByComparingTo("4.5");
        assertThat(event.consumedAt()).isEqualTo(fixture.clock.instant());
        assertThat(event.reservationId()).isEqualTo(reservation.reservationId());
        assertThat(event.sourceKeyId()).isEqualTo("key-1");
        assertThat(fixture.events).containsKey(event.eventId());
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("95.5")));
    }

    @Test
    void shouldChargeFullActualWhenCommitExceedsReservation() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("90"), null, null);

        // When
        engine.commit(reservation.reservationId(), new BigDecimal("120"));

        // Then: 剩餘額度為負，之後的預留被拒絕
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("20")) * -1);
        assertThatThrownBy(() -> engine.reserve(POOL, BigDecimal.ZERO, null, null))
            .isInstanceOf(InsufficientQuotaException.class);
    }

    @Test
    void shouldRejectSecondCommitWithoutDoubleCharging() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("10"), null, null);
        engine.commit(reservation.reservationId(), new BigDecimal("8"));

        // When & Then
        assertThatThrownBy(() -> engine.commit(reservation.reservationId(), new BigDecimal("8")))
            .isInstanceOfSatisfying(AlreadyResolvedException.class, e -> {
                assertThat(e.getState()).isEqualTo(ReservationState.COMMITTED);
                assertThat(e.isSameCommit()).isTrue();
            });
        assertThat(fixture.events).hasSize(1);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("92")));
    }

    @Test
    void shouldRejectReleaseAfterCommit() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("10"), null, null);
        engine.commit(reservation.reservationId(), new BigDecimal("8"));

        // When & Then
        assertThatThrownBy(() -> engine.release(reservation.reservationId()))
            .isInstanceOfSatisfying(AlreadyResolvedException.class,
                e -> assertThat(e.isSameCommit()).isFalse());
    }

    @Test
    void shouldRefundOnReleaseWithoutConsumptionEvent() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("40"), null, null);

        // When
        Reservation released = engine.release(reservation.reservationId());

        // Then
        assertThat(released.state()).isEqualTo(ReservationState.RELEASED);
        assertThat(released.expired()).isFalse();
        assertThat(fixture.events).isEmpty();
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("100")));
        assertThatThrownBy(() -> engine.commit(reservation.reservationId(), BigDecimal.ONE))
            .isInstanceOf(AlreadyResolvedException.class);
    }

    @Test
    void shouldReportUnknownReservation() {
        assertThatThrownBy(() -> engine.commit("nope", BigDecimal.ONE))
            .isInstanceOf(ReservationNotFoundException.class);
        assertThatThrownBy(() -> engine.release("nope"))
            .isInstanceOf(ReservationNotFoundException.class);
        assertThatThrownBy(() -> engine.getReservation("nope"))
            .isInstanceOf(ReservationNotFoundException.class);
    }

    @Test
    void shouldKeepCacheDebitAndBufferEventWhenDurableWriteFails() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("10"), null, null);
        fixture.durableDown.set(true);

        // When
        ConsumptionEvent event = engine.commit(reservation.reservationId(), new BigDecimal("10"));

        // Then: 快取已扣款，事件等待重送
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("90")));
        assertThat(fixture.writer.isBuffered(event.eventId())).isTrue();

        // When: 資料庫恢復
        fixture.durableDown.set(false);
        int written = fixture.writer.flushBuffer();

        // Then
        assertThat(written).isEqualTo(1);
        assertThat(fixture.events).containsKey(event.eventId());
    }

    @Test
    void shouldRecordDirectConsumptionOnce() {
        // Given
        engine.reserve(POOL, BigDecimal.ZERO, null, null); // 建立計數器
        ConsumptionEventData data = new ConsumptionEventData(
            "evt-1", POOL, new BigDecimal("12.25"), Instant.parse("2024-03-14T09:00:00Z"), "key-2", "model-y", 0);

        // When
        ConsumptionEvent first = engine.recordConsumption(data);
        ConsumptionEvent second = engine.recordConsumption(data);

        // Then
        assertThat(first.eventId()).isEqualTo("evt-1");
        assertThat(first.requestCountIncrement()).isEqualTo(1);
        assertThat(first.reservationId()).isNull();
        assertThat(second.eventId()).isEqualTo("evt-1");
        assertThat(fixture.events).hasSize(1);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("87.75")));
    }

    @Test
    void shouldDefaultConsumedAtToReceiveTime() {
        // Given
        ConsumptionEventData data = new ConsumptionEventData("evt-2", POOL, BigDecimal.ONE, null, null, null, 3);

        // When
        ConsumptionEvent event = engine.recordConsumption(data);

        // Then
        assertThat(event.consumedAt()).isEqualTo(fixture.clock.instant());
        assertThat(event.requestCountIncrement()).isEqualTo(3);
    }

    @Test
    void shouldRejectDirectConsumptionWithMissingFields() {
        assertThatThrownBy(() -> engine.recordConsumption(
                new ConsumptionEventData(null, POOL, BigDecimal.ONE, null, null, null, 1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("event_id");
        assertThatThrownBy(() -> engine.recordConsumption(
                new ConsumptionEventData("evt-3", POOL, null, null, null, null, 1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.recordConsumption(
                new ConsumptionEventData("evt-4", "missing", BigDecimal.ONE, null, null, null, 1)))
            .isInstanceOf(PoolUnknownException.class);
    }

    @Test
    void shouldReturnReservationWithinRetention() {
        // Given
        Reservation reservation = engine.reserve(POOL, new BigDecimal("5"), "key-1", null);
        engine.commit(reservation.reservationId(), new BigDecimal("2"));

        // When
        Reservation found = engine.getReservation(reservation.reservationId());

        // Then
        assertThat(found.state()).isEqualTo(ReservationState.COMMITTED);
        assertThat(found.actualAmount()).isEqualByComparingTo("2");
    }
}
