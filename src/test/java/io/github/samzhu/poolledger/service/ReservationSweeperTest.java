package io.github.samzhu.poolledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import io.github.samzhu.poolledger.cache.QuotaCounterStore;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.ReservationState;
import io.github.samzhu.poolledger.exception.AlreadyResolvedException;
import io.github.samzhu.poolledger.support.LedgerFixture;
import io.github.samzhu.poolledger.support.MutableClock;
import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.ResetPolicy;

class ReservationSweeperTest {

    private static final String POOL = "team-b";

    private LedgerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        fixture.givenPool(POOL, "50", ResetPolicy.NONE);
    }

    @Test
    void shouldReleaseReservationsOlderThanTimeout() {
        // Given
        Reservation stale = fixture.engine.reserve(POOL, new BigDecimal("20"), null, null);
        fixture.clock.advance(Duration.ofSeconds(20));
        Reservation fresh = fixture.engine.reserve(POOL, new BigDecimal("10"), null, null);
        fixture.clock.advance(Duration.ofSeconds(15));

        // When: stale 已存在 35 秒，fresh 15 秒，逾時 30 秒
        int released = fixture.sweeper.sweep();

        // Then
        assertThat(released).isEqualTo(1);
        Reservation swept = fixture.engine.getReservation(stale.reservationId());
        assertThat(swept.state()).isEqualTo(ReservationState.RELEASED);
        assertThat(swept.expired()).isTrue();
        assertThat(fixture.engine.getReservation(fresh.reservationId()).state()).isEqualTo(ReservationState.PENDING);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("40")));
    }

    @Test
    void shouldRejectLateCommitOfSweptReservation() {
        // Given
        Reservation reservation = fixture.engine.reserve(POOL, new BigDecimal("20"), null, null);
        fixture.clock.advance(Duration.ofMinutes(1));
        fixture.sweeper.sweep();

        // When & Then
        assertThatThrownBy(() -> fixture.engine.commit(reservation.reservationId(), new BigDecimal("5")))
            .isInstanceOfSatisfying(AlreadyResolvedException.class,
                e -> assertThat(e.getState()).isEqualTo(ReservationState.RELEASED));
        assertThat(fixture.events).isEmpty();
    }

    @Test
    void shouldDoNothingWhenNoReservationExpired() {
        // Given
        fixture.engine.reserve(POOL, new BigDecimal("20"), null, null);

        // When
        int released = fixture.sweeper.sweep();

        // Then
        assertThat(released).isZero();
    }

    @Test
    void shouldSkipScheduledSweepWhenCacheUnavailable() {
        // Given
        QuotaCounterStore store = mock(QuotaCounterStore.class);
        when(store.findExpired(any(), anyInt())).thenThrow(new RedisConnectionFailureException("connection refused"));
        ReservationSweeper sweeper = new ReservationSweeper(
            store, PoolLedgerProperties.defaults(), MutableClock.at("2024-03-14T10:00:00Z"));

        // When & Then: 定時任務吞下連線錯誤，手動清掃則拋出
        sweeper.scheduledSweep();
        assertThatThrownBy(sweeper::sweep).isInstanceOf(RedisConnectionFailureException.class);
    }
}
