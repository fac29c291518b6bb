package io.github.samzhu.poolledger.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.poolledger.cache.RebuildResult;
import io.github.samzhu.poolledger.document.QuotaPool;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.service.QuotaReconciliationService.LedgerSnapshot;
import io.github.samzhu.poolledger.support.LedgerFixture;
import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.ResetPolicy;

class QuotaReconciliationServiceTest {

    private static final String POOL = "team-c";

    private LedgerFixture fixture;
    private QuotaReconciliationService service;
    private QuotaPool pool;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        service = fixture.reconciliationService;
        pool = fixture.givenPool(POOL, "1000", ResetPolicy.MONTHLY);
    }

    @Test
    void shouldRestoreCounterAfterEviction() {
        // Given
        Reservation open = fixture.engine.reserve(POOL, new BigDecimal("100"), null, null);
        Reservation done = fixture.engine.reserve(POOL, new BigDecimal("50"), null, null);
        fixture.engine.commit(done.reservationId(), new BigDecimal("45"));
        long before = fixture.cachedRemainingUnits(POOL);

        // When
        fixture.counterStore.evict(POOL);
        RebuildResult result = service.reconcile(pool);

        // Then: 1000 - 45 (已寫入) - 100 (pending)
        assertThat(result.applied()).isTrue();
        assertThat(result.remainingUnits()).isEqualTo(before);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("855")));
        assertThat(fixture.counterStore.pending(POOL)).containsOnlyKeys(open.reservationId());
        assertThat(fixture.counterStore.committing(POOL)).isEmpty();
    }

    @Test
    void shouldCorrectDriftedCounter() {
        // Given: 快取計數器與資料庫不一致
        fixture.givenEvent("e-1", POOL, "200", LedgerFixture.START.minus(Duration.ofDays(1)));
        fixture.counterStore.rebuild(POOL, 999_000_000L, Set.of(), Duration.ofHours(1), Instant.EPOCH, false);

        // When
        service.reconcile(pool);

        // Then
        assertThat(QuotaUnits.toAmount(fixture.cachedRemainingUnits(POOL)))
            .isEqualByComparingTo(fixture.durableRemaining(POOL));
    }

    @Test
    void shouldExcludeConsumptionBeforeWindowStart() {
        // Given: 上個月的消耗不計入本月
        fixture.givenEvent("e-feb", POOL, "300", Instant.parse("2024-02-28T12:00:00Z"));
        fixture.givenEvent("e-mar", POOL, "100", Instant.parse("2024-03-02T12:00:00Z"));

        // When
        service.reconcile(pool);

        // Then
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("900")));
    }

    @Test
    void shouldKeepUnpersistedCommitDeducted() {
        // Given: 事件寫入失敗，仍在重送緩衝區
        Reservation reservation = fixture.engine.reserve(POOL, new BigDecimal("10"), null, null);
        fixture.durableDown.set(true);
        fixture.engine.commit(reservation.reservationId(), new BigDecimal("10"));
        fixture.durableDown.set(false);

        // When
        service.reconcile(pool);

        // Then: 不會因資料庫尚無此事件而高估剩餘額度
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("990")));
        assertThat(fixture.counterStore.committing(POOL)).hasSize(1);
    }

    @Test
    void shouldRematerializeLostEventFromCommittedReservation() {
        // Given: 結算後事件寫入失敗，接著程序重啟，重送緩衝區隨之消失
        Reservation reservation = fixture.engine.reserve(POOL, new BigDecimal("10"), "key-9", "model-z");
        fixture.durableDown.set(true);
        fixture.engine.commit(reservation.reservationId(), new BigDecimal("6"));
        fixture.durableDown.set(false);

        ConsumptionWriter restartedWriter = new ConsumptionWriter(fixture.eventRepository, fixture.retryRegistry);
        QuotaReconciliationService restarted = new QuotaReconciliationService(
            fixture.poolRepository, fixture.eventRepository, fixture.counterStore, restartedWriter,
            fixture.retryRegistry, fixture.properties, fixture.clock);
        fixture.clock.advance(Duration.ofMinutes(5));

        // When
        restarted.reconcile(pool);

        // Then
        String eventId = Reservation.eventIdFor(reservation.reservationId());
        assertThat(fixture.events).containsKey(eventId);
        assertThat(fixture.events.get(eventId).quotaConsumed()).isEqualByComparingTo("6");
        assertThat(fixture.events.get(eventId).sourceKeyId()).isEqualTo("key-9");
        assertThat(fixture.events.get(eventId).consumedAt()).isEqualTo(LedgerFixture.START);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("994")));
        assertThat(fixture.counterStore.committing(POOL)).isEmpty();
    }

    @Test
    void shouldLeaveBufferedEventToWriter() {
        // Given: 事件仍在本機重送緩衝區
        Reservation reservation = fixture.engine.reserve(POOL, new BigDecimal("10"), null, null);
        fixture.durableDown.set(true);
        fixture.engine.commit(reservation.reservationId(), new BigDecimal("6"));
        fixture.durableDown.set(false);
        fixture.clock.advance(Duration.ofMinutes(5));

        // When
        service.reconcile(pool);

        // Then: 校正不重複寫入，仍由緩衝區負責
        assertThat(fixture.events).isEmpty();
        assertThat(fixture.writer.getBufferSize()).isEqualTo(1);
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("994")));
    }

    @Test
    void shouldDropUnrecoverableDirectRecordAfterRetention() {
        // Given: 直接記錄的事件只扣了快取，沒有預留紀錄可供重建
        fixture.counterStore.rebuild(POOL, QuotaUnits.toUnits(new BigDecimal("1000")), Set.of(),
            Duration.ofDays(2), Instant.EPOCH, false);
        fixture.counterStore.debit(POOL, "lost", QuotaUnits.toUnits(new BigDecimal("25")), fixture.clock.instant());
        fixture.clock.advance(Duration.ofHours(25));

        // When
        service.reconcile(pool);

        // Then
        assertThat(fixture.counterStore.committing(POOL)).isEmpty();
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("1000")));
    }

    @Test
    void shouldNotOverwriteCounterOnRepairWhenPresent() {
        // Given
        fixture.engine.reserve(POOL, new BigDecimal("10"), null, null);
        fixture.givenEvent("late", POOL, "500", LedgerFixture.START);

        // When
        RebuildResult result = service.repair(pool);

        // Then
        assertThat(result.applied()).isFalse();
        assertThat(fixture.cachedRemainingUnits(POOL)).isEqualTo(QuotaUnits.toUnits(new BigDecimal("990")));
    }

    @Test
    void shouldReconcileAllPoolsAndSkipFailures() {
        // Given
        fixture.givenPool("team-d", "10", ResetPolicy.DAILY);
        fixture.pools.put("broken", new QuotaPool(null, "broken", "broken", BigDecimal.ONE, "HOURLY", 0,
            null, LedgerFixture.START, LedgerFixture.START, null));

        // When
        int reconciled = service.reconcileAll();

        // Then
        assertThat(reconciled).isEqualTo(2);
        assertThat(fixture.counterStore.remaining(POOL)).isPresent();
        assertThat(fixture.counterStore.remaining("team-d")).isPresent();
    }

    @Test
    void shouldComputeSnapshotWithoutTouchingCounter() {
        // Given
        fixture.givenEvent("e-1", POOL, "100", LedgerFixture.START);
        fixture.engine.reserve(POOL, new BigDecimal("30"), null, null);
        fixture.counterStore.evict(POOL);

        // When
        LedgerSnapshot snapshot = service.snapshot(pool);

        // Then
        assertThat(snapshot.cachedRemaining()).isEmpty();
        assertThat(snapshot.consumed()).isEqualByComparingTo("100");
        assertThat(snapshot.pendingUnits()).isEqualTo(QuotaUnits.toUnits(new BigDecimal("30")));
        assertThat(snapshot.computedRemainingUnits()).isEqualTo(QuotaUnits.toUnits(new BigDecimal("870")));
        assertThat(snapshot.window().start()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(fixture.counterStore.remaining(POOL)).isEmpty();
    }
}
