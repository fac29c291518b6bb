package io.github.samzhu.poolledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.cache.QuotaCounterStore;
import io.github.samzhu.poolledger.cache.ReserveOutcome;
import io.github.samzhu.poolledger.cache.ResolveOutcome;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.document.QuotaPool;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.exception.AlreadyResolvedException;
import io.github.samzhu.poolledger.exception.InsufficientQuotaException;
import io.github.samzhu.poolledger.exception.PoolUnknownException;
import io.github.samzhu.poolledger.exception.ReservationNotFoundException;
import io.github.samzhu.poolledger.exception.StoreUnavailableException;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;
import io.github.samzhu.poolledger.util.QuotaUnits;

/**
 * 配額帳本引擎，負責准入控制與消耗記錄。
 *
 * <p>請求生命週期：
 * <pre>
 * reserve(預估額度) ──► 放行上游呼叫 ──► commit(實際額度) ──► 消耗事件寫入資料庫
 *          │                                  │
 *          └──────── release / 逾時清掃 ◄──────┘ (呼叫失敗)
 * </pre>
 *
 * <p>處理原則：
 * <ul>
 *   <li>檢查與扣款是快取中的單一原子步驟，同一配額池的併發預留不會超賣</li>
 *   <li>計數器不存在時，從資料庫重建一次再重試</li>
 *   <li>預留路徑上快取或資料庫故障一律拒絕（fail closed）</li>
 *   <li>結算後快取扣款不回滾，資料庫寫入失敗由 {@link ConsumptionWriter} 重送</li>
 *   <li>每筆預留只有一次結算或釋放會成功，其餘回報 {@link AlreadyResolvedException}</li>
 * </ul>
 *
 * <p>結算可以超過預留額度，差額仍會扣除，計數器可能因此變為負數，
 * 之後的預留會看到並被拒絕。
 *
 * @see QuotaReconciliationService
 * @see ReservationSweeper
 */
@Service
public class LedgerEngine {

    private static final Logger log = LoggerFactory.getLogger(LedgerEngine.class);

    private final QuotaCounterStore counterStore;
    private final PoolService poolService;
    private final QuotaReconciliationService reconciliationService;
    private final ConsumptionWriter writer;
    private final ConsumptionEventRepository eventRepository;
    private final Retry readRetry;
    private final Clock clock;

    private final Duration retention;

    public LedgerEngine(
            QuotaCounterStore counterStore,
            PoolService poolService,
            QuotaReconciliationService reconciliationService,
            ConsumptionWriter writer,
            ConsumptionEventRepository eventRepository,
            RetryRegistry retryRegistry,
            PoolLedgerProperties properties,
            Clock clock) {
        this.counterStore = counterStore;
        this.poolService = poolService;
        this.reconciliationService = reconciliationService;
        this.writer = writer;
        this.eventRepository = eventRepository;
        this.readRetry = retryRegistry.retry(AppConfig.DURABLE_READ, AppConfig.DURABLE_READ);
        this.clock = clock;
        this.retention = properties.reservation().retention();
    }

    /**
     * 檢查並預留額度。
     *
     * @param poolId 配額池 ID
     * @param estimatedAmount 預估額度，≥ 0
     * @param sourceKeyId 被扣款的上游憑證，可為 null
     * @param modelName 上游模型名稱，可為 null
     * @return PENDING 預留
     * @throws PoolUnknownException 配額池不存在
     * @throws InsufficientQuotaException 額度不足，或儲存層無法使用
     * @throws IllegalArgumentException 額度無效
     */
    public Reservation reserve(String poolId, BigDecimal estimatedAmount, String sourceKeyId, String modelName) {
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("poolId is required");
        }
        BigDecimal amount = QuotaUnits.normalize(estimatedAmount);
        Reservation reservation = Reservation.pending(
            UUID.randomUUID().toString(),
            poolId,
            QuotaUnits.toUnits(amount),
            clock.instant(),
            sourceKeyId,
            modelName);

        ReserveOutcome outcome;
        try {
            outcome = counterStore.reserve(reservation, retention);
            if (outcome.status() == ReserveOutcome.Status.COUNTER_MISSING) {
                QuotaPool pool = poolService.findPool(poolId);
                reconciliationService.repair(pool);
                outcome = counterStore.reserve(reservation, retention);
            }
        } catch (DataAccessException | StoreUnavailableException e) {
            log.warn("Reservation rejected, store unavailable: poolId={}, amount={}, error={}",
                poolId, amount, e.getMessage());
            throw InsufficientQuotaException.storeUnavailable(poolId, amount, e);
        }

        switch (outcome.status()) {
            case GRANTED -> {
                log.debug("Reservation granted: reservationId={}, poolId={}, amount={}, remaining={}",
                    reservation.reservationId(), poolId, amount, QuotaUnits.toAmount(outcome.remainingUnits()));
                return reservation;
            }
            case INSUFFICIENT -> {
                BigDecimal remaining = QuotaUnits.toAmount(outcome.remainingUnits());
                log.debug("Reservation rejected, insufficient quota: poolId={}, amount={}, remaining={}",
                    poolId, amount, remaining);
                throw new InsufficientQuotaException(poolId, amount, remaining);
            }
            default -> {
                log.warn("Reservation rejected, counter still missing after rebuild: poolId={}", poolId);
                throw InsufficientQuotaException.storeUnavailable(poolId, amount, null);
            }
        }
    }

    /**
     * 以實際額度結算預留，並寫入消耗事件。
     *
     * @param reservationId 預留 ID
     * @param actualAmount 實際消耗，≥ 0，可超過預留額度
     * @return 寫入（或已排入重送）的消耗事件
     * @throws ReservationNotFoundException 預留不存在
     * @throws AlreadyResolvedException 預留已結算或已釋放
     * @throws StoreUnavailableException 快取無法使用，結算未生效
     */
    public ConsumptionEvent commit(String reservationId, BigDecimal actualAmount) {
        long actualUnits = QuotaUnits.toUnits(actualAmount);
        Instant now = clock.instant();
        String eventId = Reservation.eventIdFor(reservationId);

        ResolveOutcome outcome;
        try {
            outcome = counterStore.commit(reservationId, actualUnits, eventId, now);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Cache unavailable, commit not applied: reservationId=" + reservationId, e);
        }
        Reservation committed = resolved(reservationId, outcome, "commit");

        if (committed.actualUnits() > committed.reservedUnits()) {
            log.info("Commit exceeded reservation: reservationId={}, poolId={}, reserved={}, actual={}",
                reservationId, committed.poolId(), committed.reservedAmount(), committed.actualAmount());
        }

        ConsumptionEvent event = ConsumptionEvent.forReservation(committed, now);
        writer.write(event);

        log.debug("Reservation committed: reservationId={}, poolId={}, reserved={}, actual={}, eventId={}",
            reservationId, committed.poolId(), committed.reservedAmount(), committed.actualAmount(), eventId);
        return event;
    }

    /**
     * 釋放預留並退回額度，不產生消耗事件。
     *
     * @throws ReservationNotFoundException 預留不存在
     * @throws AlreadyResolvedException 預留已結算或已釋放
     * @throws StoreUnavailableException 快取無法使用
     */
    public Reservation release(String reservationId) {
        ResolveOutcome outcome;
        try {
            outcome = counterStore.release(reservationId, clock.instant(), false);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Cache unavailable, release not applied: reservationId=" + reservationId, e);
        }
        Reservation released = resolved(reservationId, outcome, "release");

        log.debug("Reservation released: reservationId={}, poolId={}, amount={}",
            reservationId, released.poolId(), released.reservedAmount());
        return released;
    }

    private Reservation resolved(String reservationId, ResolveOutcome outcome, String operation) {
        switch (outcome.status()) {
            case RESOLVED -> {
                return outcome.reservation();
            }
            case ALREADY_RESOLVED -> {
                if (outcome.reservation() == null) {
                    throw new ReservationNotFoundException(reservationId);
                }
                log.warn("Rejected {} of resolved reservation: reservationId={}, state={}, sameCommit={}",
                    operation, reservationId, outcome.reservation().state(), outcome.sameCommit());
                throw new AlreadyResolvedException(reservationId, outcome.reservation().state(), outcome.sameCommit());
            }
            default -> throw new ReservationNotFoundException(reservationId);
        }
    }

    /**
     * 記錄外部計量的消耗事件（不經預留流程）。
     *
     * <p>以 {@code eventId} 冪等：已寫入資料庫的事件直接回傳既有紀錄。
     *
     * @throws PoolUnknownException 配額池不存在
     * @throws IllegalArgumentException 欄位無效
     */
    public ConsumptionEvent recordConsumption(ConsumptionEventData data) {
        if (data.eventId() == null || data.eventId().isBlank()) {
            throw new IllegalArgumentException("event_id is required");
        }
        if (data.poolId() == null || data.poolId().isBlank()) {
            throw new IllegalArgumentException("pool_id is required");
        }
        BigDecimal amount = QuotaUnits.normalize(data.quotaConsumed());
        QuotaPool pool = poolService.findPool(data.poolId());

        Optional<ConsumptionEvent> existing = readRetry.executeSupplier(
            () -> eventRepository.findByEventId(data.eventId()));
        if (existing.isPresent()) {
            log.debug("Consumption already recorded: eventId={}", data.eventId());
            return existing.get();
        }

        Instant now = clock.instant();
        ConsumptionEvent event = ConsumptionEvent.create(
            data.eventId(),
            pool.poolId(),
            amount,
            data.consumedAt() != null ? data.consumedAt() : now,
            data.sourceKeyId(),
            data.modelName(),
            data.effectiveRequestCount(),
            null,
            now);

        try {
            if (!counterStore.debit(pool.poolId(), event.eventId(), event.quotaUnits(), now)) {
                log.debug("Consumption debit already applied: eventId={}", event.eventId());
            }
        } catch (DataAccessException e) {
            log.warn("Cache unavailable, counter will be corrected by reconciliation: poolId={}, eventId={}, error={}",
                pool.poolId(), event.eventId(), e.getMessage());
        }
        writer.write(event);

        log.debug("Consumption recorded: eventId={}, poolId={}, amount={}", event.eventId(), pool.poolId(), amount);
        return event;
    }

    /**
     * 查詢預留紀錄。
     *
     * @throws ReservationNotFoundException 預留不存在或已超過保留時間
     */
    public Reservation getReservation(String reservationId) {
        try {
            return counterStore.findReservation(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Cache unavailable: reservationId=" + reservationId, e);
        }
    }
}
