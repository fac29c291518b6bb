package io.github.samzhu.poolledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.cache.CommittingEntry;
import io.github.samzhu.poolledger.cache.QuotaCounterStore;
import io.github.samzhu.poolledger.cache.RebuildResult;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.document.QuotaPool;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.ReservationState;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;
import io.github.samzhu.poolledger.repository.QuotaPoolRepository;
import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.QuotaWindows.QuotaWindow;

/**
 * 快取計數器校正服務。
 *
 * <p>剩餘額度的權威定義：
 * <pre>
 * remaining = totalQuota
 *           − Σ 資料庫中當期消耗事件
 *           − Σ pending 預留
 *           − Σ committing 中尚未寫入資料庫的事件
 * </pre>
 *
 * <p>校正流程：
 * <ol>
 *   <li>快照 committing 表</li>
 *   <li>查詢其中哪些事件已寫入資料庫</li>
 *   <li>查詢資料庫當期消耗加總</li>
 *   <li>單一原子腳本：移除已寫入的 committing 項目，加總其餘 pending/committing，覆寫計數器</li>
 * </ol>
 * 步驟 2 確認已寫入的事件必定包含在步驟 3 的加總中；步驟 1 之後才結算的事件
 * 仍留在 committing 表並被扣除。最壞情況是同一事件被重複扣除（低估剩餘額度），
 * 下一次校正即修正，不會高估。
 *
 * <p>觸發時機：
 * <ul>
 *   <li>Cron 定時校正所有配額池（{@code pool-ledger.reconciliation.cron}）</li>
 *   <li>預留時發現計數器不存在（{@link #repair(QuotaPool)}，只在計數器不存在時寫入）</li>
 *   <li>配額池建立、更新、強制重置之後，以及管理 API 手動觸發</li>
 * </ul>
 *
 * <p>崩潰復原：committing 項目超過 {@code recovery-grace} 仍未寫入資料庫，
 * 且不在本機重送緩衝區中，則從保留的預留紀錄重建事件並寫入。
 * 直接記錄的事件沒有預留紀錄可供重建，超過保留時間後放棄並記錄 ERROR。
 */
@Service
public class QuotaReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(QuotaReconciliationService.class);

    private final QuotaPoolRepository poolRepository;
    private final ConsumptionEventRepository eventRepository;
    private final QuotaCounterStore counterStore;
    private final ConsumptionWriter writer;
    private final Retry readRetry;
    private final Clock clock;

    private final Duration counterTtl;
    private final Duration retention;
    private final Duration recoveryGrace;

    public QuotaReconciliationService(
            QuotaPoolRepository poolRepository,
            ConsumptionEventRepository eventRepository,
            QuotaCounterStore counterStore,
            ConsumptionWriter writer,
            RetryRegistry retryRegistry,
            PoolLedgerProperties properties,
            Clock clock) {
        this.poolRepository = poolRepository;
        this.eventRepository = eventRepository;
        this.counterStore = counterStore;
        this.writer = writer;
        this.readRetry = retryRegistry.retry(AppConfig.DURABLE_READ, AppConfig.DURABLE_READ);
        this.clock = clock;
        this.counterTtl = properties.cache().counterTtl();
        this.retention = properties.reservation().retention();
        this.recoveryGrace = properties.reconciliation().recoveryGrace();
    }

    /**
     * 當期帳本快照，用於狀態查詢。
     *
     * @param window 目前配額視窗
     * @param consumed 資料庫中當期消耗
     * @param pendingUnits pending 預留合計（微單位）
     * @param committingUnits 尚未寫入資料庫的 committing 合計（微單位）
     * @param cachedRemaining 快取計數器，不存在時為 empty
     * @param computedRemainingUnits 依定義計算的剩餘額度（微單位）
     */
    public record LedgerSnapshot(
        QuotaWindow window,
        BigDecimal consumed,
        long pendingUnits,
        long committingUnits,
        OptionalLong cachedRemaining,
        long computedRemainingUnits
    ) {}

    /**
     * 強制校正單一配額池。
     */
    public RebuildResult reconcile(QuotaPool pool) {
        return rebuild(pool, false);
    }

    /**
     * 修復不存在的計數器；計數器已存在（例如其他實例剛修復）時不做任何修改。
     */
    public RebuildResult repair(QuotaPool pool) {
        OptionalLong current = counterStore.remaining(pool.poolId());
        if (current.isPresent()) {
            return new RebuildResult(false, current.getAsLong(), 0, 0);
        }
        log.info("Quota counter missing, rebuilding from durable store: poolId={}", pool.poolId());
        return rebuild(pool, true);
    }

    /**
     * 定時校正所有配額池。
     *
     * <p>單一配額池失敗不影響其他配額池。
     *
     * @return 成功校正的配額池數
     */
    @Scheduled(cron = "${pool-ledger.reconciliation.cron:0 */5 * * * *}")
    public int reconcileAll() {
        long startTime = System.currentTimeMillis();
        List<QuotaPool> pools = read(() -> poolRepository.findAll());

        int reconciled = 0;
        for (QuotaPool pool : pools) {
            try {
                reconcile(pool);
                reconciled++;
            } catch (Exception e) {
                log.warn("Reconciliation failed: poolId={}, error={}", pool.poolId(), e.getMessage(), e);
            }
        }

        log.info("Reconciliation pass completed: {}/{} pools in {}ms",
            reconciled, pools.size(), System.currentTimeMillis() - startTime);
        return reconciled;
    }

    /**
     * 計算帳本快照，不修改快取。
     */
    public LedgerSnapshot snapshot(QuotaPool pool) {
        Instant now = clock.instant();
        QuotaWindow window = pool.currentWindow(now);

        OptionalLong cached = counterStore.remaining(pool.poolId());
        Map<String, Long> pending = counterStore.pending(pool.poolId());
        List<CommittingEntry> committing = counterStore.committing(pool.poolId());

        Set<String> durable = read(() -> eventRepository.findExistingEventIds(eventIds(committing)));
        BigDecimal consumed = read(() -> eventRepository.sumQuotaConsumed(pool.poolId(), window.start()));

        long pendingUnits = pending.values().stream().mapToLong(Long::longValue).sum();
        long committingUnits = committing.stream()
            .filter(entry -> !durable.contains(entry.eventId()))
            .mapToLong(CommittingEntry::units)
            .sum();
        long computed = pool.totalUnits() - QuotaUnits.toUnits(consumed) - pendingUnits - committingUnits;

        return new LedgerSnapshot(window, consumed, pendingUnits, committingUnits, cached, computed);
    }

    private RebuildResult rebuild(QuotaPool pool, boolean onlyIfAbsent) {
        String poolId = pool.poolId();
        Instant now = clock.instant();
        QuotaWindow window = pool.currentWindow(now);

        List<CommittingEntry> committing = counterStore.committing(poolId);
        Set<String> settled = onlyIfAbsent ? new HashSet<>() : recoverOverdue(poolId, committing, now);

        Set<String> candidates = eventIds(committing);
        candidates.removeAll(settled);
        settled.addAll(read(() -> eventRepository.findExistingEventIds(candidates)));

        BigDecimal consumed = read(() -> eventRepository.sumQuotaConsumed(poolId, window.start()));
        long baseUnits = pool.totalUnits() - QuotaUnits.toUnits(consumed);
        Duration ttl = window.counterTtl(now, counterTtl);

        RebuildResult result = counterStore.rebuild(
            poolId, baseUnits, settled, ttl, now.minus(retention), onlyIfAbsent);

        if (result.applied()) {
            log.info("Quota counter rebuilt: poolId={}, remaining={}, consumed={}, pending={}, committing={}, settled={}",
                poolId,
                QuotaUnits.toAmount(result.remainingUnits()),
                consumed,
                QuotaUnits.toAmount(result.pendingUnits()),
                QuotaUnits.toAmount(result.committingUnits()),
                settled.size());
        } else {
            log.debug("Quota counter already present, rebuild skipped: poolId={}", poolId);
        }
        return result;
    }

    /**
     * 處理逾期未寫入資料庫的 committing 項目。
     *
     * @return 確定放棄、應從 committing 表移除的事件 ID
     */
    private Set<String> recoverOverdue(String poolId, List<CommittingEntry> committing, Instant now) {
        Set<String> abandoned = new HashSet<>();
        Instant graceCutoff = now.minus(recoveryGrace);
        Instant retentionCutoff = now.minus(retention);

        List<CommittingEntry> overdue = committing.stream()
            .filter(entry -> entry.committedAt().isBefore(graceCutoff))
            .filter(entry -> !writer.isBuffered(entry.eventId()))
            .toList();
        if (overdue.isEmpty()) {
            return abandoned;
        }

        Set<String> durable = read(() -> eventRepository.findExistingEventIds(eventIds(overdue)));
        for (CommittingEntry entry : overdue) {
            if (durable.contains(entry.eventId())) {
                continue;
            }

            Optional<Reservation> reservation = entry.fromReservation()
                ? counterStore.findReservation(entry.reservationId())
                : Optional.empty();
            if (reservation.isPresent() && reservation.get().state() == ReservationState.COMMITTED) {
                log.warn("Re-materializing consumption event from reservation: poolId={}, eventId={}, reservationId={}",
                    poolId, entry.eventId(), entry.reservationId());
                writer.write(ConsumptionEvent.forReservation(reservation.get(), now));
            } else if (entry.committedAt().isBefore(retentionCutoff)) {
                log.error("Dropping unrecoverable consumption event, amount is lost from the ledger: "
                        + "poolId={}, eventId={}, amount={}, committedAt={}",
                    poolId, entry.eventId(), QuotaUnits.toAmount(entry.units()), entry.committedAt());
                abandoned.add(entry.eventId());
            } else {
                log.warn("Consumption event not yet persisted: poolId={}, eventId={}, committedAt={}",
                    poolId, entry.eventId(), entry.committedAt());
            }
        }
        return abandoned;
    }

    private static Set<String> eventIds(List<CommittingEntry> entries) {
        return entries.stream().map(CommittingEntry::eventId).collect(Collectors.toCollection(HashSet::new));
    }

    private <T> T read(Supplier<T> supplier) {
        return readRetry.executeSupplier(supplier);
    }
}
