package io.github.samzhu.poolledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.QuotaPool;
import io.github.samzhu.poolledger.dto.api.PoolRequest;
import io.github.samzhu.poolledger.dto.api.PoolStatusResponse;
import io.github.samzhu.poolledger.exception.PoolAlreadyExistsException;
import io.github.samzhu.poolledger.exception.PoolUnknownException;
import io.github.samzhu.poolledger.repository.QuotaPoolRepository;
import io.github.samzhu.poolledger.service.QuotaReconciliationService.LedgerSnapshot;
import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.ResetPolicy;

/**
 * 配額池管理服務。
 *
 * <p>負責配額池定義的建立、更新、強制重置與狀態查詢。
 * 每次修改定義後立即校正快取計數器，讓新的總額度馬上生效。
 * 校正失敗（例如快取暫時無法使用）不影響定義的寫入，
 * 計數器會在下一次定時校正或預留時重建。
 */
@Service
public class PoolService {

    private static final Logger log = LoggerFactory.getLogger(PoolService.class);

    private final QuotaPoolRepository poolRepository;
    private final QuotaReconciliationService reconciliationService;
    private final PoolLedgerProperties.PoolDefaults defaults;
    private final Retry readRetry;
    private final Clock clock;

    public PoolService(
            QuotaPoolRepository poolRepository,
            QuotaReconciliationService reconciliationService,
            RetryRegistry retryRegistry,
            PoolLedgerProperties properties,
            Clock clock) {
        this.poolRepository = poolRepository;
        this.reconciliationService = reconciliationService;
        this.defaults = properties.poolDefaults();
        this.readRetry = retryRegistry.retry(AppConfig.DURABLE_READ, AppConfig.DURABLE_READ);
        this.clock = clock;
    }

    /**
     * 取得配額池定義。
     *
     * @throws PoolUnknownException 配額池不存在
     */
    public QuotaPool findPool(String poolId) {
        return readRetry.executeSupplier(() -> poolRepository.findByPoolId(poolId))
            .orElseThrow(() -> new PoolUnknownException(poolId));
    }

    /**
     * 建立配額池。
     *
     * @throws PoolAlreadyExistsException poolId 已存在
     * @throws IllegalArgumentException 參數無效
     */
    public PoolStatusResponse create(PoolRequest request) {
        String poolId = request.poolId();
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("pool_id is required");
        }
        if (poolRepository.existsByPoolId(poolId)) {
            throw new PoolAlreadyExistsException(poolId);
        }

        QuotaPool pool = QuotaPool.create(
            poolId,
            displayName(request, poolId),
            request.totalQuota(),
            resetPolicy(request.resetPolicy()),
            rollingWindow(request.rollingWindow()),
            clock.instant());

        QuotaPool saved;
        try {
            saved = poolRepository.save(pool);
        } catch (DuplicateKeyException e) {
            throw new PoolAlreadyExistsException(poolId);
        }

        log.info("Pool created: poolId={}, totalQuota={}, resetPolicy={}",
            saved.poolId(), saved.totalQuota(), saved.resetPolicy());
        reconcileQuietly(saved);
        return status(saved);
    }

    /**
     * 更新配額池定義，未提供的重置策略與視窗沿用原值。
     */
    public PoolStatusResponse update(String poolId, PoolRequest request) {
        QuotaPool current = findPool(poolId);

        QuotaPool updated = current.withDefinition(
            request.displayName() != null ? request.displayName() : current.displayName(),
            request.totalQuota(),
            request.resetPolicy() != null ? ResetPolicy.parse(request.resetPolicy()) : current.policy(),
            request.rollingWindow() != null ? validWindow(request.rollingWindow()) : current.rollingWindow(),
            clock.instant());
        QuotaPool saved = poolRepository.save(updated);

        log.info("Pool updated: poolId={}, totalQuota={} -> {}, resetPolicy={}",
            poolId, current.totalQuota(), saved.totalQuota(), saved.resetPolicy());
        reconcileQuietly(saved);
        return status(saved);
    }

    /**
     * 強制重置：當期消耗從現在起重新計算。
     */
    public PoolStatusResponse forceReset(String poolId) {
        QuotaPool saved = poolRepository.save(findPool(poolId).withResetAt(clock.instant()));

        log.info("Pool force-reset: poolId={}, resetAt={}", poolId, saved.resetAt());
        reconcileQuietly(saved);
        return status(saved);
    }

    /**
     * 手動校正快取計數器。
     */
    public PoolStatusResponse reconcile(String poolId) {
        QuotaPool pool = findPool(poolId);
        reconciliationService.reconcile(pool);
        return status(pool);
    }

    public PoolStatusResponse status(String poolId) {
        return status(findPool(poolId));
    }

    public List<PoolStatusResponse> list() {
        return readRetry.executeSupplier(poolRepository::findAllByOrderByPoolIdAsc).stream()
            .map(this::status)
            .toList();
    }

    private PoolStatusResponse status(QuotaPool pool) {
        LedgerSnapshot snapshot = reconciliationService.snapshot(pool);
        BigDecimal cached = snapshot.cachedRemaining().isPresent()
            ? QuotaUnits.toAmount(snapshot.cachedRemaining().getAsLong())
            : null;

        return new PoolStatusResponse(
            pool.poolId(),
            pool.displayName(),
            pool.totalQuota(),
            pool.resetPolicy(),
            pool.rollingWindowSeconds(),
            new PoolStatusResponse.Window(snapshot.window().start(), snapshot.window().end()),
            snapshot.consumed(),
            QuotaUnits.toAmount(snapshot.pendingUnits()),
            QuotaUnits.toAmount(snapshot.committingUnits()),
            cached,
            QuotaUnits.toAmount(snapshot.computedRemainingUnits()),
            pool.resetAt(),
            pool.updatedAt()
        );
    }

    private void reconcileQuietly(QuotaPool pool) {
        try {
            reconciliationService.reconcile(pool);
        } catch (DataAccessException e) {
            log.warn("Counter reconciliation deferred, will rebuild on next pass: poolId={}, error={}",
                pool.poolId(), e.getMessage());
        }
    }

    private static String displayName(PoolRequest request, String poolId) {
        return request.displayName() != null && !request.displayName().isBlank() ? request.displayName() : poolId;
    }

    private ResetPolicy resetPolicy(String requested) {
        return ResetPolicy.parse(requested != null ? requested : defaults.resetPolicy());
    }

    private Duration rollingWindow(Duration requested) {
        return requested != null ? validWindow(requested) : defaults.rollingWindow();
    }

    private static Duration validWindow(Duration window) {
        if (window.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("rolling_window must be at least 1 second: " + window);
        }
        return window;
    }
}
