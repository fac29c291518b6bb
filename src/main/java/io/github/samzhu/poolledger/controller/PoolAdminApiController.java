package io.github.samzhu.poolledger.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.poolledger.dto.api.PoolRequest;
import io.github.samzhu.poolledger.dto.api.PoolStatusResponse;
import io.github.samzhu.poolledger.service.ConsumptionWriter;
import io.github.samzhu.poolledger.service.PoolService;
import io.github.samzhu.poolledger.service.QuotaReconciliationService;
import io.github.samzhu.poolledger.service.ReservationSweeper;

/**
 * 管理 API 控制器。
 *
 * <p>所有端點都需要管理金鑰，由 {@link io.github.samzhu.poolledger.config.AdminApiKeyInterceptor} 檢查。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/admin/pools} - 建立配額池</li>
 *   <li>{@code PUT /api/v1/admin/pools/{poolId}} - 更新配額池定義</li>
 *   <li>{@code POST /api/v1/admin/pools/{poolId}/reset} - 強制重置當期消耗</li>
 *   <li>{@code POST /api/v1/admin/pools/{poolId}/reconcile} - 校正快取計數器</li>
 *   <li>{@code POST /api/v1/admin/pools/reconcile} - 校正所有配額池</li>
 *   <li>{@code POST /api/v1/admin/reservations/sweep} - 立即清掃逾時預留</li>
 *   <li>{@code POST /api/v1/admin/consumption/flush} - 重送寫入失敗的消耗事件</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/admin")
public class PoolAdminApiController {

    private static final Logger log = LoggerFactory.getLogger(PoolAdminApiController.class);

    private final PoolService poolService;
    private final QuotaReconciliationService reconciliationService;
    private final ReservationSweeper sweeper;
    private final ConsumptionWriter writer;

    public PoolAdminApiController(
            PoolService poolService,
            QuotaReconciliationService reconciliationService,
            ReservationSweeper sweeper,
            ConsumptionWriter writer) {
        this.poolService = poolService;
        this.reconciliationService = reconciliationService;
        this.sweeper = sweeper;
        this.writer = writer;
    }

    // ========== 配額池管理 ==========

    @PostMapping("/pools")
    public ResponseEntity<PoolStatusResponse> createPool(@RequestBody @Validated PoolRequest request) {
        log.info("API request: createPool poolId={}, totalQuota={}", request.poolId(), request.totalQuota());
        return ResponseEntity.status(HttpStatus.CREATED).body(poolService.create(request));
    }

    @PutMapping("/pools/{poolId}")
    public ResponseEntity<PoolStatusResponse> updatePool(
            @PathVariable String poolId,
            @RequestBody @Validated PoolRequest request) {
        log.info("API request: updatePool poolId={}, totalQuota={}", poolId, request.totalQuota());
        return ResponseEntity.ok(poolService.update(poolId, request));
    }

    @PostMapping("/pools/{poolId}/reset")
    public ResponseEntity<PoolStatusResponse> resetPool(@PathVariable String poolId) {
        log.info("API request: resetPool poolId={}", poolId);
        return ResponseEntity.ok(poolService.forceReset(poolId));
    }

    @PostMapping("/pools/{poolId}/reconcile")
    public ResponseEntity<PoolStatusResponse> reconcilePool(@PathVariable String poolId) {
        log.info("API request: reconcilePool poolId={}", poolId);
        return ResponseEntity.ok(poolService.reconcile(poolId));
    }

    @PostMapping("/pools/reconcile")
    public ResponseEntity<ReconcileResult> reconcileAll() {
        log.info("API request: reconcileAll (manual)");
        int reconciled = reconciliationService.reconcileAll();
        return ResponseEntity.ok(new ReconcileResult(reconciled, "Reconciled " + reconciled + " pools"));
    }

    // ========== 維運 ==========

    @PostMapping("/reservations/sweep")
    public ResponseEntity<SweepResult> sweepReservations() {
        log.info("API request: sweepReservations (manual)");
        int released = sweeper.sweep();
        return ResponseEntity.ok(new SweepResult(released, "Released " + released + " expired reservations"));
    }

    @PostMapping("/consumption/flush")
    public ResponseEntity<FlushResult> flushConsumption() {
        log.info("API request: flushConsumption (manual)");
        int written = writer.flushBuffer();
        return ResponseEntity.ok(new FlushResult(written, writer.getBufferSize(), "Flush completed"));
    }

    /**
     * 校正結果回應。
     */
    public record ReconcileResult(int reconciledPools, String message) {}

    /**
     * 清掃結果回應。
     */
    public record SweepResult(int releasedReservations, String message) {}

    /**
     * 重送結果回應。
     */
    public record FlushResult(int writtenEvents, int stillBuffered, String message) {}
}
