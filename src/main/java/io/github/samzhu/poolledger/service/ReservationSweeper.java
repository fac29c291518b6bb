package io.github.samzhu.poolledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.poolledger.cache.QuotaCounterStore;
import io.github.samzhu.poolledger.cache.ResolveOutcome;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;

/**
 * 逾時預留清掃服務。
 *
 * <p>定時找出建立超過 {@code pool-ledger.reservation.timeout} 仍為 PENDING 的預留，
 * 以逾時釋放（{@code expired=true}）退回額度。
 *
 * <p>每個實例都可以執行：釋放腳本保證同一預留只有一次釋放成功，
 * 與呼叫端的 commit/release 競爭時也只有一方生效。
 */
@Service
public class ReservationSweeper {

    private static final Logger log = LoggerFactory.getLogger(ReservationSweeper.class);

    private final QuotaCounterStore counterStore;
    private final Clock clock;
    private final Duration timeout;
    private final int batchSize;

    public ReservationSweeper(QuotaCounterStore counterStore, PoolLedgerProperties properties, Clock clock) {
        this.counterStore = counterStore;
        this.clock = clock;
        this.timeout = properties.reservation().timeout();
        this.batchSize = properties.reservation().sweepBatchSize();
    }

    /**
     * 定時清掃，間隔由 {@code pool-ledger.reservation.sweep-interval-ms} 配置。
     */
    @Scheduled(fixedDelayString = "${pool-ledger.reservation.sweep-interval-ms:5000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (DataAccessException e) {
            log.warn("Reservation sweep skipped, cache unavailable: {}", e.getMessage());
        }
    }

    /**
     * 執行一次清掃。
     *
     * @return 本次釋放的預留數
     */
    public int sweep() {
        Instant now = clock.instant();
        List<String> expired = counterStore.findExpired(now.minus(timeout), batchSize);
        if (expired.isEmpty()) {
            return 0;
        }

        int released = 0;
        for (String reservationId : expired) {
            ResolveOutcome outcome = counterStore.release(reservationId, now, true);
            if (outcome.status() == ResolveOutcome.Status.RESOLVED) {
                released++;
                log.debug("Expired reservation released: reservationId={}, poolId={}, amount={}",
                    reservationId, outcome.reservation().poolId(), outcome.reservation().reservedAmount());
            } else {
                log.debug("Expired reservation already resolved elsewhere: reservationId={}, status={}",
                    reservationId, outcome.status());
            }
        }

        if (released > 0) {
            log.info("Reservation sweep completed: {} of {} expired reservations released", released, expired.size());
        }
        return released;
    }
}
