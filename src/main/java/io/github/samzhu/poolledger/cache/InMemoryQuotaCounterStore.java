package io.github.samzhu.poolledger.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.ReservationState;

/**
 * 單一程序內的配額計數器。
 *
 * <p>適用於單節點部署與測試（{@code pool-ledger.cache.backend=memory}）。
 * 每個配額池一個 {@link PoolSlot}，所有修改在該池的鎖內完成，
 * 與 Redis 腳本提供相同的原子性保證。
 *
 * <p>過期（計數器 TTL、預留保留時間）以 {@link Clock} 判斷，讀取時惰性清除。
 */
@Component
@ConditionalOnProperty(prefix = "pool-ledger.cache", name = "backend", havingValue = "memory")
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQuotaCounterStore.class);

    private final Clock clock;
    private final Map<String, PoolSlot> pools = new ConcurrentHashMap<>();
    private final Map<String, StoredReservation> reservations = new ConcurrentHashMap<>();

    public InMemoryQuotaCounterStore(Clock clock) {
        this.clock = clock;
        log.info("InMemoryQuotaCounterStore initialized, counters are local to this instance");
    }

    /**
     * 單一配額池的計數器與預留表，以自身作為鎖。
     */
    private static final class PoolSlot {
        Long remaining;
        Instant expiresAt;
        final Map<String, PendingEntry> pending = new LinkedHashMap<>();
        final Map<String, CommittingEntry> committing = new LinkedHashMap<>();

        boolean counterPresent(Instant now) {
            if (remaining != null && expiresAt != null && !now.isBefore(expiresAt)) {
                remaining = null;
                expiresAt = null;
            }
            return remaining != null;
        }
    }

    private record PendingEntry(long units, Instant createdAt) {}

    private record StoredReservation(Reservation reservation, Instant expiresAt) {}

    private PoolSlot slot(String poolId) {
        return pools.computeIfAbsent(poolId, id -> new PoolSlot());
    }

    @Override
    public ReserveOutcome reserve(Reservation reservation, Duration retention) {
        PoolSlot slot = slot(reservation.poolId());
        synchronized (slot) {
            if (!slot.counterPresent(clock.instant())) {
                return ReserveOutcome.counterMissing();
            }
            if (slot.remaining < reservation.reservedUnits()) {
                return ReserveOutcome.insufficient(slot.remaining);
            }
            slot.remaining -= reservation.reservedUnits();
            slot.pending.put(reservation.reservationId(),
                new PendingEntry(reservation.reservedUnits(), reservation.createdAt()));
            reservations.put(reservation.reservationId(),
                new StoredReservation(reservation, reservation.createdAt().plus(retention)));
            return ReserveOutcome.granted(slot.remaining);
        }
    }

    @Override
    public ResolveOutcome commit(String reservationId, long actualUnits, String eventId, Instant now) {
        Optional<Reservation> current = findReservation(reservationId);
        if (current.isEmpty()) {
            return ResolveOutcome.notFound();
        }
        PoolSlot slot = slot(current.get().poolId());
        synchronized (slot) {
            StoredReservation stored = reservations.get(reservationId);
            if (stored == null) {
                return ResolveOutcome.notFound();
            }
            Reservation reservation = stored.reservation();
            if (reservation.state() != ReservationState.PENDING) {
                boolean same = reservation.state() == ReservationState.COMMITTED
                    && reservation.actualUnits() != null
                    && reservation.actualUnits() == actualUnits;
                return ResolveOutcome.alreadyResolved(reservation, same);
            }
            if (slot.counterPresent(clock.instant())) {
                slot.remaining += reservation.reservedUnits() - actualUnits;
            }
            Reservation committed = reservation.committed(actualUnits, eventId, now);
            reservations.put(reservationId, new StoredReservation(committed, stored.expiresAt()));
            slot.pending.remove(reservationId);
            slot.committing.put(eventId, new CommittingEntry(eventId, actualUnits, reservationId, now));
            return ResolveOutcome.resolved(committed);
        }
    }

    @Override
    public ResolveOutcome release(String reservationId, Instant now, boolean expired) {
        Optional<Reservation> current = findReservation(reservationId);
        if (current.isEmpty()) {
            return ResolveOutcome.notFound();
        }
        PoolSlot slot = slot(current.get().poolId());
        synchronized (slot) {
            StoredReservation stored = reservations.get(reservationId);
            if (stored == null) {
                return ResolveOutcome.notFound();
            }
            Reservation reservation = stored.reservation();
            if (reservation.state() != ReservationState.PENDING) {
                return ResolveOutcome.alreadyResolved(reservation, false);
            }
            if (slot.counterPresent(clock.instant())) {
                slot.remaining += reservation.reservedUnits();
            }
            Reservation released = reservation.released(now, expired);
            reservations.put(reservationId, new StoredReservation(released, stored.expiresAt()));
            slot.pending.remove(reservationId);
            return ResolveOutcome.resolved(released);
        }
    }

    @Override
    public boolean debit(String poolId, String eventId, long units, Instant now) {
        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            if (slot.committing.containsKey(eventId)) {
                return false;
            }
            if (slot.counterPresent(clock.instant())) {
                slot.remaining -= units;
            }
            slot.committing.put(eventId, new CommittingEntry(eventId, units, null, now));
            return true;
        }
    }

    @Override
    public OptionalLong remaining(String poolId) {
        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            return slot.counterPresent(clock.instant()) ? OptionalLong.of(slot.remaining) : OptionalLong.empty();
        }
    }

    @Override
    public Optional<Reservation> findReservation(String reservationId) {
        StoredReservation stored = reservations.get(reservationId);
        if (stored == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(stored.expiresAt())) {
            reservations.remove(reservationId, stored);
            return Optional.empty();
        }
        return Optional.of(stored.reservation());
    }

    /**
     * 列出逾時的 PENDING 預留，同時清除超過保留時間的預留紀錄。
     *
     * <p>清掃器每次都會呼叫，已結算或已釋放的紀錄因此不會無限累積。
     */
    @Override
    public List<String> findExpired(Instant createdBefore, int limit) {
        purgeExpired(clock.instant());
        return reservations.values().stream()
            .map(StoredReservation::reservation)
            .filter(r -> r.state() == ReservationState.PENDING)
            .filter(r -> !r.createdAt().isAfter(createdBefore))
            .sorted(Comparator.comparing(Reservation::createdAt))
            .limit(limit)
            .map(Reservation::reservationId)
            .toList();
    }

    private void purgeExpired(Instant now) {
        int before = reservations.size();
        reservations.values().removeIf(stored -> !now.isBefore(stored.expiresAt()));
        int purged = before - reservations.size();
        if (purged > 0) {
            log.debug("Purged {} reservation records past retention", purged);
        }
    }

    /**
     * 目前保留的預留紀錄數（含已結算、已釋放）。
     */
    int reservationCount() {
        return reservations.size();
    }

    @Override
    public Map<String, Long> pending(String poolId) {
        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            Map<String, Long> snapshot = new HashMap<>();
            slot.pending.forEach((id, entry) -> snapshot.put(id, entry.units()));
            return snapshot;
        }
    }

    @Override
    public List<CommittingEntry> committing(String poolId) {
        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            return new ArrayList<>(slot.committing.values());
        }
    }

    @Override
    public RebuildResult rebuild(
            String poolId,
            long baseUnits,
            Collection<String> settledEventIds,
            Duration ttl,
            Instant stalePendingBefore,
            boolean onlyIfAbsent) {

        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            Instant now = clock.instant();
            if (onlyIfAbsent && slot.counterPresent(now)) {
                return new RebuildResult(false, slot.remaining, 0, 0);
            }
            settledEventIds.forEach(slot.committing::remove);
            slot.pending.values().removeIf(entry -> entry.createdAt().isBefore(stalePendingBefore));

            long pendingUnits = slot.pending.values().stream().mapToLong(PendingEntry::units).sum();
            long committingUnits = slot.committing.values().stream().mapToLong(CommittingEntry::units).sum();
            slot.remaining = baseUnits - pendingUnits - committingUnits;
            slot.expiresAt = now.plus(ttl.isNegative() || ttl.isZero() ? Duration.ofMillis(1) : ttl);
            return new RebuildResult(true, slot.remaining, pendingUnits, committingUnits);
        }
    }

    @Override
    public void evict(String poolId) {
        PoolSlot slot = slot(poolId);
        synchronized (slot) {
            slot.remaining = null;
            slot.expiresAt = null;
        }
    }
}
