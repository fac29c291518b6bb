package io.github.samzhu.poolledger.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.dto.Reservation;
import io.github.samzhu.poolledger.dto.ReservationState;

/**
 * Redis 實作的配額計數器。
 *
 * <p>Key 結構（{@code prefix} 預設為 {@code pool-ledger:}）：
 * <pre>
 * {prefix}pool:{poolId}:remaining      STRING  剩餘額度（微單位），TTL 到視窗結束
 * {prefix}pool:{poolId}:pending        HASH    reservationId → "units:createdAtMillis"
 * {prefix}pool:{poolId}:committing     HASH    eventId → "units:reservationId:committedAtMillis"
 * {prefix}reservation:{reservationId}  HASH    預留紀錄，TTL = retention
 * {prefix}reservations:pending-by-time ZSET    score = createdAtMillis
 * </pre>
 *
 * <p>所有修改都以 Lua 腳本執行，Redis 單執行緒保證腳本是原子的。
 * 結算/釋放前先讀取預留紀錄取得 poolId（poolId 建立後不會改變），
 * 腳本內再檢查一次狀態。
 *
 * <p>Lua 數值為雙精度浮點數，微單位在 2^53 以內都是精確的。
 * 回寫計數器時以 {@code string.format('%d')} 輸出，避免科學記號。
 *
 * @see <a href="https://redis.io/docs/latest/develop/interact/programmability/eval-intro/">Redis Lua Scripting</a>
 */
@Component
@ConditionalOnProperty(prefix = "pool-ledger.cache", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisQuotaCounterStore implements QuotaCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisQuotaCounterStore.class);

    private static final long OK = 1L;
    private static final long INSUFFICIENT = -1L;
    private static final long COUNTER_MISSING = -2L;
    private static final long NOT_FOUND = -3L;
    private static final long NOT_PENDING = -4L;

    // KEYS: remaining, pending, reservation, index
    // ARGV: units, reservationId, poolId, createdAtMs, retentionMs, sourceKeyId, modelName
    private static final DefaultRedisScript<List> RESERVE = new DefaultRedisScript<>("""
        local remaining = redis.call('GET', KEYS[1])
        if not remaining then return {-2, 0} end
        remaining = tonumber(remaining)
        if remaining < tonumber(ARGV[1]) then return {-1, remaining} end
        local left = redis.call('DECRBY', KEYS[1], ARGV[1])
        redis.call('HSET', KEYS[3], 'poolId', ARGV[3], 'reservedUnits', ARGV[1], 'state', 'PENDING',
            'createdAt', ARGV[4], 'sourceKeyId', ARGV[6], 'modelName', ARGV[7])
        redis.call('PEXPIRE', KEYS[3], ARGV[5])
        redis.call('HSET', KEYS[2], ARGV[2], ARGV[1] .. ':' .. ARGV[4])
        redis.call('ZADD', KEYS[4], ARGV[4], ARGV[2])
        return {1, left}
        """, List.class);

    // KEYS: reservation, remaining, pending, committing, index
    // ARGV: reservationId, actualUnits, eventId, nowMs, delta, committingValue
    private static final DefaultRedisScript<List> COMMIT = new DefaultRedisScript<>("""
        local state = redis.call('HGET', KEYS[1], 'state')
        if not state then return {-3, 0} end
        if state ~= 'PENDING' then
          local same = 0
          if state == 'COMMITTED' and redis.call('HGET', KEYS[1], 'actualUnits') == ARGV[2] then same = 1 end
          return {-4, same}
        end
        if redis.call('EXISTS', KEYS[2]) == 1 then
          redis.call('INCRBY', KEYS[2], ARGV[5])
        end
        redis.call('HSET', KEYS[1], 'state', 'COMMITTED', 'actualUnits', ARGV[2], 'eventId', ARGV[3], 'resolvedAt', ARGV[4])
        redis.call('HDEL', KEYS[3], ARGV[1])
        redis.call('HSET', KEYS[4], ARGV[3], ARGV[6])
        redis.call('ZREM', KEYS[5], ARGV[1])
        return {1, 0}
        """, List.class);

    // KEYS: reservation, remaining, pending, index
    // ARGV: reservationId, nowMs, expired
    private static final DefaultRedisScript<List> RELEASE = new DefaultRedisScript<>("""
        local state = redis.call('HGET', KEYS[1], 'state')
        if not state then
          redis.call('ZREM', KEYS[4], ARGV[1])
          return {-3, 0}
        end
        if state ~= 'PENDING' then return {-4, 0} end
        if redis.call('EXISTS', KEYS[2]) == 1 then
          redis.call('INCRBY', KEYS[2], redis.call('HGET', KEYS[1], 'reservedUnits'))
        end
        redis.call('HSET', KEYS[1], 'state', 'RELEASED', 'resolvedAt', ARGV[2], 'expired', ARGV[3])
        redis.call('HDEL', KEYS[3], ARGV[1])
        redis.call('ZREM', KEYS[4], ARGV[1])
        return {1, 0}
        """, List.class);

    // KEYS: remaining, committing
    // ARGV: eventId, units, committingValue
    private static final DefaultRedisScript<Long> DEBIT = new DefaultRedisScript<>("""
        if redis.call('HEXISTS', KEYS[2], ARGV[1]) == 1 then return 0 end
        if redis.call('EXISTS', KEYS[1]) == 1 then
          redis.call('DECRBY', KEYS[1], ARGV[2])
        end
        redis.call('HSET', KEYS[2], ARGV[1], ARGV[3])
        return 1
        """, Long.class);

    // KEYS: remaining, pending, committing
    // ARGV: baseUnits, onlyIfAbsent, ttlMs, stalePendingBeforeMs, settledEventIds...
    private static final DefaultRedisScript<List> REBUILD = new DefaultRedisScript<>("""
        if ARGV[2] == '1' then
          local current = redis.call('GET', KEYS[1])
          if current then return {0, tonumber(current), 0, 0} end
        end
        for i = 5, #ARGV do
          redis.call('HDEL', KEYS[3], ARGV[i])
        end
        local staleBefore = tonumber(ARGV[4])
        local pendingSum = 0
        local pending = redis.call('HGETALL', KEYS[2])
        for i = 1, #pending, 2 do
          local units, created = string.match(pending[i + 1], '^(%-?%d+):(%d+)$')
          if units and tonumber(created) < staleBefore then
            redis.call('HDEL', KEYS[2], pending[i])
          elseif units then
            pendingSum = pendingSum + tonumber(units)
          end
        end
        local committingSum = 0
        for _, v in ipairs(redis.call('HVALS', KEYS[3])) do
          committingSum = committingSum + tonumber(string.match(v, '^%-?%d+'))
        end
        local remaining = tonumber(ARGV[1]) - pendingSum - committingSum
        redis.call('SET', KEYS[1], string.format('%d', remaining), 'PX', ARGV[3])
        return {1, remaining, pendingSum, committingSum}
        """, List.class);

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisQuotaCounterStore(StringRedisTemplate redis, PoolLedgerProperties properties) {
        this.redis = redis;
        this.prefix = properties.cache().keyPrefix();
        log.info("RedisQuotaCounterStore initialized: keyPrefix={}", prefix);
    }

    @Override
    public ReserveOutcome reserve(Reservation reservation, Duration retention) {
        String poolId = reservation.poolId();
        List<?> result = redis.execute(RESERVE,
            List.of(remainingKey(poolId), pendingKey(poolId), reservationKey(reservation.reservationId()), indexKey()),
            Long.toString(reservation.reservedUnits()),
            reservation.reservationId(),
            poolId,
            Long.toString(reservation.createdAt().toEpochMilli()),
            Long.toString(retention.toMillis()),
            nullToEmpty(reservation.sourceKeyId()),
            nullToEmpty(reservation.modelName()));

        long status = element(result, 0);
        if (status == COUNTER_MISSING) {
            return ReserveOutcome.counterMissing();
        }
        if (status == INSUFFICIENT) {
            return ReserveOutcome.insufficient(element(result, 1));
        }
        return ReserveOutcome.granted(element(result, 1));
    }

    @Override
    public ResolveOutcome commit(String reservationId, long actualUnits, String eventId, Instant now) {
        Optional<Reservation> current = findReservation(reservationId);
        if (current.isEmpty()) {
            return ResolveOutcome.notFound();
        }
        Reservation reservation = current.get();
        String poolId = reservation.poolId();
        CommittingEntry entry = new CommittingEntry(eventId, actualUnits, reservationId, now);

        List<?> result = redis.execute(COMMIT,
            List.of(reservationKey(reservationId), remainingKey(poolId), pendingKey(poolId),
                committingKey(poolId), indexKey()),
            reservationId,
            Long.toString(actualUnits),
            eventId,
            Long.toString(now.toEpochMilli()),
            Long.toString(reservation.reservedUnits() - actualUnits),
            entry.encode());

        return resolveOutcome(reservationId, result, reservation.committed(actualUnits, eventId, now));
    }

    @Override
    public ResolveOutcome release(String reservationId, Instant now, boolean expired) {
        Optional<Reservation> current = findReservation(reservationId);
        if (current.isEmpty()) {
            redis.opsForZSet().remove(indexKey(), reservationId);
            return ResolveOutcome.notFound();
        }
        Reservation reservation = current.get();
        String poolId = reservation.poolId();

        List<?> result = redis.execute(RELEASE,
            List.of(reservationKey(reservationId), remainingKey(poolId), pendingKey(poolId), indexKey()),
            reservationId,
            Long.toString(now.toEpochMilli()),
            expired ? "1" : "0");

        return resolveOutcome(reservationId, result, reservation.released(now, expired));
    }

    private ResolveOutcome resolveOutcome(String reservationId, List<?> result, Reservation resolved) {
        long status = element(result, 0);
        if (status == NOT_FOUND) {
            return ResolveOutcome.notFound();
        }
        if (status == NOT_PENDING) {
            Reservation latest = findReservation(reservationId).orElse(null);
            return ResolveOutcome.alreadyResolved(latest, element(result, 1) == OK);
        }
        return ResolveOutcome.resolved(resolved);
    }

    @Override
    public boolean debit(String poolId, String eventId, long units, Instant now) {
        CommittingEntry entry = new CommittingEntry(eventId, units, null, now);
        Long applied = redis.execute(DEBIT,
            List.of(remainingKey(poolId), committingKey(poolId)),
            eventId,
            Long.toString(units),
            entry.encode());
        return applied != null && applied == OK;
    }

    @Override
    public OptionalLong remaining(String poolId) {
        String value = redis.opsForValue().get(remainingKey(poolId));
        return value == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(value));
    }

    @Override
    public Optional<Reservation> findReservation(String reservationId) {
        Map<Object, Object> fields = redis.opsForHash().entries(reservationKey(reservationId));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toReservation(reservationId, fields));
    }

    @Override
    public List<String> findExpired(Instant createdBefore, int limit) {
        Set<String> ids = redis.opsForZSet().rangeByScore(
            indexKey(), Double.NEGATIVE_INFINITY, createdBefore.toEpochMilli(), 0, limit);
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    @Override
    public Map<String, Long> pending(String poolId) {
        Map<String, Long> pending = new HashMap<>();
        redis.opsForHash().entries(pendingKey(poolId)).forEach((id, value) -> {
            String[] parts = value.toString().split(":", 2);
            pending.put(id.toString(), Long.parseLong(parts[0]));
        });
        return pending;
    }

    @Override
    public List<CommittingEntry> committing(String poolId) {
        List<CommittingEntry> entries = new ArrayList<>();
        redis.opsForHash().entries(committingKey(poolId)).forEach((eventId, value) -> {
            try {
                entries.add(CommittingEntry.decode(eventId.toString(), value.toString()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed committing entry: poolId={}, eventId={}, value={}",
                    poolId, eventId, value);
            }
        });
        return entries;
    }

    @Override
    public RebuildResult rebuild(
            String poolId,
            long baseUnits,
            Collection<String> settledEventIds,
            Duration ttl,
            Instant stalePendingBefore,
            boolean onlyIfAbsent) {

        List<String> args = new ArrayList<>(4 + settledEventIds.size());
        args.add(Long.toString(baseUnits));
        args.add(onlyIfAbsent ? "1" : "0");
        args.add(Long.toString(Math.max(1, ttl.toMillis())));
        args.add(Long.toString(stalePendingBefore.toEpochMilli()));
        args.addAll(settledEventIds);

        List<?> result = redis.execute(REBUILD,
            List.of(remainingKey(poolId), pendingKey(poolId), committingKey(poolId)),
            args.toArray());

        return new RebuildResult(
            element(result, 0) == OK,
            element(result, 1),
            element(result, 2),
            element(result, 3));
    }

    @Override
    public void evict(String poolId) {
        redis.delete(remainingKey(poolId));
    }

    private Reservation toReservation(String reservationId, Map<Object, Object> fields) {
        String actual = string(fields, "actualUnits");
        String resolvedAt = string(fields, "resolvedAt");
        return new Reservation(
            reservationId,
            string(fields, "poolId"),
            Long.parseLong(string(fields, "reservedUnits")),
            ReservationState.valueOf(string(fields, "state")),
            Instant.ofEpochMilli(Long.parseLong(string(fields, "createdAt"))),
            resolvedAt == null ? null : Instant.ofEpochMilli(Long.parseLong(resolvedAt)),
            actual == null ? null : Long.parseLong(actual),
            string(fields, "eventId"),
            string(fields, "sourceKeyId"),
            string(fields, "modelName"),
            "1".equals(string(fields, "expired")));
    }

    private static String string(Map<Object, Object> fields, String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        String s = value.toString();
        return s.isEmpty() ? null : s;
    }

    private static long element(List<?> result, int index) {
        if (result == null || result.size() <= index) {
            throw new IllegalStateException("Unexpected script result: " + result);
        }
        return ((Number) result.get(index)).longValue();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private String remainingKey(String poolId) {
        return prefix + "pool:" + poolId + ":remaining";
    }

    private String pendingKey(String poolId) {
        return prefix + "pool:" + poolId + ":pending";
    }

    private String committingKey(String poolId) {
        return prefix + "pool:" + poolId + ":committing";
    }

    private String reservationKey(String reservationId) {
        return prefix + "reservation:" + reservationId;
    }

    private String indexKey() {
        return prefix + "reservations:pending-by-time";
    }
}
