package io.github.samzhu.poolledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.api.ConsumptionRecord;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;

/**
 * 消耗紀錄查詢服務。
 *
 * <p>提供報表 API 的原始紀錄列表，依消耗時間由新到舊排序。
 */
@Service
public class ConsumptionQueryService {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionQueryService.class);

    private static final Duration DEFAULT_RANGE = Duration.ofHours(24);

    private final ConsumptionEventRepository eventRepository;
    private final Retry readRetry;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    public ConsumptionQueryService(
            ConsumptionEventRepository eventRepository,
            RetryRegistry retryRegistry,
            PoolLedgerProperties properties,
            Clock clock) {
        this.eventRepository = eventRepository;
        this.readRetry = retryRegistry.retry(AppConfig.DURABLE_READ, AppConfig.DURABLE_READ);
        this.clock = clock;
        this.defaultLimit = properties.reporting().defaultLimit();
        this.maxLimit = properties.reporting().maxLimit();
    }

    /**
     * 查詢消耗紀錄。
     *
     * @param poolId 配額池 ID，null 表示所有配額池
     * @param start 開始時間（含），null 時為 {@code end} 前 24 小時
     * @param end 結束時間（不含），null 時為現在
     * @param limit 最大筆數，null 或 ≤ 0 時使用預設值，超過上限時截斷
     * @return 由新到舊的消耗紀錄
     */
    public List<ConsumptionRecord> findRecent(String poolId, Instant start, Instant end, Integer limit) {
        Instant effectiveEnd = end != null ? end : clock.instant();
        Instant effectiveStart = start != null ? start : effectiveEnd.minus(DEFAULT_RANGE);
        if (!effectiveEnd.isAfter(effectiveStart)) {
            throw new IllegalArgumentException(
                "end_date must be after start_date: start=" + effectiveStart + ", end=" + effectiveEnd);
        }
        int effectiveLimit = limit == null || limit <= 0 ? defaultLimit : Math.min(limit, maxLimit);
        PageRequest page = PageRequest.of(0, effectiveLimit, Sort.by(Sort.Direction.DESC, "consumedAt"));

        List<ConsumptionEvent> events = readRetry.executeSupplier(() -> poolId == null || poolId.isBlank()
            ? eventRepository.findByConsumedAtGreaterThanEqualAndConsumedAtLessThan(effectiveStart, effectiveEnd, page)
            : eventRepository.findByPoolIdAndConsumedAtGreaterThanEqualAndConsumedAtLessThan(
                poolId, effectiveStart, effectiveEnd, page));

        log.debug("Consumption query: poolId={}, start={}, end={}, limit={}, found={}",
            poolId, effectiveStart, effectiveEnd, effectiveLimit, events.size());
        return events.stream().map(ConsumptionRecord::from).toList();
    }
}
