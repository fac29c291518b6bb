package io.github.samzhu.poolledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.api.TrendPoint;
import io.github.samzhu.poolledger.dto.api.TrendResponse;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;
import io.github.samzhu.poolledger.util.TrendBuckets;

/**
 * 用量趨勢聚合服務。
 *
 * <p>以串流讀取 {@code [start, end)} 內的消耗事件，累加到固定寬度、
 * 對齊 Unix epoch 的時間分桶（見 {@link TrendBuckets}）。沒有事件的分桶輸出零值。
 *
 * <p>讀取失敗以 {@code durable-read} 策略重試，每次重試重新建立分桶。
 */
@Service
public class TrendAggregationService {

    private static final Logger log = LoggerFactory.getLogger(TrendAggregationService.class);

    private static final Duration HOUR = Duration.ofHours(1);

    private final ConsumptionEventRepository eventRepository;
    private final Retry readRetry;
    private final Clock clock;
    private final int maxBuckets;

    public TrendAggregationService(
            ConsumptionEventRepository eventRepository,
            RetryRegistry retryRegistry,
            PoolLedgerProperties properties,
            Clock clock) {
        this.eventRepository = eventRepository;
        this.readRetry = retryRegistry.retry(AppConfig.DURABLE_READ, AppConfig.DURABLE_READ);
        this.clock = clock;
        this.maxBuckets = properties.reporting().maxBuckets();
    }

    /**
     * 聚合消耗事件。
     *
     * @param poolId 配額池 ID，null 或空白表示所有配額池
     * @param start 開始時間（含）
     * @param end 結束時間（不含）
     * @param bucketWidth 分桶寬度，至少 1 秒
     * @return 依分桶開始時間遞增的趨勢點
     * @throws IllegalArgumentException 區間或分桶寬度無效，或分桶數超過上限
     */
    public List<TrendPoint> aggregate(String poolId, Instant start, Instant end, Duration bucketWidth) {
        // 先驗證參數，避免無效查詢進入資料庫
        TrendBuckets.covering(start, end, bucketWidth, maxBuckets);
        String pool = poolId == null || poolId.isBlank() ? null : poolId;

        long startTime = System.currentTimeMillis();
        List<TrendPoint> points = readRetry.executeSupplier(() -> collect(pool, start, end, bucketWidth));
        log.debug("Trend aggregated: poolId={}, start={}, end={}, width={}, buckets={}, in {}ms",
            pool, start, end, bucketWidth, points.size(), System.currentTimeMillis() - startTime);
        return points;
    }

    /**
     * 最近 {@code hours} 小時的每小時趨勢，最後一個分桶包含現在。
     */
    public TrendResponse hourlyTrend(String poolId, int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be at least 1: " + hours);
        }
        Instant end = clock.instant().truncatedTo(ChronoUnit.HOURS).plus(HOUR);
        Instant start = end.minus(HOUR.multipliedBy(hours));
        return trend(poolId, start, end, HOUR);
    }

    /**
     * 任意區間與分桶寬度的趨勢。
     */
    public TrendResponse trend(String poolId, Instant start, Instant end, Duration bucketWidth) {
        List<TrendPoint> points = aggregate(poolId, start, end, bucketWidth);
        String pool = poolId == null || poolId.isBlank() ? null : poolId;
        return new TrendResponse(pool, start, end, bucketWidth.toSeconds(), points);
    }

    private List<TrendPoint> collect(String poolId, Instant start, Instant end, Duration bucketWidth) {
        TrendBuckets buckets = TrendBuckets.covering(start, end, bucketWidth, maxBuckets);
        try (Stream<ConsumptionEvent> events = poolId == null
                ? eventRepository.findByConsumedAtGreaterThanEqualAndConsumedAtLessThanOrderByConsumedAtAsc(start, end)
                : eventRepository.findByPoolIdAndConsumedAtGreaterThanEqualAndConsumedAtLessThanOrderByConsumedAtAsc(
                    poolId, start, end)) {
            events.forEach(event -> buckets.add(event.consumedAt(), event.quotaConsumed(), event.requestCountIncrement()));
        }
        return buckets.points();
    }
}
