package io.github.samzhu.poolledger.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.poolledger.dto.api.ConsumptionRecord;
import io.github.samzhu.poolledger.dto.api.TrendResponse;
import io.github.samzhu.poolledger.service.ConsumptionQueryService;
import io.github.samzhu.poolledger.service.TrendAggregationService;

/**
 * 用量報表 REST API 控制器（唯讀）。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/usage/consumption} - 消耗紀錄（由新到舊）</li>
 *   <li>{@code GET /api/v1/usage/trend} - 最近 N 小時的每小時趨勢</li>
 *   <li>{@code GET /api/v1/usage/trend/range} - 任意區間與分桶寬度的趨勢</li>
 * </ul>
 *
 * <p>時間參數使用 ISO-8601 格式（例如 {@code 2025-01-15T08:00:00Z}），
 * 分桶寬度使用 ISO-8601 duration（例如 {@code PT1H}、{@code PT15M}）。
 * 省略 {@code pool_id} 表示所有配額池合計。
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    private final ConsumptionQueryService queryService;
    private final TrendAggregationService trendService;

    public UsageApiController(ConsumptionQueryService queryService, TrendAggregationService trendService) {
        this.queryService = queryService;
        this.trendService = trendService;
    }

    /**
     * 查詢消耗紀錄。
     *
     * <p>端點：{@code GET /api/v1/usage/consumption?limit=&start_date=&end_date=&pool_id=}
     *
     * @param limit 最大筆數，預設 1000，上限由 {@code pool-ledger.reporting.max-limit} 配置
     * @param startDate 開始時間（含），預設為結束前 24 小時
     * @param endDate 結束時間（不含），預設為現在
     * @param poolId 配額池 ID
     * @return 消耗紀錄列表
     */
    @GetMapping("/consumption")
    public ResponseEntity<List<ConsumptionRecord>> getConsumption(
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "start_date", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(name = "end_date", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(name = "pool_id", required = false) String poolId) {

        log.debug("API request: getConsumption poolId={}, start={}, end={}, limit={}", poolId, startDate, endDate, limit);

        return ResponseEntity.ok(queryService.findRecent(poolId, startDate, endDate, limit));
    }

    /**
     * 最近 N 小時的每小時趨勢。
     *
     * <p>端點：{@code GET /api/v1/usage/trend?pool_id=&hours=24}
     *
     * @param poolId 配額池 ID
     * @param hours 小時數，回傳正好 {@code hours} 個分桶，最後一個包含現在
     * @return 趨勢回應
     */
    @GetMapping("/trend")
    public ResponseEntity<TrendResponse> getHourlyTrend(
            @RequestParam(name = "pool_id", required = false) String poolId,
            @RequestParam(defaultValue = "24") int hours) {

        log.debug("API request: getHourlyTrend poolId={}, hours={}", poolId, hours);

        return ResponseEntity.ok(trendService.hourlyTrend(poolId, hours));
    }

    /**
     * 任意區間的趨勢。
     *
     * <p>端點：{@code GET /api/v1/usage/trend/range?pool_id=&start=&end=&bucket=PT1H}
     *
     * @param poolId 配額池 ID
     * @param start 開始時間（含）
     * @param end 結束時間（不含）
     * @param bucket 分桶寬度，至少 1 秒
     * @return 趨勢回應
     */
    @GetMapping("/trend/range")
    public ResponseEntity<TrendResponse> getRangeTrend(
            @RequestParam(name = "pool_id", required = false) String poolId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "PT1H") Duration bucket) {

        log.debug("API request: getRangeTrend poolId={}, start={}, end={}, bucket={}", poolId, start, end, bucket);

        return ResponseEntity.ok(trendService.trend(poolId, start, end, bucket));
    }
}
