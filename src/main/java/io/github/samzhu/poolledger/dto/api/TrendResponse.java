package io.github.samzhu.poolledger.dto.api;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 用量趨勢 API 回應。
 *
 * <p>{@code pool_id} 為 null 表示所有配額池合計。
 */
public record TrendResponse(
    @JsonProperty("pool_id") String poolId,
    Instant start,
    Instant end,
    @JsonProperty("bucket_seconds") long bucketSeconds,
    List<TrendPoint> points
) {}
