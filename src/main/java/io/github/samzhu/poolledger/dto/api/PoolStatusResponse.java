package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 配額池狀態 API 回應。
 *
 * <p>用於 {@code GET /api/v1/pools/{poolId}} 與管理端點。
 *
 * <p>剩餘額度有兩個來源：
 * <ul>
 *   <li>{@code cached_remaining} - 快取計數器目前的值，計數器不存在時為 null</li>
 *   <li>{@code computed_remaining} - {@code total − consumed − pending − committing}，從資料庫與預留表計算</li>
 * </ul>
 * 兩者在沒有進行中的操作時應相等。
 */
public record PoolStatusResponse(
    @JsonProperty("pool_id") String poolId,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("total_quota") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalQuota,
    @JsonProperty("reset_policy") String resetPolicy,
    @JsonProperty("rolling_window_seconds") long rollingWindowSeconds,
    Window window,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal consumed,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal pending,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal committing,
    @JsonProperty("cached_remaining") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal cachedRemaining,
    @JsonProperty("computed_remaining") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal computedRemaining,
    @JsonProperty("reset_at") Instant resetAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    /**
     * 目前配額視窗，{@code end} 為 null 表示沒有固定結束邊界。
     */
    public record Window(Instant start, Instant end) {}
}
