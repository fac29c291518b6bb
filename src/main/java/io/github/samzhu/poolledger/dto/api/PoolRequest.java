package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 配額池建立/更新請求。
 *
 * <p>用於 {@code POST /api/v1/admin/pools} 與 {@code PUT /api/v1/admin/pools/{poolId}}。
 * 更新時 {@code poolId} 以路徑參數為準。
 *
 * <p>{@code resetPolicy} 與 {@code rollingWindow} 未提供時使用
 * {@code pool-ledger.pool-defaults} 的設定。
 */
public record PoolRequest(
    @JsonProperty("pool_id")
    @Pattern(regexp = "[A-Za-z0-9._-]{1,64}", message = "pool_id must be 1-64 characters of [A-Za-z0-9._-]")
    String poolId,

    @JsonProperty("display_name")
    String displayName,

    @JsonProperty("total_quota")
    @NotNull(message = "total_quota is required")
    @PositiveOrZero(message = "total_quota must be positive or zero")
    BigDecimal totalQuota,

    @JsonProperty("reset_policy")
    String resetPolicy,

    @JsonProperty("rolling_window")
    Duration rollingWindow
) {}
