package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 預留請求。
 *
 * <p>用於 {@code POST /api/v1/ledger/reservations} 端點。
 */
public record ReserveRequest(
    @JsonProperty("pool_id")
    @NotBlank(message = "pool_id is required")
    String poolId,

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must be positive or zero")
    BigDecimal amount,

    @JsonProperty("source_key_id")
    String sourceKeyId,

    @JsonProperty("model_name")
    String modelName
) {}
