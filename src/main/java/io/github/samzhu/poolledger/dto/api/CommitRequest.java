package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 結算請求。
 *
 * <p>用於 {@code POST /api/v1/ledger/reservations/{id}/commit} 端點。
 */
public record CommitRequest(
    @JsonProperty("actual_amount")
    @NotNull(message = "actual_amount is required")
    @PositiveOrZero(message = "actual_amount must be positive or zero")
    BigDecimal actualAmount
) {}
