package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.poolledger.document.ConsumptionEvent;

/**
 * 消耗紀錄 API 回應項目。
 *
 * <p>用於 {@code GET /api/v1/usage/consumption} 與結算/直接記錄端點。
 * {@code quota_consumed} 以十進位字串輸出，避免 JSON 數字的精度問題。
 */
public record ConsumptionRecord(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("pool_id") String poolId,
    @JsonProperty("quota_consumed") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal quotaConsumed,
    @JsonProperty("consumed_at") Instant consumedAt,
    @JsonProperty("source_key_id") String sourceKeyId,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("request_count") int requestCount,
    @JsonProperty("reservation_id") String reservationId
) {

    public static ConsumptionRecord from(ConsumptionEvent event) {
        return new ConsumptionRecord(
            event.eventId(),
            event.poolId(),
            event.quotaConsumed(),
            event.consumedAt(),
            event.sourceKeyId(),
            event.modelName(),
            event.requestCountIncrement(),
            event.reservationId()
        );
    }
}
