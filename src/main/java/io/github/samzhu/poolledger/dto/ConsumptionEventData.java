package io.github.samzhu.poolledger.dto;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 外部計量的消耗事件資料（CloudEvents data payload，亦用於 REST 直接記錄）。
 *
 * <p>由不經過預留流程的上游（例如批次作業、其他閘道）發送，
 * Ledger 直接扣除額度並寫入消耗事件。
 *
 * <p>欄位說明：
 * <ul>
 *   <li>{@code eventId} - 事件唯一識別碼，重送時必須相同；CloudEvent 未帶時使用 CloudEvent id</li>
 *   <li>{@code poolId} - 扣款的配額池</li>
 *   <li>{@code quotaConsumed} - 消耗額度，≥ 0</li>
 *   <li>{@code consumedAt} - 消耗時間，未提供時使用接收時間</li>
 *   <li>{@code sourceKeyId} / {@code modelName} - 上游憑證與模型</li>
 *   <li>{@code requestCount} - 請求數增量，未提供（≤ 0）時為 1</li>
 * </ul>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
public record ConsumptionEventData(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("pool_id") String poolId,
    @JsonProperty("quota_consumed") BigDecimal quotaConsumed,
    @JsonProperty("consumed_at") Instant consumedAt,
    @JsonProperty("source_key_id") String sourceKeyId,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("request_count") int requestCount
) {

    /**
     * 補上事件 ID（若尚未設定）。
     */
    public ConsumptionEventData withDefaultEventId(String fallbackEventId) {
        if (eventId != null && !eventId.isBlank()) {
            return this;
        }
        return new ConsumptionEventData(fallbackEventId, poolId, quotaConsumed, consumedAt,
            sourceKeyId, modelName, requestCount);
    }

    public int effectiveRequestCount() {
        return requestCount > 0 ? requestCount : 1;
    }
}
