package io.github.samzhu.poolledger.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 趨勢圖的單一分桶資料點。
 *
 * @param bucketStart 分桶開始時間（UTC，對齊 epoch）
 * @param quotaConsumed 分桶內消耗總額，以十進位字串輸出
 * @param callCount 分桶內事件筆數
 * @param requestCount 分桶內請求數總和
 */
public record TrendPoint(
    @JsonProperty("bucket_start") Instant bucketStart,
    @JsonProperty("quota_consumed") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal quotaConsumed,
    @JsonProperty("call_count") long callCount,
    @JsonProperty("request_count") long requestCount
) {}
