package io.github.samzhu.poolledger.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.github.samzhu.poolledger.dto.api.TrendPoint;

/**
 * 固定寬度時間分桶累加器。
 *
 * <p>分桶邊界對齊 Unix epoch（UTC），與查詢起點無關：
 * <pre>
 * index = floor((t − EPOCH) / width)
 * </pre>
 * 因此每小時分桶永遠從整點開始，重疊的查詢區間會得到完全相同的分桶邊界。
 *
 * <p>涵蓋範圍是 {@code [start, end)}：從包含 {@code start} 的分桶，
 * 到包含 {@code end} 前最後一刻的分桶，沒有事件的分桶也會輸出零值。
 *
 * <p>非執行緒安全，每次查詢建立新實例。
 */
public final class TrendBuckets {

    private final Instant start;
    private final Instant end;
    private final long widthMillis;
    private final long firstIndex;
    private final BigDecimal[] sums;
    private final long[] calls;
    private final long[] requests;

    private TrendBuckets(Instant start, Instant end, long widthMillis, long firstIndex, int size) {
        this.start = start;
        this.end = end;
        this.widthMillis = widthMillis;
        this.firstIndex = firstIndex;
        this.sums = new BigDecimal[size];
        this.calls = new long[size];
        this.requests = new long[size];
        Arrays.fill(sums, QuotaUnits.toAmount(0));
    }

    /**
     * 建立涵蓋 {@code [start, end)} 的分桶。
     *
     * @param start 查詢開始（含）
     * @param end 查詢結束（不含）
     * @param width 分桶寬度，至少 1 秒
     * @param maxBuckets 分桶數上限
     * @throws IllegalArgumentException 參數無效或分桶數超過上限
     */
    public static TrendBuckets covering(Instant start, Instant end, Duration width, int maxBuckets) {
        if (start == null || end == null || width == null) {
            throw new IllegalArgumentException("start, end and bucket width are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start: start=" + start + ", end=" + end);
        }
        if (width.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("Bucket width must be at least 1 second: " + width);
        }
        long widthMillis = width.toMillis();
        long first = bucketIndex(start, widthMillis);
        long last = Math.floorDiv(end.toEpochMilli() - 1, widthMillis);
        long count = last - first + 1;
        if (count > maxBuckets) {
            throw new IllegalArgumentException(
                "Too many buckets: " + count + " (max " + maxBuckets + "), use a wider bucket or a shorter range");
        }
        return new TrendBuckets(start, end, widthMillis, first, (int) count);
    }

    /**
     * 計算時間點所屬的分桶開始時間。
     */
    public static Instant bucketStart(Instant time, Duration width) {
        long widthMillis = width.toMillis();
        return Instant.ofEpochMilli(bucketIndex(time, widthMillis) * widthMillis);
    }

    private static long bucketIndex(Instant time, long widthMillis) {
        return Math.floorDiv(time.toEpochMilli(), widthMillis);
    }

    /**
     * 將一筆消耗事件累加到所屬分桶。
     *
     * @return false 表示事件時間不在 {@code [start, end)} 內，已忽略
     */
    public boolean add(Instant consumedAt, BigDecimal quotaConsumed, int requestCount) {
        if (consumedAt == null || consumedAt.isBefore(start) || !consumedAt.isBefore(end)) {
            return false;
        }
        int slot = (int) (bucketIndex(consumedAt, widthMillis) - firstIndex);
        if (quotaConsumed != null) {
            sums[slot] = sums[slot].add(quotaConsumed);
        }
        calls[slot]++;
        requests[slot] += requestCount;
        return true;
    }

    /**
     * 依分桶開始時間遞增輸出所有分桶。
     */
    public List<TrendPoint> points() {
        List<TrendPoint> points = new ArrayList<>(sums.length);
        for (int i = 0; i < sums.length; i++) {
            Instant bucketStart = Instant.ofEpochMilli((firstIndex + i) * widthMillis);
            points.add(new TrendPoint(bucketStart, sums[i], calls[i], requests[i]));
        }
        return points;
    }

    public int size() {
        return sums.length;
    }
}
