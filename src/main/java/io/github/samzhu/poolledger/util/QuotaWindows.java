package io.github.samzhu.poolledger.util;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * 配額視窗計算工具。
 *
 * <p>所有日曆邊界均使用 UTC 時區。
 */
public final class QuotaWindows {

    private QuotaWindows() {
        // 工具類不允許實例化
    }

    /**
     * 配額視窗。
     *
     * @param start 視窗開始（含），null 代表不設下限
     * @param end 視窗結束（不含），null 代表沒有固定結束邊界
     */
    public record QuotaWindow(Instant start, Instant end) {

        /**
         * 計數器應存活的時間：到視窗結束為止，且不超過 {@code maxTtl}。
         */
        public Duration counterTtl(Instant now, Duration maxTtl) {
            if (end == null) {
                return maxTtl;
            }
            Duration untilEnd = Duration.between(now, end);
            if (untilEnd.compareTo(Duration.ofMillis(1)) < 0) {
                return Duration.ofMillis(1);
            }
            return untilEnd.compareTo(maxTtl) < 0 ? untilEnd : maxTtl;
        }
    }

    /**
     * 計算目前的配額視窗。
     *
     * <p>若管理員曾強制重置（{@code resetAt}），且重置時間晚於日曆視窗開始，
     * 則以重置時間作為視窗開始，重置前的消耗不計入本期。
     *
     * @param policy 重置策略
     * @param rollingWindow ROLLING 策略的視窗長度
     * @param resetAt 最後一次強制重置時間，可為 null
     * @param now 當前時間
     * @return 目前視窗
     */
    public static QuotaWindow current(ResetPolicy policy, Duration rollingWindow, Instant resetAt, Instant now) {
        Instant start;
        Instant end;
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        switch (policy) {
            case DAILY -> {
                start = startOfDay(today);
                end = startOfDay(today.plusDays(1));
            }
            case WEEKLY -> {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                start = startOfDay(monday);
                end = startOfDay(monday.plusWeeks(1));
            }
            case MONTHLY -> {
                LocalDate first = today.withDayOfMonth(1);
                start = startOfDay(first);
                end = startOfDay(first.plusMonths(1));
            }
            case ROLLING -> {
                start = now.minus(rollingWindow);
                end = null;
            }
            default -> {
                start = null;
                end = null;
            }
        }

        if (resetAt != null && !resetAt.isAfter(now) && (start == null || resetAt.isAfter(start))) {
            start = resetAt;
        }
        return new QuotaWindow(start, end);
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
