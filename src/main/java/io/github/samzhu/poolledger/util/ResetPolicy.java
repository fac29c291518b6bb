package io.github.samzhu.poolledger.util;

import java.util.Locale;

/**
 * 配額池重置策略。
 *
 * <ul>
 *   <li>{@code NONE} - 永不重置，額度為終身總量</li>
 *   <li>{@code DAILY} / {@code WEEKLY} / {@code MONTHLY} - 依 UTC 日曆邊界重置</li>
 *   <li>{@code ROLLING} - 以滾動視窗計算（過去 N 秒內的消耗）</li>
 * </ul>
 */
public enum ResetPolicy {
    NONE,
    DAILY,
    WEEKLY,
    MONTHLY,
    ROLLING;

    /**
     * 從字串解析策略，不分大小寫。
     *
     * @throws IllegalArgumentException 未知策略
     */
    public static ResetPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Reset policy is required");
        }
        try {
            return ResetPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown reset policy: " + value, e);
        }
    }
}
