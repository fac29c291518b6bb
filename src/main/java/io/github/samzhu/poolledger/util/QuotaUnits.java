package io.github.samzhu.poolledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 配額數值換算工具。
 *
 * <p>配額可為小數，所有金額統一正規化為 {@value #SCALE} 位小數（無條件進位），
 * 快取計數器以整數「微單位」（{@code amount × 10^6}）儲存，
 * 避免浮點誤差在大量小額消耗中累積。
 */
public final class QuotaUnits {

    /** 小數位數 */
    public static final int SCALE = 6;

    private QuotaUnits() {
        // 工具類不允許實例化
    }

    /**
     * 正規化配額金額。
     *
     * @param amount 原始金額，必須 ≥ 0
     * @return {@value #SCALE} 位小數的金額
     * @throws IllegalArgumentException 金額為 null 或負數
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Quota amount is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Quota amount must not be negative: " + amount.toPlainString());
        }
        return amount.setScale(SCALE, RoundingMode.UP);
    }

    /**
     * 金額轉為微單位。
     *
     * @param amount 原始金額，必須 ≥ 0
     * @return 微單位整數
     * @throws IllegalArgumentException 金額無效或超出 long 範圍
     */
    public static long toUnits(BigDecimal amount) {
        BigDecimal normalized = normalize(amount);
        try {
            return normalized.unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Quota amount out of range: " + amount.toPlainString(), e);
        }
    }

    /**
     * 微單位轉回金額，可為負數（例如超額結算後的剩餘額度）。
     *
     * @param units 微單位
     * @return {@value #SCALE} 位小數的金額
     */
    public static BigDecimal toAmount(long units) {
        return BigDecimal.valueOf(units, SCALE);
    }

    /**
     * 以字串輸出金額，不使用科學記號。
     */
    public static String format(BigDecimal amount) {
        return Objects.requireNonNull(amount).toPlainString();
    }
}
