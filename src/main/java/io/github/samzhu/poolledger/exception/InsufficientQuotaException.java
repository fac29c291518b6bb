package io.github.samzhu.poolledger.exception;

import java.math.BigDecimal;

/**
 * 預留被拒絕。
 *
 * <p>兩種情況都以此異常回報，呼叫端一律視為「不可放行」：
 * <ul>
 *   <li>{@link Reason#INSUFFICIENT} - 剩餘額度小於預估額度</li>
 *   <li>{@link Reason#STORE_UNAVAILABLE} - 快取或資料庫無法使用，無法確認額度（fail closed）</li>
 * </ul>
 */
public class InsufficientQuotaException extends LedgerException {

    public enum Reason {
        INSUFFICIENT,
        STORE_UNAVAILABLE
    }

    private final String poolId;
    private final BigDecimal requested;
    private final BigDecimal remaining;
    private final Reason reason;

    public InsufficientQuotaException(String poolId, BigDecimal requested, BigDecimal remaining) {
        super(ErrorCode.QUOTA_EXHAUSTED, String.format("Insufficient quota: poolId='%s', requested=%s, remaining=%s",
            poolId, requested.toPlainString(), remaining.toPlainString()));
        this.poolId = poolId;
        this.requested = requested;
        this.remaining = remaining;
        this.reason = Reason.INSUFFICIENT;
    }

    private InsufficientQuotaException(String poolId, BigDecimal requested, Throwable cause) {
        super(ErrorCode.QUOTA_EXHAUSTED, String.format(
            "Quota cannot be verified, store unavailable: poolId='%s', requested=%s",
            poolId, requested.toPlainString()), cause);
        this.poolId = poolId;
        this.requested = requested;
        this.remaining = null;
        this.reason = Reason.STORE_UNAVAILABLE;
    }

    /**
     * 儲存層故障時的拒絕。
     */
    public static InsufficientQuotaException storeUnavailable(String poolId, BigDecimal requested, Throwable cause) {
        return new InsufficientQuotaException(poolId, requested, cause);
    }

    public String getPoolId() {
        return poolId;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    /**
     * @return 剩餘額度，{@link Reason#STORE_UNAVAILABLE} 時為 null
     */
    public BigDecimal getRemaining() {
        return remaining;
    }

    public Reason getReason() {
        return reason;
    }
}
