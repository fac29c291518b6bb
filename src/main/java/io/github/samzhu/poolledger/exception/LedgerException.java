package io.github.samzhu.poolledger.exception;

/**
 * 配額帳本的業務異常基底類別。
 *
 * <p>每個子類別對應一個 {@link ErrorCode}，API 層依此決定 HTTP 狀態碼，
 * 並在回應中帶出 {@code code} 欄位，讓呼叫端區分「額度不足」與一般錯誤。
 */
public abstract class LedgerException extends RuntimeException {

    /**
     * 業務錯誤代碼。
     */
    public enum ErrorCode {
        POOL_UNKNOWN,
        POOL_EXISTS,
        QUOTA_EXHAUSTED,
        RESERVATION_NOT_FOUND,
        ALREADY_RESOLVED,
        STORE_UNAVAILABLE
    }

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
