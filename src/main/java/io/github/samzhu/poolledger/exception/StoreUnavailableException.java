package io.github.samzhu.poolledger.exception;

/**
 * 快取或資料庫暫時無法使用。
 */
public class StoreUnavailableException extends LedgerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
