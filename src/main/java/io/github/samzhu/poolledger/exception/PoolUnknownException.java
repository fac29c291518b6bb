package io.github.samzhu.poolledger.exception;

/**
 * 配額池不存在。
 */
public class PoolUnknownException extends LedgerException {

    private final String poolId;

    public PoolUnknownException(String poolId) {
        super(ErrorCode.POOL_UNKNOWN, String.format("Unknown pool: poolId='%s'", poolId));
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }
}
