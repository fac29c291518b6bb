package io.github.samzhu.poolledger.exception;

/**
 * 建立配額池時 poolId 已被使用。
 */
public class PoolAlreadyExistsException extends LedgerException {

    private final String poolId;

    public PoolAlreadyExistsException(String poolId) {
        super(ErrorCode.POOL_EXISTS, String.format("Pool already exists: poolId='%s'", poolId));
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }
}
