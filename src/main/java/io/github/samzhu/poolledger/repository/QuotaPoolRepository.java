package io.github.samzhu.poolledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.poolledger.document.QuotaPool;

/**
 * 配額池定義資料存取介面。
 *
 * <p>提供對 {@code quota_pools} 集合的 CRUD 操作。
 * 更新以整份文件 {@code save} 寫回，{@code @Version} 防止併發覆寫。
 *
 * @see io.github.samzhu.poolledger.document.QuotaPool
 */
public interface QuotaPoolRepository extends MongoRepository<QuotaPool, String> {

    Optional<QuotaPool> findByPoolId(String poolId);

    boolean existsByPoolId(String poolId);

    List<QuotaPool> findAllByOrderByPoolIdAsc();
}
