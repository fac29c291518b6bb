package io.github.samzhu.poolledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>Repository 自動掃描：自動註冊 {@code io.github.samzhu.poolledger.repository} 下的介面，
 * 包含 {@code ConsumptionEventRepositoryCustomImpl} 自訂片段。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code quota_pools} - 配額池定義，每池一筆</li>
 *   <li>{@code consumption_events} - 消耗事件，只增不改，索引 {@code (poolId, consumedAt)}</li>
 * </ul>
 *
 * <p>索引由 {@code spring.data.mongodb.auto-index-creation=true} 在啟動時建立。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.poolledger.repository")
public class MongoConfig {
}
