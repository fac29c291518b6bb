package io.github.samzhu.poolledger.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link PoolLedgerProperties} 的型別安全配置綁定，並提供：
 * <ul>
 *   <li>{@link Clock} - 所有時間計算的來源（UTC），測試時可替換</li>
 *   <li>{@link RetryRegistry} - MongoDB 讀寫重試策略（Resilience4j）</li>
 * </ul>
 *
 * @see PoolLedgerProperties
 * @see <a href="https://resilience4j.readme.io/docs/retry">Resilience4j Retry</a>
 */
@Configuration
@EnableConfigurationProperties(PoolLedgerProperties.class)
public class AppConfig {

    /** 持久化寫入重試名稱 */
    public static final String DURABLE_WRITE = "durable-write";

    /** 持久化讀取重試名稱 */
    public static final String DURABLE_READ = "durable-read";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryRegistry durableRetryRegistry(PoolLedgerProperties properties) {
        return buildRetryRegistry(properties.durable());
    }

    /**
     * 建立持久化讀寫的重試註冊表。
     *
     * <p>只重試 {@link DataAccessException}（連線中斷、逾時等），
     * {@link DuplicateKeyException} 代表事件已寫入，不重試。
     *
     * @param durable 重試設定
     * @return 含 {@link #DURABLE_WRITE} 與 {@link #DURABLE_READ} 兩組配置的註冊表
     */
    public static RetryRegistry buildRetryRegistry(PoolLedgerProperties.DurableConfig durable) {
        return RetryRegistry.of(Map.of(
            DURABLE_WRITE, retryConfig(durable.writeMaxAttempts(), durable.backoff()),
            DURABLE_READ, retryConfig(durable.readMaxAttempts(), durable.backoff())
        ));
    }

    private static RetryConfig retryConfig(int maxAttempts, Duration backoff) {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
            .retryOnException(e -> e instanceof DataAccessException && !(e instanceof DuplicateKeyException))
            .build();
    }
}
