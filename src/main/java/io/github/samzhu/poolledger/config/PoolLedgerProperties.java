package io.github.samzhu.poolledger.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pool Ledger 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link CacheConfig} - 快取計數器後端與存活時間</li>
 *   <li>{@link ReservationConfig} - 預留逾時、清掃頻率與保留時間</li>
 *   <li>{@link ReconciliationConfig} - 計數器校正排程與崩潰復原寬限期</li>
 *   <li>{@link DurableConfig} - MongoDB 讀寫重試設定</li>
 *   <li>{@link PoolDefaults} - 新建配額池的預設重置策略</li>
 *   <li>{@link ReportingConfig} - 報表查詢上限</li>
 *   <li>{@link AdminConfig} - 管理 API 金鑰</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * pool-ledger:
 *   cache:
 *     backend: redis
 *     key-prefix: "pool-ledger:"
 *     counter-ttl: PT1H
 *   reservation:
 *     timeout: PT30S
 *     sweep-interval-ms: 5000
 *   reconciliation:
 *     cron: "0 *&#47;5 * * * *"
 *   pool-defaults:
 *     reset-policy: MONTHLY
 * </pre>
 *
 * <p>任何巢狀區塊未設定時，使用各自的 {@code defaults()}。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "pool-ledger")
public record PoolLedgerProperties(
    CacheConfig cache,
    ReservationConfig reservation,
    ReconciliationConfig reconciliation,
    DurableConfig durable,
    PoolDefaults poolDefaults,
    ReportingConfig reporting,
    AdminConfig admin
) {
    public PoolLedgerProperties {
        if (cache == null) {
            cache = CacheConfig.defaults();
        }
        if (reservation == null) {
            reservation = ReservationConfig.defaults();
        }
        if (reconciliation == null) {
            reconciliation = ReconciliationConfig.defaults();
        }
        if (durable == null) {
            durable = DurableConfig.defaults();
        }
        if (poolDefaults == null) {
            poolDefaults = PoolDefaults.defaults();
        }
        if (reporting == null) {
            reporting = ReportingConfig.defaults();
        }
        if (admin == null) {
            admin = AdminConfig.defaults();
        }
    }

    /**
     * 全部使用預設值的配置，供測試與本地開發使用。
     */
    public static PoolLedgerProperties defaults() {
        return new PoolLedgerProperties(null, null, null, null, null, null, null);
    }

    /**
     * 快取計數器設定。
     *
     * @param backend 計數器後端：{@code redis}（多實例共享）或 {@code memory}（單節點）
     * @param keyPrefix Redis key 前綴
     * @param counterTtl 計數器最長存活時間，到期後下一次預留會從 MongoDB 重建
     */
    public record CacheConfig(
        String backend,
        String keyPrefix,
        Duration counterTtl
    ) {
        public CacheConfig {
            if (backend == null || backend.isBlank()) {
                backend = "redis";
            }
            if (keyPrefix == null) {
                keyPrefix = "pool-ledger:";
            }
            if (counterTtl == null || counterTtl.isZero() || counterTtl.isNegative()) {
                counterTtl = Duration.ofHours(1);
            }
        }

        public static CacheConfig defaults() {
            return new CacheConfig("redis", "pool-ledger:", Duration.ofHours(1));
        }
    }

    /**
     * 預留設定。
     *
     * @param timeout PENDING 預留的最長存活時間，逾時由清掃器釋放
     * @param sweepIntervalMs 清掃器執行間隔（毫秒）
     * @param sweepBatchSize 單次清掃最多處理的預留數
     * @param retention 已結算預留紀錄的保留時間，用於重複呼叫判定與崩潰復原
     */
    public record ReservationConfig(
        Duration timeout,
        long sweepIntervalMs,
        int sweepBatchSize,
        Duration retention
    ) {
        public ReservationConfig {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(30);
            }
            if (sweepIntervalMs <= 0) {
                sweepIntervalMs = 5000;
            }
            if (sweepBatchSize <= 0) {
                sweepBatchSize = 500;
            }
            if (retention == null || retention.compareTo(timeout) < 0) {
                retention = Duration.ofHours(24);
            }
        }

        public static ReservationConfig defaults() {
            return new ReservationConfig(Duration.ofSeconds(30), 5000, 500, Duration.ofHours(24));
        }
    }

    /**
     * 計數器校正設定。
     *
     * @param cron 全池校正排程，預設每 5 分鐘
     * @param recoveryGrace 快取已結算但尚未持久化的紀錄，超過此時間即從預留紀錄補寫
     */
    public record ReconciliationConfig(
        String cron,
        Duration recoveryGrace
    ) {
        public ReconciliationConfig {
            if (cron == null || cron.isBlank()) {
                cron = "0 */5 * * * *";
            }
            if (recoveryGrace == null || recoveryGrace.isNegative()) {
                recoveryGrace = Duration.ofMinutes(2);
            }
        }

        public static ReconciliationConfig defaults() {
            return new ReconciliationConfig("0 */5 * * * *", Duration.ofMinutes(2));
        }
    }

    /**
     * MongoDB 讀寫重試設定。
     *
     * <p>重試採指數退避：{@code backoff}, {@code backoff × 2}, ...
     *
     * @param writeMaxAttempts 寫入最多嘗試次數（含第一次）
     * @param readMaxAttempts 讀取最多嘗試次數（含第一次）
     * @param backoff 第一次重試前的等待時間
     * @param retryFlushIntervalMs 寫入失敗緩衝區的定時重送間隔（毫秒）
     */
    public record DurableConfig(
        int writeMaxAttempts,
        int readMaxAttempts,
        Duration backoff,
        long retryFlushIntervalMs
    ) {
        public DurableConfig {
            if (writeMaxAttempts <= 0) {
                writeMaxAttempts = 3;
            }
            if (readMaxAttempts <= 0) {
                readMaxAttempts = 3;
            }
            if (backoff == null || backoff.isZero() || backoff.isNegative()) {
                backoff = Duration.ofMillis(200);
            }
            if (retryFlushIntervalMs <= 0) {
                retryFlushIntervalMs = 10_000;
            }
        }

        public static DurableConfig defaults() {
            return new DurableConfig(3, 3, Duration.ofMillis(200), 10_000);
        }
    }

    /**
     * 新建配額池的預設值。
     *
     * @param resetPolicy 預設重置策略：NONE、DAILY、WEEKLY、MONTHLY、ROLLING
     * @param rollingWindow ROLLING 策略的預設視窗長度
     */
    public record PoolDefaults(
        String resetPolicy,
        Duration rollingWindow
    ) {
        public PoolDefaults {
            if (resetPolicy == null || resetPolicy.isBlank()) {
                resetPolicy = "MONTHLY";
            }
            if (rollingWindow == null || rollingWindow.isZero() || rollingWindow.isNegative()) {
                rollingWindow = Duration.ofHours(24);
            }
        }

        public static PoolDefaults defaults() {
            return new PoolDefaults("MONTHLY", Duration.ofHours(24));
        }
    }

    /**
     * 報表查詢上限。
     *
     * @param defaultLimit 消耗紀錄查詢預設筆數
     * @param maxLimit 消耗紀錄查詢最大筆數
     * @param maxBuckets 趨勢查詢最多分桶數
     */
    public record ReportingConfig(
        int defaultLimit,
        int maxLimit,
        int maxBuckets
    ) {
        public ReportingConfig {
            if (defaultLimit <= 0) {
                defaultLimit = 1000;
            }
            if (maxLimit < defaultLimit) {
                maxLimit = Math.max(defaultLimit, 5000);
            }
            if (maxBuckets <= 0) {
                maxBuckets = 2000;
            }
        }

        public static ReportingConfig defaults() {
            return new ReportingConfig(1000, 5000, 2000);
        }
    }

    /**
     * 管理 API 設定。
     *
     * @param apiKey 預先共享的管理金鑰，空值代表停用所有管理端點
     */
    public record AdminConfig(String apiKey) {

        public static AdminConfig defaults() {
            return new AdminConfig(null);
        }

        public boolean enabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
