package io.github.samzhu.poolledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pool Ledger Service - 共享配額池的額度帳本與准入控制服務。
 *
 * <p>多個代理外掛 (Antigravity plugin) 共用同一組上游 API 額度，此服務負責：
 * <ul>
 *   <li>每次代理請求前檢查並原子預留額度 (reserve)</li>
 *   <li>上游呼叫完成後以實際成本結算 (commit) 或退還 (release)</li>
 *   <li>將消耗事件持久化為不可變紀錄</li>
 *   <li>回收逾時未結算的預留、定期以持久化資料校正快取計數器</li>
 *   <li>提供時間分桶的用量趨勢查詢</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Plugin → reserve → (Redis 計數器, Lua 原子腳本)
 *            ↓ 上游呼叫
 * Plugin → commit  → Redis 調整差額 → MongoDB consumption_events
 *                                          ↓
 *                                  趨勢聚合 / 報表 API
 * </pre>
 */
@SpringBootApplication
@EnableScheduling
public class PoolLedgerApplication {

    private static final Logger log = LoggerFactory.getLogger(PoolLedgerApplication.class);

    public static void main(String[] args) {
        log.info("Starting Pool Ledger Service - shared quota admission control");
        SpringApplication.run(PoolLedgerApplication.class, args);
    }
}
