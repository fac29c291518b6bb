package io.github.samzhu.poolledger.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.poolledger.controller.PoolAdminApiController;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.document.QuotaPool;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.dto.api.CommitRequest;
import io.github.samzhu.poolledger.dto.api.ConsumptionRecord;
import io.github.samzhu.poolledger.dto.api.PoolRequest;
import io.github.samzhu.poolledger.dto.api.PoolStatusResponse;
import io.github.samzhu.poolledger.dto.api.ReservationResponse;
import io.github.samzhu.poolledger.dto.api.ReserveRequest;
import io.github.samzhu.poolledger.dto.api.TrendPoint;
import io.github.samzhu.poolledger.dto.api.TrendResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>GraalVM Native Image 在編譯時期進行靜態分析，無法自動偵測
 * 執行時期的反射呼叫。此配置註冊需要反射存取的類別，確保
 * Native Image 編譯時包含必要的 metadata。
 *
 * <p>需要註冊的類別：
 * <ul>
 *   <li>{@link ConsumptionEventData} - CloudEvents data payload，Jackson 反序列化</li>
 *   <li>{@link QuotaPool}、{@link ConsumptionEvent} - MongoDB 文件映射</li>
 *   <li>API 請求/回應 record - Jackson 序列化</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 * @see <a href="https://www.graalvm.org/latest/reference-manual/native-image/metadata/">GraalVM Reachability Metadata</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.PoolLedgerRuntimeHints.class)
public class NativeHintsConfig {

    /**
     * RuntimeHintsRegistrar 實作，註冊 Pool Ledger 服務所需的反射提示。
     */
    static class PoolLedgerRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 事件與文件
            hints.reflection()
                .registerType(ConsumptionEventData.class, MemberCategory.values())
                .registerType(QuotaPool.class, MemberCategory.values())
                .registerType(ConsumptionEvent.class, MemberCategory.values());

            // API DTO
            hints.reflection()
                .registerType(ReserveRequest.class, MemberCategory.values())
                .registerType(CommitRequest.class, MemberCategory.values())
                .registerType(ReservationResponse.class, MemberCategory.values())
                .registerType(ConsumptionRecord.class, MemberCategory.values())
                .registerType(PoolRequest.class, MemberCategory.values())
                .registerType(PoolStatusResponse.class, MemberCategory.values())
                .registerType(PoolStatusResponse.Window.class, MemberCategory.values())
                .registerType(TrendPoint.class, MemberCategory.values())
                .registerType(TrendResponse.class, MemberCategory.values())
                // PoolAdminApiController 內部記錄
                .registerType(PoolAdminApiController.ReconcileResult.class, MemberCategory.values())
                .registerType(PoolAdminApiController.SweepResult.class, MemberCategory.values())
                .registerType(PoolAdminApiController.FlushResult.class, MemberCategory.values());
        }
    }
}
