package io.github.samzhu.poolledger.document;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import io.github.samzhu.poolledger.util.QuotaUnits;
import io.github.samzhu.poolledger.util.QuotaWindows;
import io.github.samzhu.poolledger.util.QuotaWindows.QuotaWindow;
import io.github.samzhu.poolledger.util.ResetPolicy;

/**
 * 配額池定義文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>ID 自動生成：{@code _id} 由 MongoDB 自動產生 ObjectId，業務識別碼為 {@code poolId}</li>
 *   <li>避免自定義類型：重置策略以字串儲存，讀取時再轉為 {@link ResetPolicy}</li>
 *   <li>精確小數：{@code totalQuota} 以 Decimal128 儲存</li>
 *   <li>剩餘額度不存於此：由快取計數器維護，或從消耗事件計算</li>
 * </ul>
 */
@Document(collection = "quota_pools")
public record QuotaPool(
    @Id String id,

    /** 配額池唯一識別碼 */
    @Indexed(unique = true) String poolId,
    /** 顯示名稱 */
    String displayName,
    /** 每個視窗的總額度 */
    @Field(targetType = FieldType.DECIMAL128) BigDecimal totalQuota,
    /** 重置策略名稱，見 {@link ResetPolicy} */
    String resetPolicy,
    /** ROLLING 策略的視窗長度（秒） */
    long rollingWindowSeconds,
    /** 最後一次強制重置時間，之前的消耗不計入當期 */
    Instant resetAt,

    Instant createdAt,
    Instant updatedAt,
    @Version Long version
) {

    /**
     * 建立新的配額池定義。
     */
    public static QuotaPool create(
            String poolId,
            String displayName,
            BigDecimal totalQuota,
            ResetPolicy resetPolicy,
            Duration rollingWindow,
            Instant now) {

        return new QuotaPool(
            null, // ID 自動產生
            poolId,
            displayName,
            QuotaUnits.normalize(totalQuota),
            resetPolicy.name(),
            rollingWindow.toSeconds(),
            null,
            now,
            now,
            null
        );
    }

    /**
     * 更新額度與重置策略。
     */
    public QuotaPool withDefinition(
            String displayName,
            BigDecimal totalQuota,
            ResetPolicy resetPolicy,
            Duration rollingWindow,
            Instant now) {

        return new QuotaPool(id, poolId, displayName, QuotaUnits.normalize(totalQuota),
            resetPolicy.name(), rollingWindow.toSeconds(), resetAt, createdAt, now, version);
    }

    /**
     * 強制重置：以 {@code now} 作為當期開始。
     */
    public QuotaPool withResetAt(Instant now) {
        return new QuotaPool(id, poolId, displayName, totalQuota,
            resetPolicy, rollingWindowSeconds, now, createdAt, now, version);
    }

    public ResetPolicy policy() {
        return ResetPolicy.parse(resetPolicy);
    }

    public Duration rollingWindow() {
        return Duration.ofSeconds(rollingWindowSeconds);
    }

    /**
     * 計算目前的配額視窗。
     */
    public QuotaWindow currentWindow(Instant now) {
        return QuotaWindows.current(policy(), rollingWindow(), resetAt, now);
    }

    public long totalUnits() {
        return QuotaUnits.toUnits(totalQuota);
    }
}
