package io.github.samzhu.poolledger.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;

/**
 * 消耗事件持久化服務。
 *
 * <p>快取扣款後呼叫 {@link #write(ConsumptionEvent)} 寫入 MongoDB：
 * <ol>
 *   <li>以 {@code durable-write} 重試策略（指數退避）嘗試 {@code insert}</li>
 *   <li>{@link DuplicateKeyException} 代表同一 {@code eventId} 已寫入，視為成功</li>
 *   <li>重試用盡仍失敗時，事件放入記憶體緩衝區，由定時任務與關閉流程重送</li>
 * </ol>
 *
 * <p>快取的扣款不會因寫入失敗而回滾。在事件寫入之前，
 * 對應的 committing 項目讓計數器校正不會高估剩餘額度。
 *
 * <p>實作 {@link SmartLifecycle} 確保：
 * <ul>
 *   <li>關閉時重送所有緩衝事件</li>
 *   <li>關閉順序在 Spring Cloud Stream bindings 之後（phase: MAX_VALUE - 100）</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/core/beans/factory-nature.html#beans-factory-lifecycle-processor">SmartLifecycle</a>
 */
@Service
public class ConsumptionWriter implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionWriter.class);

    private final ConsumptionEventRepository repository;
    private final Retry writeRetry;
    private final List<ConsumptionEvent> retryBuffer = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ConsumptionWriter(ConsumptionEventRepository repository, RetryRegistry retryRegistry) {
        this.repository = repository;
        this.writeRetry = retryRegistry.retry(AppConfig.DURABLE_WRITE, AppConfig.DURABLE_WRITE);
    }

    /**
     * 寫入消耗事件。
     *
     * @param event 消耗事件
     * @return true 表示已持久化（含重複寫入），false 表示已放入重送緩衝區
     */
    public boolean write(ConsumptionEvent event) {
        try {
            insert(event);
            return true;
        } catch (Exception e) {
            log.error("Failed to persist consumption event, buffering for retry: eventId={}, poolId={}, error={}",
                event.eventId(), event.poolId(), e.getMessage(), e);
            if (!isBuffered(event.eventId())) {
                retryBuffer.add(event);
            }
            return false;
        }
    }

    private void insert(ConsumptionEvent event) {
        try {
            writeRetry.executeRunnable(() -> repository.insert(event));
            log.debug("Consumption event persisted: eventId={}, poolId={}, amount={}",
                event.eventId(), event.poolId(), event.quotaConsumed());
        } catch (DuplicateKeyException e) {
            log.debug("Consumption event already persisted: eventId={}", event.eventId());
        }
    }

    /**
     * 重送緩衝區的所有事件。
     *
     * <p>此方法為 synchronized，確保同時只有一個執行緒執行 flush。
     * 仍然失敗的事件會重新加入緩衝區。
     *
     * @return 本次成功寫入的事件數
     */
    public synchronized int flushBuffer() {
        if (retryBuffer.isEmpty()) {
            log.debug("Retry buffer is empty, nothing to flush");
            return 0;
        }

        List<ConsumptionEvent> batch = new ArrayList<>(retryBuffer);
        retryBuffer.removeAll(batch);

        log.info("Flushing {} buffered consumption events", batch.size());
        long startTime = System.currentTimeMillis();

        List<ConsumptionEvent> failed = new ArrayList<>();
        for (ConsumptionEvent event : batch) {
            try {
                insert(event);
            } catch (Exception e) {
                log.error("Retry of consumption event failed: eventId={}, error={}", event.eventId(), e.getMessage());
                failed.add(event);
            }
        }
        if (!failed.isEmpty()) {
            retryBuffer.addAll(0, failed);
        }

        long duration = System.currentTimeMillis() - startTime;
        int written = batch.size() - failed.size();
        log.info("Flush completed: {} written, {} still buffered in {}ms", written, retryBuffer.size(), duration);
        return written;
    }

    /**
     * 定時重送，間隔由 {@code pool-ledger.durable.retry-flush-interval-ms} 配置。
     *
     * <p>只在服務 running 狀態時執行，避免啟動或關閉過程中執行。
     */
    @Scheduled(fixedDelayString = "${pool-ledger.durable.retry-flush-interval-ms:10000}")
    public void scheduledFlush() {
        if (running.get()) {
            if (!retryBuffer.isEmpty()) {
                flushBuffer();
            }
        } else {
            log.debug("Scheduled flush skipped: service not running");
        }
    }

    /**
     * 事件是否仍在重送緩衝區中。
     */
    public boolean isBuffered(String eventId) {
        return retryBuffer.stream().anyMatch(e -> e.eventId().equals(eventId));
    }

    /**
     * 緩衝區中的事件 ID 快照。
     */
    public Set<String> bufferedEventIds() {
        return retryBuffer.stream().map(ConsumptionEvent::eventId).collect(Collectors.toSet());
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        running.set(true);
        log.info("ConsumptionWriter started: retryName={}, maxAttempts={}",
            writeRetry.getName(), writeRetry.getRetryConfig().getMaxAttempts());
    }

    @Override
    public void stop() {
        log.info("ConsumptionWriter stopping, flushing remaining {} events...", retryBuffer.size());
        running.set(false);
        flushBuffer();
        if (!retryBuffer.isEmpty()) {
            log.error("ConsumptionWriter stopped with {} unpersisted events: {}",
                retryBuffer.size(), bufferedEventIds());
        }
        log.info("ConsumptionWriter stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 在 Spring Cloud Stream bindings 之後關閉
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    /**
     * 取得目前緩衝區大小，用於監控。
     *
     * @return 緩衝區中的事件數量
     */
    public int getBufferSize() {
        return retryBuffer.size();
    }
}
