package io.github.samzhu.poolledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import io.github.samzhu.poolledger.config.AppConfig;
import io.github.samzhu.poolledger.config.PoolLedgerProperties;
import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.repository.ConsumptionEventRepository;

class ConsumptionWriterTest {

    private ConsumptionEventRepository repository;
    private ConsumptionWriter writer;

    @BeforeEach
    void setUp() {
        repository = mock(ConsumptionEventRepository.class);
        writer = new ConsumptionWriter(repository, AppConfig.buildRetryRegistry(
            new PoolLedgerProperties.DurableConfig(3, 3, Duration.ofMillis(1), 10_000)));
    }

    @Test
    void shouldRetryTransientFailureThenPersist() {
        // Given: 第一次寫入失敗，第二次成功
        ConsumptionEvent event = event("e-1");
        when(repository.insert(any(ConsumptionEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("timeout"))
            .thenReturn(event);

        // When
        boolean persisted = writer.write(event);

        // Then
        assertThat(persisted).isTrue();
        assertThat(writer.getBufferSize()).isZero();
        verify(repository, times(2)).insert(event);
    }

    @Test
    void shouldTreatDuplicateKeyAsAlreadyPersisted() {
        // Given
        ConsumptionEvent event = event("e-1");
        when(repository.insert(any(ConsumptionEvent.class))).thenThrow(new DuplicateKeyException("E11000"));

        // When
        boolean persisted = writer.write(event);

        // Then: 不重試、不進緩衝區
        assertThat(persisted).isTrue();
        assertThat(writer.getBufferSize()).isZero();
        verify(repository, times(1)).insert(event);
    }

    @Test
    void shouldBufferAfterRetriesExhausted() {
        // Given
        ConsumptionEvent event = event("e-1");
        when(repository.insert(any(ConsumptionEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("down"));

        // When
        boolean persisted = writer.write(event);
        writer.write(event);

        // Then: 同一事件只緩衝一次
        assertThat(persisted).isFalse();
        assertThat(writer.isBuffered("e-1")).isTrue();
        assertThat(writer.bufferedEventIds()).containsExactly("e-1");
        assertThat(writer.getBufferSize()).isEqualTo(1);
    }

    @Test
    void shouldKeepFailedEventsOnFlush() {
        // Given
        ConsumptionEvent ok = event("e-ok");
        ConsumptionEvent bad = event("e-bad");
        when(repository.insert(any(ConsumptionEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("down"));
        writer.write(ok);
        writer.write(bad);

        doReturn(ok).when(repository).insert(ok);

        // When
        int written = writer.flushBuffer();

        // Then
        assertThat(written).isEqualTo(1);
        assertThat(writer.bufferedEventIds()).containsExactly("e-bad");
    }

    @Test
    void shouldFlushOnStopAndSkipScheduledFlushWhenNotRunning() {
        // Given
        ConsumptionEvent event = event("e-1");
        when(repository.insert(any(ConsumptionEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("down"));
        writer.write(event);
        doReturn(event).when(repository).insert(event);

        // When: 尚未啟動時定時重送不執行
        writer.scheduledFlush();

        // Then
        assertThat(writer.getBufferSize()).isEqualTo(1);

        // When
        writer.start();
        writer.stop();

        // Then
        assertThat(writer.isRunning()).isFalse();
        assertThat(writer.getBufferSize()).isZero();
    }

    private static ConsumptionEvent event(String eventId) {
        Instant now = Instant.parse("2024-03-14T10:00:00Z");
        return ConsumptionEvent.create(eventId, "pool", new BigDecimal("1.5"), now, "key", "model", 1, null, now);
    }
}
