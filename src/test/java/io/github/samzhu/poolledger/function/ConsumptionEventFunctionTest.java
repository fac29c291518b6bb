package io.github.samzhu.poolledger.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.exception.PoolUnknownException;
import io.github.samzhu.poolledger.exception.StoreUnavailableException;
import io.github.samzhu.poolledger.service.LedgerEngine;

/**
 * 以 Spring Cloud Stream Test Binder 測試 {@link ConsumptionEventFunction}。
 *
 * <p>上游以 Structured Mode（application/cloudevents+json）發送 CloudEvent，
 * Spring Cloud Stream 解析後，CloudEvent 屬性放在訊息標頭，payload 只剩 data 欄位。
 * 此測試直接模擬解析後的訊息格式。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class ConsumptionEventFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static LedgerEngine mockLedgerEngine;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockLedgerEngine = mock(LedgerEngine.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=consumptionEventConsumer",
                "--spring.jmx.enabled=false",
                "--spring.autoconfigure.exclude=com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubAutoConfiguration,com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubReactiveAutoConfiguration,com.google.cloud.spring.autoconfigure.pubsub.stream.GcpPubSubBinderAutoConfiguration,com.google.cloud.spring.autoconfigure.core.GcpContextAutoConfiguration"
            );

        inputDestination = context.getBean(InputDestination.class);
        objectMapper = context.getBean(ObjectMapper.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMock() {
        reset(mockLedgerEngine);
        when(mockLedgerEngine.recordConsumption(any())).thenAnswer(inv -> {
            ConsumptionEventData data = inv.getArgument(0);
            Instant now = Instant.now();
            return ConsumptionEvent.create(data.eventId(), data.poolId(), data.quotaConsumed(),
                data.consumedAt() != null ? data.consumedAt() : now, data.sourceKeyId(), data.modelName(),
                data.effectiveRequestCount(), null, now);
        });
    }

    @Test
    void shouldRecordConsumptionFromCloudEvent() throws Exception {
        // Given: data payload 自帶 event_id
        Instant consumedAt = Instant.parse("2024-03-14T09:30:00Z");
        ConsumptionEventData data = new ConsumptionEventData(
            "batch-42", "team-a", new BigDecimal("12.345678"), consumedAt, "key-1", "model-x", 3);

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(data), UUID.randomUUID().toString()));

        // Then
        ArgumentCaptor<ConsumptionEventData> captor = ArgumentCaptor.forClass(ConsumptionEventData.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockLedgerEngine, atLeastOnce()).recordConsumption(captor.capture());
        });

        ConsumptionEventData captured = captor.getValue();
        assertThat(captured.eventId()).isEqualTo("batch-42");
        assertThat(captured.poolId()).isEqualTo("team-a");
        assertThat(captured.quotaConsumed()).isEqualByComparingTo("12.345678");
        assertThat(captured.consumedAt()).isEqualTo(consumedAt);
        assertThat(captured.sourceKeyId()).isEqualTo("key-1");
        assertThat(captured.modelName()).isEqualTo("model-x");
        assertThat(captured.requestCount()).isEqualTo(3);
    }

    @Test
    void shouldFallBackToCloudEventIdWhenEventIdMissing() throws Exception {
        // Given: data 沒有 event_id
        String cloudEventId = UUID.randomUUID().toString();
        ConsumptionEventData data = new ConsumptionEventData(
            null, "team-b", new BigDecimal("1"), null, null, null, 0);

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(data), cloudEventId));

        // Then
        ArgumentCaptor<ConsumptionEventData> captor = ArgumentCaptor.forClass(ConsumptionEventData.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockLedgerEngine, atLeastOnce()).recordConsumption(captor.capture());
        });

        assertThat(captor.getValue().eventId()).isEqualTo(cloudEventId);
        assertThat(captor.getValue().effectiveRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldKeepConsumingAfterRejectedEvent() throws Exception {
        // Given: 第一筆事件的配額池不存在
        doThrow(new PoolUnknownException("ghost"))
            .when(mockLedgerEngine).recordConsumption(argThat(d -> d != null && "ghost".equals(d.poolId())));
        ConsumptionEventData rejected = new ConsumptionEventData(
            "evt-ghost", "ghost", BigDecimal.ONE, null, null, null, 1);
        ConsumptionEventData accepted = new ConsumptionEventData(
            "evt-ok", "team-a", BigDecimal.ONE, null, null, null, 1);

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(rejected), UUID.randomUUID().toString()));
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(accepted), UUID.randomUUID().toString()));

        // Then: 錯誤不影響後續訊息
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockLedgerEngine, atLeastOnce()).recordConsumption(argThat(d -> "evt-ok".equals(d.eventId())));
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPropagateStoreFailureSoMessageIsNotAcknowledged() {
        // Given
        doThrow(new DataAccessResourceFailureException("mongo down"))
            .when(mockLedgerEngine).recordConsumption(argThat(d -> d != null && "evt-mongo".equals(d.eventId())));
        Consumer<Message<ConsumptionEventData>> consumer =
            context.getBean("consumptionEventConsumer", Consumer.class);
        Message<ConsumptionEventData> message = MessageBuilder
            .withPayload(new ConsumptionEventData("evt-mongo", "team-a", BigDecimal.ONE, null, null, null, 1))
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .build();

        // When & Then
        assertThatThrownBy(() -> consumer.accept(message))
            .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPropagateCacheFailure() {
        // Given
        doThrow(new StoreUnavailableException("redis down", null))
            .when(mockLedgerEngine).recordConsumption(argThat(d -> d != null && "evt-redis".equals(d.eventId())));
        Consumer<Message<ConsumptionEventData>> consumer =
            context.getBean("consumptionEventConsumer", Consumer.class);
        Message<ConsumptionEventData> message = MessageBuilder
            .withPayload(new ConsumptionEventData("evt-redis", "team-a", BigDecimal.ONE, null, null, null, 1))
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .build();

        // When & Then
        assertThatThrownBy(() -> consumer.accept(message))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDiscardEventForUnknownPool() {
        // Given
        doThrow(new PoolUnknownException("ghost"))
            .when(mockLedgerEngine).recordConsumption(argThat(d -> d != null && "evt-ghost-direct".equals(d.eventId())));
        Consumer<Message<ConsumptionEventData>> consumer =
            context.getBean("consumptionEventConsumer", Consumer.class);
        Message<ConsumptionEventData> message = MessageBuilder
            .withPayload(new ConsumptionEventData("evt-ghost-direct", "ghost", BigDecimal.ONE, null, null, null, 1))
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .build();

        // When
        consumer.accept(message);

        // Then: 不會重試
        verify(mockLedgerEngine).recordConsumption(argThat(d -> "evt-ghost-direct".equals(d.eventId())));
    }

    @Test
    void shouldRedeliverEventWhenStoreFails() throws Exception {
        // Given
        doThrow(new DataAccessResourceFailureException("mongo down"))
            .when(mockLedgerEngine).recordConsumption(argThat(d -> d != null && "evt-retry".equals(d.eventId())));
        ConsumptionEventData data = new ConsumptionEventData(
            "evt-retry", "team-a", BigDecimal.ONE, null, null, null, 1);

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(data), UUID.randomUUID().toString()));

        // Then: binder 依 max-attempts 重新投遞
        await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            verify(mockLedgerEngine, atLeast(2)).recordConsumption(argThat(d -> "evt-retry".equals(d.eventId())));
        });
    }

    private static Message<byte[]> cloudEvent(byte[] payload, String cloudEventId) {
        return MessageBuilder.withPayload(payload)
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, cloudEventId)
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("https://batch.example.com/metering"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.poolledger.consumption.v1")
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .build();
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
    }, excludeName = {
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubReactiveAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.stream.GcpPubSubBinderAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.core.GcpContextAutoConfiguration"
    })
    @Import(ConsumptionEventFunction.class)
    static class TestConfig {

        @Bean
        public LedgerEngine ledgerEngine() {
            return mockLedgerEngine;
        }
    }
}
