package io.github.samzhu.poolledger.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.poolledger.document.ConsumptionEvent;
import io.github.samzhu.poolledger.dto.ConsumptionEventData;
import io.github.samzhu.poolledger.exception.PoolUnknownException;
import io.github.samzhu.poolledger.service.LedgerEngine;

/**
 * CloudEvents 消費者函式配置。
 *
 * <p>接收不經預留流程的外部計量消耗事件（例如批次作業、其他閘道），
 * 透過 {@link LedgerEngine#recordConsumption(ConsumptionEventData)} 直接扣款並寫入資料庫。
 *
 * <p>Publisher 以 <b>Structured Mode</b> ({@code application/cloudevents+json})
 * 發送事件，Spring Cloud Stream 自動解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（自動轉換為 {@link ConsumptionEventData}）</li>
 * </ul>
 *
 * <p>data 未帶 {@code event_id} 時使用 CloudEvent {@code id}，重送的同一 CloudEvent 不會重複扣款。
 *
 * <p>Binding name: {@code consumptionEventConsumer-in-0}
 *
 * @see <a href="https://spring.io/blog/2020/12/23/cloud-events-and-spring-part-2/">Cloud Events and Spring - part 2</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class ConsumptionEventFunction {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionEventFunction.class);

    private final LedgerEngine ledgerEngine;

    public ConsumptionEventFunction(LedgerEngine ledgerEngine) {
        this.ledgerEngine = ledgerEngine;
    }

    /**
     * CloudEvents 消耗事件消費者 Bean。
     *
     * <p>錯誤處理：
     * <ul>
     *   <li>未知配額池、欄位無效：重送也不會成功，記錄後丟棄</li>
     *   <li>資料庫或快取錯誤：重新拋出，由 binder 重試並重新投遞；以 eventId 冪等，不會重複扣款</li>
     * </ul>
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<ConsumptionEventData>> consumptionEventConsumer() {
        return message -> {
            String cloudEventId = CloudEventMessageUtils.getId(message);
            try {
                ConsumptionEventData data = message.getPayload().withDefaultEventId(cloudEventId);

                log.debug("CloudEvent received: id={}, type={}, source={}, poolId={}",
                    cloudEventId,
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    data.poolId());

                ConsumptionEvent event = ledgerEngine.recordConsumption(data);

                log.debug("Consumption event consumed: eventId={}, poolId={}, amount={}",
                    event.eventId(), event.poolId(), event.quotaConsumed());
            } catch (PoolUnknownException | IllegalArgumentException e) {
                log.error("Discarding invalid CloudEvent: id={}, error={}", cloudEventId, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Failed to process CloudEvent, will be redelivered: id={}, error={}",
                    cloudEventId, e.getMessage());
                throw e;
            }
        };
    }
}
