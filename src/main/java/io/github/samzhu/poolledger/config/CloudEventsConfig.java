package io.github.samzhu.poolledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>自行計量的代理外掛以 <b>Structured Mode</b>（{@code application/cloudevents+json}）
 * 發布消耗事件，整個 CloudEvent 封裝在 JSON body 中。
 *
 * <p>註冊 {@link CloudEventMessageConverter} 後，Spring Cloud Stream 會將：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（反序列化為
 *       {@link io.github.samzhu.poolledger.dto.ConsumptionEventData}）</li>
 * </ul>
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    /**
     * 註冊 CloudEvents 訊息轉換器。
     *
     * <p>需要 {@code cloudevents-json-jackson} 依賴，
     * 該依賴透過 Java ServiceLoader 機制提供 JSON 序列化支援。
     *
     * @return CloudEventMessageConverter 實例
     */
    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
