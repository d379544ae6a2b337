package io.github.samzhu.reach.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>告警事件以 <b>Binary Mode</b> 發送：CloudEvent attributes 放在
 * {@code ce-*} headers，data 放在 message body。
 * {@link io.github.samzhu.reach.event.AlertEventPublisher} 使用此轉換器將
 * {@link io.cloudevents.CloudEvent} 轉為 Spring {@code Message}。
 *
 * <p>需要 {@code cloudevents-json-jackson} 依賴，
 * 該依賴透過 Java ServiceLoader 機制提供 JSON 序列化支援。
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
