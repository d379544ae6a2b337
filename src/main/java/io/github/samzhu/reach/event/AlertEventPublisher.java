package io.github.samzhu.reach.event;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.spring.messaging.CloudEventMessageConverter;
import io.github.samzhu.reach.document.Alert;

/**
 * 將新建立的告警以 CloudEvents 發佈給下游通知服務。
 *
 * <p>透過 {@link StreamBridge} 送到 binding {@code alertEvents-out-0}
 * (本地開發使用 RabbitMQ)，訊息為 <b>Binary Mode</b>：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → {@code ce-*} Message Headers</li>
 *   <li>{@link AlertEvent} JSON → Message Payload</li>
 * </ul>
 *
 * <p>通知內容的格式化 (聊天室訊息、報告文字) 由下游負責。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Component
public class AlertEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AlertEventPublisher.class);

    public static final String BINDING = "alertEvents-out-0";
    public static final String EVENT_TYPE = "io.github.samzhu.reach.alert.v1";
    public static final URI EVENT_SOURCE = URI.create("/reach/anomaly");

    private final StreamBridge streamBridge;
    private final CloudEventMessageConverter messageConverter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AlertEventPublisher(StreamBridge streamBridge, CloudEventMessageConverter messageConverter,
                               ObjectMapper objectMapper, Clock clock) {
        this.streamBridge = streamBridge;
        this.messageConverter = messageConverter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 發佈告警事件。
     *
     * @param alert 已儲存的告警
     * @return true 表示 binder 已接受訊息
     */
    public boolean publish(Alert alert) {
        try {
            CloudEvent event = toCloudEvent(alert);
            Message<?> message = messageConverter.toMessage(event, new MessageHeaders(null));

            boolean sent = streamBridge.send(BINDING, message);
            if (sent) {
                log.debug("Alert event published: id={}, alertId={}, severity={}",
                    event.getId(), alert.id(), alert.severity());
            } else {
                log.warn("Alert event not accepted by binder: alertId={}", alert.id());
            }
            return sent;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert event: alertId={}, error={}", alert.id(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to publish alert event: alertId={}, error={}", alert.id(), e.getMessage(), e);
            return false;
        }
    }

    CloudEvent toCloudEvent(Alert alert) throws JsonProcessingException {
        return CloudEventBuilder.v1()
            .withId(UUID.randomUUID().toString())
            .withType(EVENT_TYPE)
            .withSource(EVENT_SOURCE)
            .withSubject(alert.brand() + "/" + alert.surface() + "/" + alert.metric())
            .withTime(OffsetDateTime.now(clock))
            .withDataContentType(MimeTypeUtils.APPLICATION_JSON_VALUE)
            .withData(objectMapper.writeValueAsBytes(AlertEvent.from(alert)))
            .build();
    }
}
