package com.ble.positioning.publisher;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.dto.AlertMessage;
import com.ble.positioning.dto.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes outbound messages to Kafka as JSON strings.
 *
 * <p>Positions go to the positions topic, alerts to the alerts topic; the message routing key is
 * the record key, so all positions of one beacon land on the same partition in order.</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "positioning.outbound.kafka.enabled", havingValue = "true")
public class KafkaOutboundMessageSink implements OutboundMessageSink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String positionsTopic;
    private final String alertsTopic;

    public KafkaOutboundMessageSink(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
            PositioningProperties properties) {
        if (kafkaTemplate == null) {
            throw new IllegalArgumentException("KafkaTemplate cannot be null");
        }
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.positionsTopic = properties.getOutbound().getKafka().getPositionsTopic();
        this.alertsTopic = properties.getOutbound().getKafka().getAlertsTopic();
        log.info("Kafka outbound sink initialized - positions: {}, alerts: {}", positionsTopic, alertsTopic);
    }

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        String topic = message instanceof AlertMessage ? alertsTopic : positionsTopic;
        return kafkaTemplate.send(topic, message.routingKey(), payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish {} to topic {}: {}", message.type(), topic, ex.getMessage());
                    } else {
                        log.debug("Published {} to {}-{}@{}", message.type(), topic,
                                result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                    }
                })
                .thenApply(result -> null);
    }
}
