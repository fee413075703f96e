package com.ble.positioning.publisher;

import com.ble.positioning.dto.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes outbound messages to the application log. Active unless the Kafka sink is enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "positioning.outbound.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingOutboundMessageSink implements OutboundMessageSink {

    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        try {
            log.info("Outbound {} [{}]: {}", message.type(), message.routingKey(),
                    objectMapper.writeValueAsString(message));
            return CompletableFuture.completedFuture(null);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
