package com.ble.positioning.listener;

import com.ble.positioning.dto.GatewayReading;
import com.ble.positioning.exception.GatewayPayloadException;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.processor.GatewayPayloadParser;
import com.ble.positioning.service.SignalIngestionService;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka adapter of the inbound message bus. Each record carries one gateway payload; the record
 * key, when present, is the gateway address used for payloads that do not name their gateway.
 *
 * <p>Decoded readings are handed to {@link SignalIngestionService#submit(GatewayReading)} and the
 * listener returns immediately. Undecodable payloads are logged, counted and skipped; they are
 * never redelivered.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "positioning.inbound.kafka.enabled", havingValue = "true")
public class GatewayMessageListener {

    private final GatewayPayloadParser parser;
    private final SignalIngestionService ingestionService;
    private final PositioningMetrics metrics;

    @Getter
    private final AtomicLong processedMessageCount = new AtomicLong(0);

    @Getter
    private final AtomicLong rejectedMessageCount = new AtomicLong(0);

    @KafkaListener(
            topics = "${positioning.inbound.kafka.topic}",
            groupId = "${positioning.inbound.kafka.group-id}")
    public void onMessage(ConsumerRecord<String, String> record) {
        try {
            List<GatewayReading> readings = parser.parse(record.value(), record.key());
            readings.forEach(ingestionService::submit);
            processedMessageCount.incrementAndGet();
            log.debug("Queued {} reading(s) from {}-{}@{}", readings.size(), record.topic(),
                    record.partition(), record.offset());
        } catch (GatewayPayloadException e) {
            rejectedMessageCount.incrementAndGet();
            metrics.recordPayloadRejected();
            log.warn("Rejected gateway payload at {}-{}@{}: {}", record.topic(), record.partition(),
                    record.offset(), e.getMessage());
        }
    }
}
