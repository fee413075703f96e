package com.ble.positioning.publisher;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.dto.AlertMessage;
import com.ble.positioning.dto.PositionMessage;
import com.ble.positioning.model.AlertType;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Kafka Outbound Message Sink Tests")
class KafkaOutboundMessageSinkTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Beacon BEACON = new Beacon("b1", "C3:00:00:00:00:01", "Wheelchair 1", "Wheelchair", true);

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private KafkaOutboundMessageSink sink;

    @BeforeEach
    void setUp() {
        PositioningProperties properties = new PositioningProperties();
        properties.getOutbound().getKafka().setPositionsTopic("positions");
        properties.getOutbound().getKafka().setAlertsTopic("alerts");
        sink = new KafkaOutboundMessageSink(kafkaTemplate, new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("should key positions by compact beacon MAC on the positions topic")
    void shouldSendPositions() throws Exception {
        when(kafkaTemplate.send(eq("positions"), eq("C30000000001"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(result("positions")));
        PositionMessage message = PositionMessage.from(BEACON,
                new SmoothedPosition("b1", "floor-1", 3.0, 4.0, 0, 0, 0, null, 1.5, T0));

        sink.send(message).get(1, TimeUnit.SECONDS);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("positions"), eq("C30000000001"), payload.capture());
        assertThat(payload.getValue()).contains("\"type\":\"position\"").contains("\"floor_id\":\"floor-1\"");
    }

    @Test
    @DisplayName("should key alerts by type and zone on the alerts topic")
    void shouldSendAlerts() throws Exception {
        when(kafkaTemplate.send(eq("alerts"), eq("entry/z1"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(result("alerts")));
        Zone zone = new Zone("z1", "Pharmacy", "floor-1",
                List.of(Point.of(0, 0), Point.of(1, 0), Point.of(1, 1)), true, true, 0);
        AlertMessage message = AlertMessage.from(BEACON, zone,
                ZoneAlertEvent.of("b1", "z1", AlertType.ENTRY, T0, Point.of(0.5, 0.2)));

        sink.send(message).get(1, TimeUnit.SECONDS);

        verify(kafkaTemplate).send(eq("alerts"), eq("entry/z1"), anyString());
    }

    @Test
    @DisplayName("should surface broker failures through the returned future")
    void shouldSurfaceFailures() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        PositionMessage message = PositionMessage.from(BEACON,
                new SmoothedPosition("b1", "floor-1", 3.0, 4.0, 0, 0, 0, null, 1.5, T0));

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> sink.send(message).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    private static SendResult<String, String> result(String topic) {
        return new SendResult<>(new ProducerRecord<>(topic, "key", "value"),
                new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0));
    }
}
