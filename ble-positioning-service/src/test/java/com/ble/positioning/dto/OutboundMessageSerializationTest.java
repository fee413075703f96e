package com.ble.positioning.dto;

import com.ble.positioning.model.AlertType;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Floor;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Outbound Message Serialization Tests")
class OutboundMessageSerializationTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Beacon BEACON =
      new Beacon("wheelchair-7", "C3:00:00:00:00:07", "Wheelchair 7", "Wheelchair", true);

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  @DisplayName("should write position messages with snake_case fields and ISO timestamps")
  void shouldWritePositionMessage() throws Exception {
    SmoothedPosition position =
        new SmoothedPosition("wheelchair-7", "floor-1", 3.5, 4.25, 1.0, 0.0, 1.0, 0.0, 0.8, T0);

    JsonNode json = objectMapper.readTree(
        objectMapper.writeValueAsString(PositionMessage.from(BEACON, position)));

    assertEquals("position", json.get("type").asText());
    assertEquals("wheelchair-7", json.at("/beacon/id").asText());
    assertEquals("C3:00:00:00:00:07", json.at("/beacon/mac").asText());
    assertEquals("Wheelchair", json.at("/beacon/resource_type").asText());
    assertEquals("floor-1", json.at("/location/floor_id").asText());
    assertEquals(4.25, json.at("/location/y").asDouble());
    assertEquals(0.8, json.at("/location/accuracy").asDouble());
    assertEquals(1.0, json.at("/movement/velocity_x").asDouble());
    assertEquals(0.0, json.at("/movement/heading").asDouble());
    assertEquals("2024-05-01T10:00:00Z", json.get("timestamp").asText());
    assertFalse(json.has("routingKey"));
    assertTrue(json.at("/location/floor_name").isNull());
  }

  @Test
  @DisplayName("should carry the floor name when the floor is known")
  void shouldWriteFloorName() throws Exception {
    SmoothedPosition position =
        new SmoothedPosition("wheelchair-7", "floor-1", 3.5, 4.25, 0, 0, 0, null, 0.8, T0);
    Floor floor = new Floor("floor-1", "Ground Floor", 30, 20);

    JsonNode json = objectMapper.readTree(
        objectMapper.writeValueAsString(PositionMessage.from(BEACON, floor, position)));

    assertEquals("floor-1", json.at("/location/floor_id").asText());
    assertEquals("Ground Floor", json.at("/location/floor_name").asText());
  }

  @Test
  @DisplayName("should write a null heading for a stationary beacon")
  void shouldWriteNullHeading() throws Exception {
    SmoothedPosition still =
        new SmoothedPosition("wheelchair-7", "floor-1", 3.5, 4.25, 0, 0, 0, null, 0.8, T0);

    JsonNode json = objectMapper.readTree(
        objectMapper.writeValueAsString(PositionMessage.from(BEACON, still)));

    assertTrue(json.at("/movement/heading").isNull());
    assertEquals(0.0, json.at("/movement/speed").asDouble());
  }

  @Test
  @DisplayName("should route positions by the compact beacon address")
  void shouldRoutePositionsByBeacon() {
    SmoothedPosition position =
        new SmoothedPosition("wheelchair-7", "floor-1", 0, 0, 0, 0, 0, null, 1, T0);

    assertEquals("C30000000007", PositionMessage.from(BEACON, position).routingKey());
  }

  @Test
  @DisplayName("should write alert messages with zone and position")
  void shouldWriteAlertMessage() throws Exception {
    Zone zone = new Zone("pharmacy", "Pharmacy", "floor-1",
        List.of(Point.of(20, 10), Point.of(30, 10), Point.of(30, 20)), true, true, 300);
    ZoneAlertEvent event =
        ZoneAlertEvent.of("wheelchair-7", "pharmacy", AlertType.DWELL, T0, Point.of(25, 12));

    AlertMessage message = AlertMessage.from(BEACON, zone, event);
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(message));

    assertEquals("zone_alert", json.get("type").asText());
    assertEquals("dwell", json.get("alert_type").asText());
    assertEquals("Pharmacy", json.at("/zone/name").asText());
    assertEquals(25.0, json.at("/position/x").asDouble());
    assertEquals("2024-05-01T10:00:00Z", json.get("timestamp").asText());
    assertEquals("dwell/pharmacy", message.routingKey());
  }
}
