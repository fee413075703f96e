package com.ble.positioning.dto;

import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound zone alert.
 *
 * <pre>
 * {
 *   "type": "zone_alert",
 *   "alert_type": "entry" | "exit" | "dwell",
 *   "beacon":   {"id": .., "mac": .., "name": .., "resource_type": ..},
 *   "zone":     {"id": .., "name": ..},
 *   "position": {"x": .., "y": ..},
 *   "timestamp": "2024-01-01T00:00:00Z"
 * }
 * </pre>
 */
public record AlertMessage(
    @JsonProperty("type") String type,
    @JsonProperty("alert_type") String alertType,
    @JsonProperty("beacon") BeaconInfo beacon,
    @JsonProperty("zone") ZoneInfo zone,
    @JsonProperty("position") PositionInfo position,
    @JsonProperty("timestamp") String timestamp)
    implements OutboundMessage {

  public static final String TYPE = "zone_alert";

  public static AlertMessage from(Beacon beacon, Zone zone, ZoneAlertEvent event) {
    return new AlertMessage(
        TYPE,
        event.alertType().getLabel(),
        BeaconInfo.from(beacon),
        new ZoneInfo(zone.id(), zone.name()),
        new PositionInfo(event.x(), event.y()),
        event.triggeredAt().toString());
  }

  @Override
  public String routingKey() {
    return alertType + "/" + zone.id();
  }

  public record ZoneInfo(@JsonProperty("id") String id, @JsonProperty("name") String name) {}

  public record PositionInfo(@JsonProperty("x") double x, @JsonProperty("y") double y) {}
}
