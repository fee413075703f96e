package com.ble.positioning.dto;

import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Floor;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.topology.MacAddresses;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound location update, one per beacon per tick with a new smoothed position.
 *
 * <pre>
 * {
 *   "type": "position",
 *   "beacon":   {"id": .., "mac": .., "name": .., "resource_type": ..},
 *   "location": {"floor_id": .., "floor_name": .. | null, "x": .., "y": .., "accuracy": ..},
 *   "movement": {"speed": .., "heading": .. | null, "velocity_x": .., "velocity_y": ..},
 *   "timestamp": "2024-01-01T00:00:00Z"
 * }
 * </pre>
 */
public record PositionMessage(
    @JsonProperty("type") String type,
    @JsonProperty("beacon") BeaconInfo beacon,
    @JsonProperty("location") Location location,
    @JsonProperty("movement") Movement movement,
    @JsonProperty("timestamp") String timestamp)
    implements OutboundMessage {

  public static final String TYPE = "position";

  public static PositionMessage from(Beacon beacon, SmoothedPosition position) {
    return from(beacon, null, position);
  }

  /** {@code floor} may be null when the floor is no longer configured. */
  public static PositionMessage from(Beacon beacon, Floor floor, SmoothedPosition position) {
    return new PositionMessage(
        TYPE,
        BeaconInfo.from(beacon),
        new Location(
            position.floorId(),
            floor == null ? null : floor.name(),
            position.x(),
            position.y(),
            position.accuracy()),
        new Movement(
            position.speed(), position.heading(), position.velocityX(), position.velocityY()),
        position.updatedAt().toString());
  }

  @Override
  public String routingKey() {
    return MacAddresses.compact(beacon.mac());
  }

  public record Location(
      @JsonProperty("floor_id") String floorId,
      @JsonProperty("floor_name") String floorName,
      @JsonProperty("x") double x,
      @JsonProperty("y") double y,
      @JsonProperty("accuracy") double accuracy) {}

  /** Heading is null while the beacon is not moving. */
  public record Movement(
      @JsonProperty("speed") double speed,
      @JsonProperty("heading") Double heading,
      @JsonProperty("velocity_x") double velocityX,
      @JsonProperty("velocity_y") double velocityY) {}
}
