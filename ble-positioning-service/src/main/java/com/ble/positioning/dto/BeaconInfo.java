package com.ble.positioning.dto;

import com.ble.positioning.model.Beacon;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Beacon identity as embedded in outbound messages. */
public record BeaconInfo(
    @JsonProperty("id") String id,
    @JsonProperty("mac") String mac,
    @JsonProperty("name") String name,
    @JsonProperty("resource_type") String resourceType) {

  public static BeaconInfo from(Beacon beacon) {
    return new BeaconInfo(beacon.id(), beacon.mac(), beacon.name(), beacon.resourceType());
  }
}
