package com.ble.positioning.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** A message queued for the outbound bus. */
public interface OutboundMessage {

  /** Message type as written to the wire ({@code position} or {@code zone_alert}). */
  String type();

  /**
   * Routing key: the compact beacon address for positions, {@code <alertType>/<zoneId>} for
   * alerts.
   */
  @JsonIgnore
  String routingKey();
}
