package com.ble.positioning.dto;

import java.time.Instant;

/**
 * A decoded reading as delivered by the inbound message bus, before identities are resolved.
 *
 * @param beaconMac beacon hardware address, any common notation
 * @param gatewayMac gateway hardware address, any common notation
 * @param rssi received signal strength in dBm
 * @param txPower advertised 1 m power, null when not reported
 * @param observedAt observation time
 */
public record GatewayReading(
    String beaconMac, String gatewayMac, int rssi, Integer txPower, Instant observedAt) {

  public static GatewayReading of(String beaconMac, String gatewayMac, int rssi, Instant observedAt) {
    return new GatewayReading(beaconMac, gatewayMac, rssi, null, observedAt);
  }
}
