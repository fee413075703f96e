// com/ble/positioning/model/RawSignal.java
package com.ble.positioning.model;

import java.time.Instant;

/**
 * One RSSI observation of a beacon by a gateway, exactly as received. Never updated.
 *
 * @param beaconId observed beacon
 * @param gatewayId observing gateway
 * @param rssiDbm received signal strength in dBm
 * @param txPower advertised 1 m power if the beacon reported one, otherwise null
 * @param observedAt observation time reported by the gateway
 * @param sequence store-assigned append order, 0 before the signal is stored
 */
public record RawSignal(
        String beaconId,
        String gatewayId,
        int rssiDbm,
        Integer txPower,
        Instant observedAt,
        long sequence) {

    public static RawSignal of(String beaconId, String gatewayId, int rssiDbm, Instant observedAt) {
        return new RawSignal(beaconId, gatewayId, rssiDbm, null, observedAt, 0L);
    }

    public RawSignal withSequence(long newSequence) {
        return new RawSignal(beaconId, gatewayId, rssiDbm, txPower, observedAt, newSequence);
    }
}
