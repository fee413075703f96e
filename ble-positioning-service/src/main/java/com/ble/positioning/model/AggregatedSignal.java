package com.ble.positioning.model;

import java.time.Instant;

/**
 * Robust per-gateway RSSI for one beacon over one aggregation window. Recomputed every tick.
 *
 * @param beaconId beacon the samples belong to
 * @param gatewayId gateway that observed them
 * @param robustRssiDbm median of the samples that survived IQR filtering
 * @param sampleCount number of raw samples in the window, before filtering
 * @param windowStart inclusive window start
 * @param windowEnd inclusive window end
 */
public record AggregatedSignal(
        String beaconId,
        String gatewayId,
        double robustRssiDbm,
        int sampleCount,
        Instant windowStart,
        Instant windowEnd) {}
