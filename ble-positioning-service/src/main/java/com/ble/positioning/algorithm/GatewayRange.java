package com.ble.positioning.algorithm;

import com.ble.positioning.model.Point;

/**
 * Estimated distance between a beacon and one gateway.
 *
 * @param gatewayId gateway the range was measured by
 * @param floorId floor the gateway is mounted on
 * @param position gateway location
 * @param distance estimated beacon distance, always positive
 */
public record GatewayRange(String gatewayId, String floorId, Point position, double distance) {

    public GatewayRange {
        if (!(distance > 0) || !Double.isFinite(distance)) {
            throw new IllegalArgumentException("Range distance must be positive and finite: " + distance);
        }
    }
}
