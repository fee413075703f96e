package com.ble.positioning.model;

import java.time.Instant;

/**
 * Unsmoothed position computed for one beacon in one tick.
 *
 * @param beaconId beacon the estimate belongs to
 * @param floorId floor the contributing gateways are on
 * @param x horizontal coordinate
 * @param y vertical coordinate
 * @param accuracyRadius uncertainty radius derived from the fit residuals
 * @param method algorithm that produced the estimate
 * @param computedAt tick time
 */
public record PositionEstimate(
        String beaconId,
        String floorId,
        double x,
        double y,
        double accuracyRadius,
        EstimationMethod method,
        Instant computedAt) {

    public Point point() {
        return new Point(x, y);
    }
}
