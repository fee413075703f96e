// com/ble/positioning/model/SmoothedPosition.java
package com.ble.positioning.model;

import java.time.Instant;

/**
 * Jitter-filtered position of a beacon together with its movement vector.
 *
 * <p>Instances are never modified. Each tick produces a new instance that supersedes the previous
 * one; the previous value remains valid as read-only history.
 *
 * @param beaconId beacon the position belongs to
 * @param floorId floor the beacon is on
 * @param x smoothed horizontal coordinate
 * @param y smoothed vertical coordinate
 * @param velocityX horizontal velocity in units per second
 * @param velocityY vertical velocity in units per second
 * @param speed magnitude of the velocity
 * @param heading direction of travel in degrees [0, 360), null when not moving
 * @param accuracy smoothed accuracy radius
 * @param updatedAt time of the estimate this position was derived from
 */
public record SmoothedPosition(
        String beaconId,
        String floorId,
        double x,
        double y,
        double velocityX,
        double velocityY,
        double speed,
        Double heading,
        double accuracy,
        Instant updatedAt) {

    public Point point() {
        return new Point(x, y);
    }

    public boolean hasHeading() {
        return heading != null;
    }
}
