// com/ble/positioning/model/Point.java
package com.ble.positioning.model;

/**
 * A point on a floor plan, in floor-plan units (metres unless the floor plan says otherwise).
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Point(double x, double y) {

    public static Point of(double x, double y) {
        return new Point(x, y);
    }

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
