package com.ble.positioning.model;

/**
 * A floor plan. Coordinates on the floor run from (0, 0) to (width, height).
 *
 * @param id floor identifier
 * @param name display name
 * @param width plan width in floor-plan units
 * @param height plan height in floor-plan units
 */
public record Floor(String id, String name, double width, double height) {

    public boolean contains(Point point) {
        return point.x() >= 0 && point.x() <= width && point.y() >= 0 && point.y() <= height;
    }
}
