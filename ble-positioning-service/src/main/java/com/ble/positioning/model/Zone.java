// com/ble/positioning/model/Zone.java
package com.ble.positioning.model;

import java.util.List;

/**
 * Polygonal geofence on a floor.
 *
 * <p>The external owner guarantees at least three vertices and a non-self-intersecting outline.
 * The constructor re-checks the vertex count because a degenerate polygon would silently never
 * contain anything.
 *
 * @param id zone identifier
 * @param name display name
 * @param floorId floor the zone is drawn on
 * @param vertices outline in drawing order, not closed
 * @param alertOnEntry emit an entry alert when a beacon moves in
 * @param alertOnExit emit an exit alert when a beacon moves out
 * @param dwellThresholdSeconds emit one dwell alert after this many seconds inside, 0 disables
 */
public record Zone(
        String id,
        String name,
        String floorId,
        List<Point> vertices,
        boolean alertOnEntry,
        boolean alertOnExit,
        long dwellThresholdSeconds) {

    public Zone {
        if (vertices == null || vertices.size() < 3) {
            throw new IllegalArgumentException("Zone " + id + " needs at least 3 vertices");
        }
        vertices = List.copyOf(vertices);
    }

    public boolean isDwellAlertEnabled() {
        return dwellThresholdSeconds > 0;
    }

    public boolean alertsOn(AlertType type) {
        switch (type) {
            case ENTRY:
                return alertOnEntry;
            case EXIT:
                return alertOnExit;
            case DWELL:
                return isDwellAlertEnabled();
            default:
                return false;
        }
    }
}
