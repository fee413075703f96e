package com.ble.positioning.model;

import java.time.Instant;

/**
 * A qualifying zone transition. Handed to the store and the outbound bus, never changed afterwards.
 *
 * @param beaconId beacon that triggered the alert
 * @param zoneId zone involved
 * @param alertType entry, exit or dwell
 * @param triggeredAt tick time of the transition
 * @param x beacon position when the alert fired
 * @param y beacon position when the alert fired
 * @param acknowledged always false when created; acknowledgement is owned by the store
 */
public record ZoneAlertEvent(
        String beaconId,
        String zoneId,
        AlertType alertType,
        Instant triggeredAt,
        double x,
        double y,
        boolean acknowledged) {

    public static ZoneAlertEvent of(
            String beaconId, String zoneId, AlertType alertType, Instant triggeredAt, Point position) {
        return new ZoneAlertEvent(
                beaconId, zoneId, alertType, triggeredAt, position.x(), position.y(), false);
    }
}
