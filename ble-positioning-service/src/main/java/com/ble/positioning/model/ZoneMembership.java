package com.ble.positioning.model;

import java.time.Instant;

/**
 * A beacon currently inside a zone.
 *
 * @param beaconId beacon inside the zone
 * @param zoneId zone containing it
 * @param since time the beacon entered
 * @param dwellAlerted whether the dwell alert for this stay has already fired
 */
public record ZoneMembership(String beaconId, String zoneId, Instant since, boolean dwellAlerted) {

    public ZoneMembership markDwellAlerted() {
        return new ZoneMembership(beaconId, zoneId, since, true);
    }
}
