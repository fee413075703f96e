// com/ble/positioning/model/Gateway.java
package com.ble.positioning.model;

/**
 * A fixed BLE receiver installed on a floor.
 *
 * <p>Gateways are immutable for the duration of a processing cycle; they are only changed by the
 * external configuration owner, which hands the pipeline a fresh instance.
 *
 * @param id internal gateway identifier
 * @param mac hardware address, upper-case colon separated
 * @param floorId floor the gateway is mounted on
 * @param position gateway location on the floor plan
 * @param calibration path-loss calibration, possibly incomplete
 * @param active inactive gateways are ignored by ingestion
 */
public record Gateway(
        String id,
        String mac,
        String floorId,
        Point position,
        GatewayCalibration calibration,
        boolean active) {

    public Gateway {
        if (calibration == null) {
            calibration = GatewayCalibration.UNSET;
        }
    }
}
