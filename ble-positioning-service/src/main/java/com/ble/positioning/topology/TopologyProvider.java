package com.ble.positioning.topology;

import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Floor;
import com.ble.positioning.model.Gateway;
import com.ble.positioning.model.Zone;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the site: floors, gateways with their calibration, beacons and zones.
 *
 * <p>The pipeline never changes topology. Implementations must return the same objects for the
 * whole duration of a processing tick; a reconfiguration is visible from the next tick on.</p>
 */
public interface TopologyProvider {

    Collection<Floor> floors();

    Optional<Floor> floor(String floorId);

    Optional<Gateway> gateway(String gatewayId);

    /** Looks a gateway up by hardware address in any notation {@link MacAddresses} accepts. */
    Optional<Gateway> gatewayByMac(String mac);

    Optional<Beacon> beacon(String beaconId);

    /** Looks a beacon up by hardware address in any notation {@link MacAddresses} accepts. */
    Optional<Beacon> beaconByMac(String mac);

    Optional<Zone> zone(String zoneId);

    /** Zones drawn on the given floor, in configuration order. */
    List<Zone> zonesOnFloor(String floorId);
}
