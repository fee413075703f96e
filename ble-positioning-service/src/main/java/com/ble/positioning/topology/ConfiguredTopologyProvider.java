package com.ble.positioning.topology;

import com.ble.positioning.config.TopologyProperties;
import com.ble.positioning.config.TopologyProperties.BeaconDefinition;
import com.ble.positioning.config.TopologyProperties.FloorDefinition;
import com.ble.positioning.config.TopologyProperties.GatewayDefinition;
import com.ble.positioning.config.TopologyProperties.ZoneDefinition;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Floor;
import com.ble.positioning.model.Gateway;
import com.ble.positioning.model.GatewayCalibration;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.Zone;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Topology bound from the {@code topology} section of the application configuration.
 *
 * <p>The configuration is validated once at startup. Any violation throws
 * {@link IllegalStateException}, which aborts context startup; the pipeline never runs against a
 * topology it cannot trust.</p>
 *
 * <p><strong>Validated rules:</strong></p>
 * <ul>
 *   <li>Floor, gateway, beacon and zone ids are present and unique</li>
 *   <li>Gateway and beacon hardware addresses are present and unique</li>
 *   <li>Every gateway sits on a known floor and within its bounds</li>
 *   <li>Every zone sits on a known floor and has at least three vertices</li>
 * </ul>
 */
@Slf4j
@Component
public class ConfiguredTopologyProvider implements TopologyProvider {

    private final Map<String, Floor> floorsById;
    private final Map<String, Gateway> gatewaysById;
    private final Map<String, Gateway> gatewaysByMac;
    private final Map<String, Beacon> beaconsById;
    private final Map<String, Beacon> beaconsByMac;
    private final Map<String, Zone> zonesById;
    private final Map<String, List<Zone>> zonesByFloor;

    public ConfiguredTopologyProvider(TopologyProperties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("TopologyProperties cannot be null");
        }
        Map<String, Floor> floors = new LinkedHashMap<>();
        for (FloorDefinition definition : properties.getFloors()) {
            Floor floor = toFloor(definition);
            putUnique(floors, floor.id(), floor, "floor id");
        }

        Map<String, Gateway> gateways = new LinkedHashMap<>();
        Map<String, Gateway> gatewayMacs = new LinkedHashMap<>();
        for (GatewayDefinition definition : properties.getGateways()) {
            Gateway gateway = toGateway(definition, floors);
            putUnique(gateways, gateway.id(), gateway, "gateway id");
            putUnique(gatewayMacs, gateway.mac(), gateway, "gateway mac");
        }

        Map<String, Beacon> beacons = new LinkedHashMap<>();
        Map<String, Beacon> beaconMacs = new LinkedHashMap<>();
        for (BeaconDefinition definition : properties.getBeacons()) {
            Beacon beacon = toBeacon(definition);
            putUnique(beacons, beacon.id(), beacon, "beacon id");
            putUnique(beaconMacs, beacon.mac(), beacon, "beacon mac");
        }

        Map<String, Zone> zones = new LinkedHashMap<>();
        Map<String, List<Zone>> zonesOnFloor = new LinkedHashMap<>();
        for (ZoneDefinition definition : properties.getZones()) {
            Zone zone = toZone(definition, floors);
            putUnique(zones, zone.id(), zone, "zone id");
            zonesOnFloor.computeIfAbsent(zone.floorId(), k -> new ArrayList<>()).add(zone);
        }
        zonesOnFloor.replaceAll((floorId, list) -> List.copyOf(list));

        this.floorsById = Collections.unmodifiableMap(floors);
        this.gatewaysById = Collections.unmodifiableMap(gateways);
        this.gatewaysByMac = Collections.unmodifiableMap(gatewayMacs);
        this.beaconsById = Collections.unmodifiableMap(beacons);
        this.beaconsByMac = Collections.unmodifiableMap(beaconMacs);
        this.zonesById = Collections.unmodifiableMap(zones);
        this.zonesByFloor = Collections.unmodifiableMap(zonesOnFloor);

        log.info("Loaded topology - floors: {}, gateways: {}, beacons: {}, zones: {}",
                floorsById.size(), gatewaysById.size(), beaconsById.size(), zonesById.size());
    }

    @Override
    public Collection<Floor> floors() {
        return floorsById.values();
    }

    @Override
    public Optional<Floor> floor(String floorId) {
        return Optional.ofNullable(floorId).map(floorsById::get);
    }

    @Override
    public Optional<Gateway> gateway(String gatewayId) {
        return Optional.ofNullable(gatewayId).map(gatewaysById::get);
    }

    @Override
    public Optional<Gateway> gatewayByMac(String mac) {
        return Optional.ofNullable(MacAddresses.normalize(mac)).map(gatewaysByMac::get);
    }

    @Override
    public Optional<Beacon> beacon(String beaconId) {
        return Optional.ofNullable(beaconId).map(beaconsById::get);
    }

    @Override
    public Optional<Beacon> beaconByMac(String mac) {
        return Optional.ofNullable(MacAddresses.normalize(mac)).map(beaconsByMac::get);
    }

    @Override
    public Optional<Zone> zone(String zoneId) {
        return Optional.ofNullable(zoneId).map(zonesById::get);
    }

    @Override
    public List<Zone> zonesOnFloor(String floorId) {
        if (floorId == null) {
            return List.of();
        }
        return zonesByFloor.getOrDefault(floorId, List.of());
    }

    private static Floor toFloor(FloorDefinition definition) {
        String id = requireText(definition.getId(), "floor id");
        if (definition.getWidth() <= 0 || definition.getHeight() <= 0) {
            throw new IllegalStateException("Floor " + id + " must have a positive width and height");
        }
        String name = StringUtils.hasText(definition.getName()) ? definition.getName() : id;
        return new Floor(id, name, definition.getWidth(), definition.getHeight());
    }

    private static Gateway toGateway(GatewayDefinition definition, Map<String, Floor> floors) {
        String id = requireText(definition.getId(), "gateway id");
        String mac = MacAddresses.normalize(requireText(definition.getMac(), "mac of gateway " + id));
        Floor floor = floors.get(definition.getFloorId());
        if (floor == null) {
            throw new IllegalStateException(
                    "Gateway " + id + " references unknown floor " + definition.getFloorId());
        }
        Point position = new Point(definition.getX(), definition.getY());
        if (!floor.contains(position)) {
            throw new IllegalStateException("Gateway " + id + " at " + position
                    + " lies outside the bounds of floor " + floor.id());
        }
        GatewayCalibration calibration =
                new GatewayCalibration(definition.getReferencePower(), definition.getPathLossExponent());
        return new Gateway(id, mac, floor.id(), position, calibration, definition.isActive());
    }

    private static Beacon toBeacon(BeaconDefinition definition) {
        String id = requireText(definition.getId(), "beacon id");
        String mac = MacAddresses.normalize(requireText(definition.getMac(), "mac of beacon " + id));
        String name = StringUtils.hasText(definition.getName()) ? definition.getName() : id;
        return new Beacon(id, mac, name, definition.getResourceType(), definition.isActive());
    }

    private static Zone toZone(ZoneDefinition definition, Map<String, Floor> floors) {
        String id = requireText(definition.getId(), "zone id");
        if (!floors.containsKey(definition.getFloorId())) {
            throw new IllegalStateException(
                    "Zone " + id + " references unknown floor " + definition.getFloorId());
        }
        List<Point> vertices = new ArrayList<>();
        if (definition.isRectangle()) {
            double minX = Math.min(definition.getMinX(), definition.getMaxX());
            double maxX = Math.max(definition.getMinX(), definition.getMaxX());
            double minY = Math.min(definition.getMinY(), definition.getMaxY());
            double maxY = Math.max(definition.getMinY(), definition.getMaxY());
            vertices.add(new Point(minX, minY));
            vertices.add(new Point(maxX, minY));
            vertices.add(new Point(maxX, maxY));
            vertices.add(new Point(minX, maxY));
        } else {
            definition.getVertices().forEach(v -> vertices.add(new Point(v.getX(), v.getY())));
        }
        if (vertices.size() < 3) {
            throw new IllegalStateException("Zone " + id + " needs at least 3 vertices, got " + vertices.size());
        }
        if (definition.getDwellThresholdSeconds() < 0) {
            throw new IllegalStateException("Zone " + id + " has a negative dwell threshold");
        }
        String name = StringUtils.hasText(definition.getName()) ? definition.getName() : id;
        return new Zone(id, name, definition.getFloorId(), vertices, definition.isAlertOnEntry(),
                definition.isAlertOnExit(), definition.getDwellThresholdSeconds());
    }

    private static String requireText(String value, String what) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalStateException("Missing " + what + " in topology configuration");
        }
        return value.trim();
    }

    private static <T> void putUnique(Map<String, T> target, String key, T value, String what) {
        if (target.putIfAbsent(key, value) != null) {
            throw new IllegalStateException("Duplicate " + what + " in topology configuration: " + key);
        }
    }
}
