package com.ble.positioning;

import com.ble.positioning.config.TopologyProperties;
import com.ble.positioning.config.TopologyProperties.BeaconDefinition;
import com.ble.positioning.config.TopologyProperties.FloorDefinition;
import com.ble.positioning.config.TopologyProperties.GatewayDefinition;
import com.ble.positioning.config.TopologyProperties.VertexDefinition;
import com.ble.positioning.config.TopologyProperties.ZoneDefinition;
import com.ble.positioning.topology.ConfiguredTopologyProvider;

/**
 * Topology fixture shared by the tests.
 *
 * <p>One 20 x 20 floor ({@code floor-1}) with gateways A (0,0), B (10,0) and C (0,10), nominal
 * calibration (-59 dBm, exponent 2.0), one beacon and one square zone spanning (4,4)-(8,8).</p>
 */
public final class TestTopology {

    public static final String FLOOR = "floor-1";
    public static final String GATEWAY_A = "gw-a";
    public static final String GATEWAY_B = "gw-b";
    public static final String GATEWAY_C = "gw-c";
    public static final String GATEWAY_A_MAC = "AA:00:00:00:00:0A";
    public static final String GATEWAY_B_MAC = "AA:00:00:00:00:0B";
    public static final String GATEWAY_C_MAC = "AA:00:00:00:00:0C";
    public static final String BEACON = "beacon-1";
    public static final String BEACON_MAC = "C3:00:00:00:00:01";
    public static final String ZONE = "zone-1";

    private TestTopology() {
    }

    public static TopologyProperties triangle() {
        TopologyProperties properties = new TopologyProperties();
        properties.getFloors().add(floor(FLOOR, 20, 20));
        properties.getGateways().add(gateway(GATEWAY_A, GATEWAY_A_MAC, FLOOR, 0, 0, -59.0, 2.0));
        properties.getGateways().add(gateway(GATEWAY_B, GATEWAY_B_MAC, FLOOR, 10, 0, -59.0, 2.0));
        properties.getGateways().add(gateway(GATEWAY_C, GATEWAY_C_MAC, FLOOR, 0, 10, -59.0, 2.0));
        properties.getBeacons().add(beacon(BEACON, BEACON_MAC));
        properties.getZones().add(rectangleZone(ZONE, FLOOR, 4, 4, 8, 8));
        return properties;
    }

    public static ConfiguredTopologyProvider triangleProvider() {
        return new ConfiguredTopologyProvider(triangle());
    }

    public static FloorDefinition floor(String id, double width, double height) {
        FloorDefinition floor = new FloorDefinition();
        floor.setId(id);
        floor.setName(id);
        floor.setWidth(width);
        floor.setHeight(height);
        return floor;
    }

    public static GatewayDefinition gateway(String id, String mac, String floorId, double x, double y,
            Double referencePower, Double exponent) {
        GatewayDefinition gateway = new GatewayDefinition();
        gateway.setId(id);
        gateway.setMac(mac);
        gateway.setFloorId(floorId);
        gateway.setX(x);
        gateway.setY(y);
        gateway.setReferencePower(referencePower);
        gateway.setPathLossExponent(exponent);
        return gateway;
    }

    public static BeaconDefinition beacon(String id, String mac) {
        BeaconDefinition beacon = new BeaconDefinition();
        beacon.setId(id);
        beacon.setMac(mac);
        beacon.setName("Beacon " + id);
        beacon.setResourceType("Wheelchair");
        return beacon;
    }

    public static ZoneDefinition rectangleZone(String id, String floorId, double minX, double minY,
            double maxX, double maxY) {
        ZoneDefinition zone = new ZoneDefinition();
        zone.setId(id);
        zone.setName("Zone " + id);
        zone.setFloorId(floorId);
        zone.setMinX(minX);
        zone.setMinY(minY);
        zone.setMaxX(maxX);
        zone.setMaxY(maxY);
        return zone;
    }

    public static ZoneDefinition polygonZone(String id, String floorId, double... coordinates) {
        ZoneDefinition zone = new ZoneDefinition();
        zone.setId(id);
        zone.setName("Zone " + id);
        zone.setFloorId(floorId);
        for (int i = 0; i + 1 < coordinates.length; i += 2) {
            VertexDefinition vertex = new VertexDefinition();
            vertex.setX(coordinates[i]);
            vertex.setY(coordinates[i + 1]);
            zone.getVertices().add(vertex);
        }
        return zone;
    }

    /** RSSI a nominally calibrated gateway reports for a beacon at the given distance. */
    public static int rssiAt(double distance) {
        return (int) Math.round(-59 - 20 * Math.log10(distance));
    }
}
