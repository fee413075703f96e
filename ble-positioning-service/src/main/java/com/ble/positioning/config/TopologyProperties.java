package com.ble.positioning.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Floors, gateways, beacons and zones the pipeline works with.
 * Maps to the 'topology' section in application.yml.
 *
 * <p>The lists are owned by whoever provisions the site; the pipeline only reads them. A zone
 * may be given either as a polygon ({@code vertices}) or as an axis-aligned rectangle
 * ({@code min-x}, {@code min-y}, {@code max-x}, {@code max-y}).</p>
 */
@Data
@ConfigurationProperties(prefix = "topology")
public class TopologyProperties {

    private List<FloorDefinition> floors = new ArrayList<>();
    private List<GatewayDefinition> gateways = new ArrayList<>();
    private List<BeaconDefinition> beacons = new ArrayList<>();
    private List<ZoneDefinition> zones = new ArrayList<>();

    @Data
    public static class FloorDefinition {
        private String id;
        private String name;
        private double width;
        private double height;
    }

    @Data
    public static class GatewayDefinition {
        private String id;
        private String mac;
        private String floorId;
        private double x;
        private double y;
        private Double referencePower;
        private Double pathLossExponent;
        private boolean active = true;
    }

    @Data
    public static class BeaconDefinition {
        private String id;
        private String mac;
        private String name;
        private String resourceType;
        private boolean active = true;
    }

    @Data
    public static class ZoneDefinition {
        private String id;
        private String name;
        private String floorId;
        private List<VertexDefinition> vertices = new ArrayList<>();
        private Double minX;
        private Double minY;
        private Double maxX;
        private Double maxY;
        private boolean alertOnEntry = true;
        private boolean alertOnExit = true;
        private long dwellThresholdSeconds = 0;

        public boolean isRectangle() {
            return minX != null && minY != null && maxX != null && maxY != null;
        }
    }

    @Data
    public static class VertexDefinition {
        private double x;
        private double y;
    }
}
