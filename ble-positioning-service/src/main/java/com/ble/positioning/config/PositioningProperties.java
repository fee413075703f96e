// com/ble/positioning/config/PositioningProperties.java
package com.ble.positioning.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the positioning pipeline.
 * Maps to the 'positioning' section in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "positioning")
public class PositioningProperties {

    @Valid
    private Processing processing = new Processing();
    @Valid
    private PathLoss pathLoss = new PathLoss();
    @Valid
    private Estimation estimation = new Estimation();
    @Valid
    private Smoothing smoothing = new Smoothing();
    @Valid
    private Zones zones = new Zones();
    @Valid
    private Inbound inbound = new Inbound();
    @Valid
    private Outbound outbound = new Outbound();

    @Data
    public static class Processing {
        /** Aggregation window length. */
        @Min(1)
        private long windowSeconds = 5;
        @Min(1)
        private long tickPeriodSeconds = 1;
        /** How long raw signals are kept; raised to the aggregation window plus two tick periods if shorter. */
        @Min(1)
        private long retentionSeconds = 60;
        @Min(1)
        private long retentionSweepSeconds = 10;
        /** Per-beacon cap on stored raw signals, oldest evicted first. */
        @Min(2)
        private int maxSignalsPerBeacon = 2000;
        /** Per-beacon cap on position estimates kept by the in-memory tracking store. */
        @Min(1)
        private int maxHistoryPerBeacon = 500;
        @Min(1)
        private int maxAlerts = 1000;
        @Min(1)
        private int workers = 4;
        /** Time already-started beacon evaluations get to finish when the scheduler stops. */
        @Min(0)
        private long shutdownGraceSeconds = 5;
        private boolean autoStart = true;
    }

    @Data
    public static class PathLoss {
        private double defaultReferencePowerDbm = -59.0;
        @DecimalMin(value = "0.0", inclusive = false)
        private double defaultExponent = 2.0;
        @DecimalMin(value = "0.0", inclusive = false)
        private double minDistance = 0.1;
        @DecimalMin(value = "0.0", inclusive = false)
        private double maxDistance = 100.0;
    }

    @Data
    public static class Estimation {
        /** Ranges beyond this are discarded unless every range is beyond it. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double maxUsableDistance = 50.0;
        @Min(1)
        private int maxIterations = 50;
        @DecimalMin(value = "0.0", inclusive = false)
        private double epsilon = 1e-4;
        @DecimalMin(value = "0.0", inclusive = false)
        private double minAccuracy = 0.1;
        /** Multiplier applied to the accuracy radius of degraded estimates. */
        @DecimalMin("1.0")
        private double degradedAccuracyFactor = 2.0;
    }

    @Data
    public static class Smoothing {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double alpha = 0.3;
        @DecimalMin("0.0")
        private double stabilityDistanceThreshold = 0.5;
        @Min(0)
        private long driftWindowSeconds = 10;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double velocityDecay = 0.5;
    }

    @Data
    public static class Zones {
        @Min(0)
        private long cooldownSeconds = 30;
    }

    @Data
    public static class Inbound {
        @Min(1)
        private int queueCapacity = 10000;
        @Valid
        private Kafka kafka = new Kafka();

        @Data
        public static class Kafka {
            private boolean enabled = false;
            @NotBlank
            private String topic = "ble-gateway-readings";
            @NotBlank
            private String groupId = "ble-positioning-service";
        }
    }

    @Data
    public static class Outbound {
        @Min(1)
        private int queueCapacity = 5000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        @Min(0)
        private long flushTimeoutSeconds = 5;
        @Valid
        private Kafka kafka = new Kafka();

        @Data
        public static class Kafka {
            private boolean enabled = false;
            @NotBlank
            private String positionsTopic = "ble-positions";
            @NotBlank
            private String alertsTopic = "ble-zone-alerts";
        }
    }

    /** What the outbound queue discards when it is full. */
    public enum OverflowPolicy {
        DROP_OLDEST,
        DROP_NEWEST
    }
}
