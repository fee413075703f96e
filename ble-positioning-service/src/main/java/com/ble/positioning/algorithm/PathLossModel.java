// com/ble/positioning/algorithm/PathLossModel.java
package com.ble.positioning.algorithm;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.Gateway;
import com.ble.positioning.model.GatewayCalibration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Log-distance path-loss model converting a robust RSSI into an estimated distance.
 *
 * <p>MATHEMATICAL FOUNDATION:</p>
 * <pre>
 *   RSSI(d) = P₀ - 10 × n × log₁₀(d)        (d in metres, d₀ = 1 m)
 *   d       = 10 ^ ((P₀ - RSSI) / (10 × n))
 * </pre>
 * where P₀ is the RSSI at one metre and n the path-loss exponent of the gateway's environment.
 *
 * <p>The result is clamped to {@code [minDistance, maxDistance]}. The lower bound keeps ranges
 * strictly positive when a beacon is practically touching the gateway (RSSI above P₀); the upper
 * bound stops very weak readings from producing ranges far beyond any plausible floor.</p>
 *
 * <p>A gateway without usable calibration is ranged with the configured nominal pair
 * (-59 dBm, 2.0 by default). That is a recoverable default, reported through
 * {@link #hasCalibration(Gateway)}.</p>
 */
@Component
public class PathLossModel {

    private final double defaultReferencePower;
    private final double defaultExponent;
    private final double minDistance;
    private final double maxDistance;

    @Autowired
    public PathLossModel(PositioningProperties properties) {
        this(properties.getPathLoss().getDefaultReferencePowerDbm(),
                properties.getPathLoss().getDefaultExponent(),
                properties.getPathLoss().getMinDistance(),
                properties.getPathLoss().getMaxDistance());
    }

    PathLossModel(double defaultReferencePower, double defaultExponent, double minDistance, double maxDistance) {
        if (!(defaultExponent > 0)) {
            throw new IllegalArgumentException("Default path-loss exponent must be positive");
        }
        if (!(minDistance > 0) || maxDistance < minDistance) {
            throw new IllegalArgumentException(
                    "Distance clamp must satisfy 0 < min <= max, got [" + minDistance + ", " + maxDistance + "]");
        }
        this.defaultReferencePower = defaultReferencePower;
        this.defaultExponent = defaultExponent;
        this.minDistance = minDistance;
        this.maxDistance = maxDistance;
    }

    /**
     * Estimated distance between the gateway and a beacon received at {@code robustRssi}.
     *
     * @return distance in floor-plan units, within the configured clamp
     */
    public double distance(Gateway gateway, double robustRssi) {
        GatewayCalibration calibration = gateway.calibration();
        double referencePower = calibration.referencePowerDbm() != null
                && Double.isFinite(calibration.referencePowerDbm())
                ? calibration.referencePowerDbm()
                : defaultReferencePower;
        double exponent = calibration.pathLossExponent() != null
                && Double.isFinite(calibration.pathLossExponent())
                && calibration.pathLossExponent() > 0
                ? calibration.pathLossExponent()
                : defaultExponent;

        double distance = Math.pow(10.0, (referencePower - robustRssi) / (10.0 * exponent));
        if (Double.isNaN(distance)) {
            return maxDistance;
        }
        return Math.max(minDistance, Math.min(maxDistance, distance));
    }

    /** False when {@link #distance} has to fall back to a nominal value for this gateway. */
    public boolean hasCalibration(Gateway gateway) {
        return gateway.calibration().isComplete();
    }

    public double getMinDistance() {
        return minDistance;
    }

    public double getMaxDistance() {
        return maxDistance;
    }
}
