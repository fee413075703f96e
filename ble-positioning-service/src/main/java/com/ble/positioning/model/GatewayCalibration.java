package com.ble.positioning.model;

/**
 * Per-gateway path-loss calibration.
 *
 * <p>{@code referencePowerDbm} is the RSSI expected at 1 m from the gateway and {@code
 * pathLossExponent} describes how fast the signal attenuates in this environment (2.0 for free
 * space, 2.5-4.0 for typical indoor floors). Either value may be absent, in which case the path
 * loss model falls back to {@link #NOMINAL}.
 *
 * @param referencePowerDbm RSSI at 1 m in dBm, or null when not calibrated
 * @param pathLossExponent environment exponent, or null when not calibrated
 */
public record GatewayCalibration(Double referencePowerDbm, Double pathLossExponent) {

    /** Nominal BLE calibration: -59 dBm at 1 m, free-space exponent. */
    public static final GatewayCalibration NOMINAL = new GatewayCalibration(-59.0, 2.0);

    /** Calibration with nothing set. */
    public static final GatewayCalibration UNSET = new GatewayCalibration(null, null);

    /**
     * Returns true if both values are present and usable. A non-positive or non-finite exponent
     * would make the path-loss relation meaningless, so it counts as missing.
     */
    public boolean isComplete() {
        return referencePowerDbm != null
                && Double.isFinite(referencePowerDbm)
                && pathLossExponent != null
                && Double.isFinite(pathLossExponent)
                && pathLossExponent > 0;
    }
}
