package com.ble.positioning.model;

import java.util.Optional;

/** How a raw position estimate was computed. */
public enum EstimationMethod {
    /** Intersection of two range circles. */
    TWO_POINT("two_point"),
    /** Weighted non-linear least squares over three or more ranges. */
    LEAST_SQUARES("least_squares");

    private final String label;

    EstimationMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Selects the method for the given number of usable gateway ranges. Empty when fewer than two
     * ranges are available, since no position can be derived from them.
     */
    public static Optional<EstimationMethod> forGatewayCount(int gatewayCount) {
        if (gatewayCount >= 3) {
            return Optional.of(LEAST_SQUARES);
        }
        if (gatewayCount == 2) {
            return Optional.of(TWO_POINT);
        }
        return Optional.empty();
    }
}
