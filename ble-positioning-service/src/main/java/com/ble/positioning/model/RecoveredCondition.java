package com.ble.positioning.model;

/**
 * Non-fatal conditions met while processing signals. None of them interrupts the pipeline, but
 * every occurrence is counted so operators can see them.
 */
public enum RecoveredCondition {
    /** Fewer than two usable gateway ranges; the beacon keeps its previous position. */
    INSUFFICIENT_GATEWAYS("insufficient_gateways"),
    /** Non-intersecting circles or collinear gateways; a fallback estimate was used. */
    DEGENERATE_GEOMETRY("degenerate_geometry"),
    /** Least squares hit its iteration cap; the best iterate was used. */
    NON_CONVERGENCE("non_convergence"),
    /** Inbound reading named an unknown or inactive beacon or gateway; it was dropped. */
    UNRESOLVED_IDENTITY("unresolved_identity"),
    /** Gateway had no usable calibration; nominal values were used. */
    MISSING_CALIBRATION("missing_calibration");

    private final String tag;

    RecoveredCondition(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
