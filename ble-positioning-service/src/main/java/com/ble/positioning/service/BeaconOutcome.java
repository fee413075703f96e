package com.ble.positioning.service;

/** Result of evaluating one beacon in one tick. */
public enum BeaconOutcome {
    /** A new estimate was produced, smoothed and published. */
    LOCATED,
    /** Fewer than two usable gateway ranges; the beacon's position was left unchanged. */
    INSUFFICIENT,
    /** Another evaluation of the same beacon was still running. */
    BUSY,
    /** The beacon is no longer in the topology, or is inactive. */
    UNKNOWN,
    /** The pipeline threw; other beacons were not affected. */
    FAILED,
    /** The scheduler stopped before this beacon's evaluation started. */
    DROPPED
}
