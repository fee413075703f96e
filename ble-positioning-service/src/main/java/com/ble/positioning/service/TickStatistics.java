package com.ble.positioning.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Summary of one processing tick.
 *
 * @param tickNumber ticks since startup, starting at 1
 * @param startedAt tick time
 * @param cut signal store cut the tick read from
 * @param outcomes number of beacons per outcome
 * @param duration wall time the tick took
 */
public record TickStatistics(
        long tickNumber, Instant startedAt, long cut, Map<BeaconOutcome, Integer> outcomes, Duration duration) {

    public TickStatistics {
        outcomes = Map.copyOf(outcomes);
    }

    public int count(BeaconOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int beaconCount() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }
}
