package com.ble.positioning.service;

import com.ble.positioning.model.AggregatedSignal;
import com.ble.positioning.model.RawSignal;
import com.ble.positioning.repository.SignalStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Component;

/**
 * Reduces a beacon's raw observations over a sliding window to one robust RSSI per gateway.
 *
 * <p>For each gateway the samples in {@code [now - window, now]} are IQR filtered: anything
 * outside {@code [Q1 - 1.5·IQR, Q3 + 1.5·IQR]} is discarded and the median of the rest is the
 * robust value. Quartiles use linear interpolation between order statistics (Hyndman-Fan type 7),
 * so the result depends only on the multiset of samples, never on their arrival order.</p>
 *
 * <p>Gateways with fewer than {@value #MIN_SAMPLES} samples in the window are left out rather
 * than given a default. Aggregation is a pure read; it never removes signals from the store.</p>
 */
@Component
public class SignalAggregator {

    static final int MIN_SAMPLES = 2;
    private static final double IQR_MULTIPLIER = 1.5;

    private final SignalStore signalStore;

    public SignalAggregator(SignalStore signalStore) {
        if (signalStore == null) {
            throw new IllegalArgumentException("SignalStore cannot be null");
        }
        this.signalStore = signalStore;
    }

    /** Aggregates over everything stored so far. */
    public Map<String, AggregatedSignal> aggregate(String beaconId, Instant now, long windowSeconds) {
        return aggregate(beaconId, now, windowSeconds, Long.MAX_VALUE);
    }

    /**
     * Aggregates over the signals visible at a store cut.
     *
     * @return gateway id to aggregated signal, sorted by gateway id; empty when no gateway has
     *     enough samples
     */
    public Map<String, AggregatedSignal> aggregate(String beaconId, Instant now, long windowSeconds, long cut) {
        Instant windowStart = now.minus(Duration.ofSeconds(windowSeconds));
        Map<String, List<Integer>> byGateway = new TreeMap<>();
        for (RawSignal signal : signalStore.signals(beaconId, windowStart, now, cut)) {
            byGateway.computeIfAbsent(signal.gatewayId(), k -> new ArrayList<>()).add(signal.rssiDbm());
        }

        Map<String, AggregatedSignal> result = new TreeMap<>();
        byGateway.forEach((gatewayId, samples) -> {
            if (samples.size() < MIN_SAMPLES) {
                return;
            }
            result.put(gatewayId, new AggregatedSignal(beaconId, gatewayId, robustRssi(samples),
                    samples.size(), windowStart, now));
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Median of the samples that survive IQR filtering.
     *
     * @param samples at least one RSSI value
     */
    static double robustRssi(List<Integer> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i);
        }
        // Percentile caches the sorted copy, so a fresh instance per call keeps this thread safe.
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(values);
        double q1 = percentile.evaluate(25.0);
        double q3 = percentile.evaluate(75.0);
        double iqr = q3 - q1;
        double lower = q1 - IQR_MULTIPLIER * iqr;
        double upper = q3 + IQR_MULTIPLIER * iqr;

        double[] kept = new double[values.length];
        int count = 0;
        for (double value : values) {
            if (value >= lower && value <= upper) {
                kept[count++] = value;
            }
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(kept, 0, count, 50.0);
    }
}
