package com.ble.positioning.algorithm;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RecoveredCondition;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a beacon's gateway ranges into one raw position estimate.
 *
 * <p><strong>Processing steps:</strong></p>
 * <ol>
 *   <li><strong>Floor resolution:</strong> the beacon is placed on the floor with the most
 *       reporting gateways; ties go to the floor with the smaller mean range, then to the smaller
 *       floor id. Ranges from other floors are ignored.</li>
 *   <li><strong>Range filtering:</strong> ranges beyond the maximum usable distance are
 *       discarded, unless that would discard all of them.</li>
 *   <li><strong>Ordering:</strong> ranges are sorted by gateway id so floating-point
 *       accumulation, and therefore the result, is identical for identical input.</li>
 *   <li><strong>Method selection:</strong> {@link EstimationMethod#forGatewayCount(int)} picks
 *       circle intersection for two ranges and least squares for three or more. Fewer than two
 *       ranges yields {@link EstimationResult#insufficient()}.</li>
 * </ol>
 */
@Slf4j
@Component
public class PositionEstimator {

    private final Map<EstimationMethod, RangeLocalizationAlgorithm> algorithms =
            new EnumMap<>(EstimationMethod.class);
    private final double maxUsableDistance;

    @Autowired
    public PositionEstimator(List<RangeLocalizationAlgorithm> algorithms, PositioningProperties properties) {
        this(algorithms, properties.getEstimation().getMaxUsableDistance());
    }

    public PositionEstimator(List<RangeLocalizationAlgorithm> algorithms, double maxUsableDistance) {
        for (RangeLocalizationAlgorithm algorithm : algorithms) {
            if (this.algorithms.put(algorithm.method(), algorithm) != null) {
                throw new IllegalArgumentException("Duplicate algorithm for method " + algorithm.method());
            }
        }
        for (EstimationMethod method : EstimationMethod.values()) {
            if (!this.algorithms.containsKey(method)) {
                throw new IllegalArgumentException("No algorithm registered for method " + method);
            }
        }
        this.maxUsableDistance = maxUsableDistance;
    }

    /**
     * Estimates the position of a beacon.
     *
     * @param beaconId beacon being located
     * @param ranges gateway id to range; iteration order is irrelevant
     * @param computedAt tick time stamped on the estimate
     * @return the estimate with any recovered conditions, or an insufficient result
     */
    public EstimationResult estimate(String beaconId, Map<String, GatewayRange> ranges, Instant computedAt) {
        Optional<String> floorId = resolveFloor(ranges.values());
        if (floorId.isEmpty()) {
            return EstimationResult.insufficient();
        }

        List<GatewayRange> usable = usableRanges(ranges.values(), floorId.get());
        Optional<EstimationMethod> method = EstimationMethod.forGatewayCount(usable.size());
        if (method.isEmpty()) {
            log.debug("Beacon {} has {} usable gateway range(s), cannot locate", beaconId, usable.size());
            return EstimationResult.insufficient();
        }

        RangeSolution solution = algorithms.get(method.get()).solve(usable);
        if (!solution.point().isFinite()) {
            log.warn("Beacon {} produced a non-finite {} solution, skipping", beaconId, method.get().getLabel());
            return new EstimationResult(null,
                    EnumSet.of(RecoveredCondition.INSUFFICIENT_GATEWAYS, RecoveredCondition.DEGENERATE_GEOMETRY));
        }
        PositionEstimate estimate = new PositionEstimate(beaconId, floorId.get(), solution.point().x(),
                solution.point().y(), solution.accuracyRadius(), method.get(), computedAt);
        return new EstimationResult(estimate, solution.conditions());
    }

    private Optional<String> resolveFloor(Iterable<GatewayRange> ranges) {
        Map<String, FloorTally> tallies = new TreeMap<>();
        for (GatewayRange range : ranges) {
            tallies.computeIfAbsent(range.floorId(), FloorTally::new).add(range.distance());
        }
        return tallies.values().stream()
                .min(Comparator.comparingInt((FloorTally t) -> -t.count)
                        .thenComparingDouble(FloorTally::meanDistance)
                        .thenComparing(t -> t.floorId))
                .map(t -> t.floorId);
    }

    private List<GatewayRange> usableRanges(Iterable<GatewayRange> ranges, String floorId) {
        List<GatewayRange> onFloor = new ArrayList<>();
        for (GatewayRange range : ranges) {
            if (floorId.equals(range.floorId())) {
                onFloor.add(range);
            }
        }
        onFloor.sort(Comparator.comparing(GatewayRange::gatewayId));

        List<GatewayRange> withinReach = new ArrayList<>(onFloor.size());
        for (GatewayRange range : onFloor) {
            if (range.distance() <= maxUsableDistance) {
                withinReach.add(range);
            }
        }
        return withinReach.isEmpty() ? onFloor : withinReach;
    }

    private static final class FloorTally {
        private final String floorId;
        private int count;
        private double totalDistance;

        private FloorTally(String floorId) {
            this.floorId = floorId;
        }

        private void add(double distance) {
            count++;
            totalDistance += distance;
        }

        private double meanDistance() {
            return totalDistance / count;
        }
    }
}
