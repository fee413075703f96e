package com.ble.positioning.algorithm.impl;

import com.ble.positioning.algorithm.GatewayRange;
import com.ble.positioning.algorithm.RangeLocalizationAlgorithm;
import com.ble.positioning.algorithm.RangeSolution;
import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.RecoveredCondition;
import java.util.List;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Position from exactly two gateway ranges by circle intersection.
 *
 * <p>ALGORITHM OVERVIEW:</p>
 * <ol>
 *   <li>Let D be the gateway separation and r₁, r₂ the ranges</li>
 *   <li>If |r₁ - r₂| ≤ D ≤ r₁ + r₂ the circles meet. Distance from G₁ to the chord:
 *       a = (r₁² - r₂² + D²) / (2D), half chord h = √(r₁² - a²). The estimate is the chord
 *       midpoint G₁ + a·(G₂ - G₁)/D and the accuracy radius is h: the true position is one of the
 *       two intersection points and the midpoint is h away from both.</li>
 *   <li>Otherwise the circles are disjoint or nested. The estimate falls back to the point on
 *       the gateway line weighted inversely by range, (r₂·G₁ + r₁·G₂) / (r₁ + r₂), and the
 *       accuracy radius is the range mismatch inflated by the degraded-accuracy factor.</li>
 * </ol>
 *
 * <p>Two ranges only constrain the beacon along the gateway axis, so the result is always a
 * best-effort estimate; the accuracy radius carries that uncertainty.</p>
 */
@Component
public class TwoCircleIntersectionAlgorithm implements RangeLocalizationAlgorithm {

    private final double minAccuracy;
    private final double degradedAccuracyFactor;

    @Autowired
    public TwoCircleIntersectionAlgorithm(PositioningProperties properties) {
        this(properties.getEstimation().getMinAccuracy(), properties.getEstimation().getDegradedAccuracyFactor());
    }

    public TwoCircleIntersectionAlgorithm(double minAccuracy, double degradedAccuracyFactor) {
        this.minAccuracy = minAccuracy;
        this.degradedAccuracyFactor = degradedAccuracyFactor;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.TWO_POINT;
    }

    @Override
    public RangeSolution solve(List<GatewayRange> ranges) {
        if (ranges.size() != 2) {
            throw new IllegalArgumentException("Circle intersection needs exactly 2 ranges, got " + ranges.size());
        }
        Point g1 = ranges.get(0).position();
        Point g2 = ranges.get(1).position();
        double r1 = ranges.get(0).distance();
        double r2 = ranges.get(1).distance();
        double separation = g1.distanceTo(g2);

        if (separation == 0) {
            // Co-located gateways carry no directional information at all.
            return new RangeSolution(g1, degradedAccuracyFactor * Math.max(minAccuracy, Math.max(r1, r2)),
                    Set.of(RecoveredCondition.DEGENERATE_GEOMETRY));
        }

        double ux = (g2.x() - g1.x()) / separation;
        double uy = (g2.y() - g1.y()) / separation;

        boolean disjoint = separation > r1 + r2;
        boolean nested = separation < Math.abs(r1 - r2);
        if (disjoint || nested) {
            double along = separation * r1 / (r1 + r2);
            Point fallback = new Point(g1.x() + along * ux, g1.y() + along * uy);
            double mismatch = disjoint ? separation - (r1 + r2) : Math.abs(r1 - r2) - separation;
            double accuracy = degradedAccuracyFactor * Math.max(minAccuracy, mismatch);
            return new RangeSolution(fallback, accuracy, Set.of(RecoveredCondition.DEGENERATE_GEOMETRY));
        }

        double a = (r1 * r1 - r2 * r2 + separation * separation) / (2.0 * separation);
        double halfChord = Math.sqrt(Math.max(0.0, r1 * r1 - a * a));
        Point midpoint = new Point(g1.x() + a * ux, g1.y() + a * uy);
        return new RangeSolution(midpoint, Math.max(minAccuracy, halfChord), Set.of());
    }
}
