package com.ble.positioning.algorithm.impl;

import com.ble.positioning.algorithm.GatewayRange;
import com.ble.positioning.algorithm.RangeLocalizationAlgorithm;
import com.ble.positioning.algorithm.RangeSolution;
import com.ble.positioning.algorithm.util.PlanarGeometry;
import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.RecoveredCondition;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Weighted non-linear least squares multilateration for three or more gateway ranges.
 *
 * <p>MATHEMATICAL FOUNDATION:</p>
 * <pre>
 *   minimise  S(P) = Σ wᵢ (‖P - Gᵢ‖ - dᵢ)²      with wᵢ = 1 / dᵢ²
 * </pre>
 * Closer gateways produce more reliable ranges, so they dominate the fit.
 *
 * <p>ALGORITHM OVERVIEW:</p>
 * <ol>
 *   <li>Start from the inverse-distance weighted centroid Σ(Gᵢ/dᵢ) / Σ(1/dᵢ)</li>
 *   <li>Per iteration, with residuals rᵢ = ‖P - Gᵢ‖ - dᵢ and Jacobian rows
 *       Jᵢ = (P - Gᵢ)ᵀ / ‖P - Gᵢ‖, solve the damped normal equations
 *       (JᵀWJ + λμI)·δ = -JᵀW·r with an LU decomposition</li>
 *   <li>Accept the step if S decreases (λ shrinks), otherwise reject it (λ grows)</li>
 *   <li>Stop when an accepted step is shorter than epsilon or the iteration cap is hit; the best
 *       iterate seen is returned either way</li>
 * </ol>
 *
 * <p>The accuracy radius is the RMS of the unweighted range residuals at the solution, floored at
 * the configured minimum. It is multiplied by the degraded-accuracy factor when the iteration
 * cap was hit ({@link RecoveredCondition#NON_CONVERGENCE}) or the gateways are collinear
 * ({@link RecoveredCondition#DEGENERATE_GEOMETRY}); a collinear layout cannot tell the beacon
 * from its mirror image across the gateway line.</p>
 */
@Slf4j
@Component
public class WeightedLeastSquaresAlgorithm implements RangeLocalizationAlgorithm {

    // ============================================================================
    // DAMPING CONSTANTS
    // ============================================================================

    private static final double INITIAL_DAMPING = 1e-3;
    private static final double DAMPING_DECREASE = 0.1;
    private static final double DAMPING_INCREASE = 10.0;
    /** Beyond this damping no step can lower the cost; the current iterate is a minimum. */
    private static final double MAX_DAMPING = 1e10;
    /** Below this distance to a gateway the Jacobian row is undefined and skipped. */
    private static final double SINGULAR_DISTANCE = 1e-9;

    private final int maxIterations;
    private final double epsilon;
    private final double minAccuracy;
    private final double degradedAccuracyFactor;

    @Autowired
    public WeightedLeastSquaresAlgorithm(PositioningProperties properties) {
        this(properties.getEstimation().getMaxIterations(),
                properties.getEstimation().getEpsilon(),
                properties.getEstimation().getMinAccuracy(),
                properties.getEstimation().getDegradedAccuracyFactor());
    }

    public WeightedLeastSquaresAlgorithm(int maxIterations, double epsilon, double minAccuracy,
            double degradedAccuracyFactor) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
        this.minAccuracy = minAccuracy;
        this.degradedAccuracyFactor = degradedAccuracyFactor;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.LEAST_SQUARES;
    }

    @Override
    public RangeSolution solve(List<GatewayRange> ranges) {
        if (ranges.size() < 3) {
            throw new IllegalArgumentException("Least squares needs at least 3 ranges, got " + ranges.size());
        }
        double[] x = new double[ranges.size()];
        double[] y = new double[ranges.size()];
        double[] d = new double[ranges.size()];
        double[] w = new double[ranges.size()];
        List<Point> positions = new ArrayList<>(ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            GatewayRange range = ranges.get(i);
            x[i] = range.position().x();
            y[i] = range.position().y();
            d[i] = range.distance();
            w[i] = 1.0 / (d[i] * d[i]);
            positions.add(range.position());
        }

        double[] current = initialGuess(x, y, d);
        double currentCost = cost(current, x, y, d, w);
        double damping = INITIAL_DAMPING;
        boolean converged = false;

        for (int iteration = 0; iteration < maxIterations && !converged; iteration++) {
            double[] step = dampedStep(current, x, y, d, w, damping);
            if (step == null) {
                // Iterate sits on every gateway at once; nothing left to improve.
                converged = true;
                break;
            }
            double[] candidate = {current[0] + step[0], current[1] + step[1]};
            double candidateCost = cost(candidate, x, y, d, w);
            if (candidateCost <= currentCost) {
                current = candidate;
                currentCost = candidateCost;
                damping = Math.max(damping * DAMPING_DECREASE, 1e-12);
                if (Math.hypot(step[0], step[1]) < epsilon) {
                    converged = true;
                }
            } else {
                damping *= DAMPING_INCREASE;
                if (damping > MAX_DAMPING) {
                    converged = true;
                }
            }
        }

        Set<RecoveredCondition> conditions = EnumSet.noneOf(RecoveredCondition.class);
        double accuracy = Math.max(minAccuracy, rmsResidual(current, x, y, d));
        if (!converged) {
            conditions.add(RecoveredCondition.NON_CONVERGENCE);
            log.debug("Least squares hit the {} iteration cap, using best iterate ({}, {})",
                    maxIterations, current[0], current[1]);
        }
        if (PlanarGeometry.isCollinear(positions, PlanarGeometry.DEFAULT_COLLINEARITY_TOLERANCE)) {
            conditions.add(RecoveredCondition.DEGENERATE_GEOMETRY);
        }
        if (!conditions.isEmpty()) {
            accuracy *= degradedAccuracyFactor;
        }
        return new RangeSolution(new Point(current[0], current[1]), accuracy, conditions);
    }

    private static double[] initialGuess(double[] x, double[] y, double[] d) {
        double sumWeights = 0;
        double px = 0;
        double py = 0;
        for (int i = 0; i < x.length; i++) {
            double weight = 1.0 / d[i];
            px += weight * x[i];
            py += weight * y[i];
            sumWeights += weight;
        }
        return new double[] {px / sumWeights, py / sumWeights};
    }

    private static double[] dampedStep(double[] p, double[] x, double[] y, double[] d, double[] w,
            double damping) {
        double a00 = 0;
        double a01 = 0;
        double a11 = 0;
        double b0 = 0;
        double b1 = 0;
        for (int i = 0; i < x.length; i++) {
            double dx = p[0] - x[i];
            double dy = p[1] - y[i];
            double range = Math.hypot(dx, dy);
            if (range < SINGULAR_DISTANCE) {
                continue;
            }
            double jx = dx / range;
            double jy = dy / range;
            double residual = range - d[i];
            a00 += w[i] * jx * jx;
            a01 += w[i] * jx * jy;
            a11 += w[i] * jy * jy;
            b0 -= w[i] * jx * residual;
            b1 -= w[i] * jy * residual;
        }
        double scale = (a00 + a11) / 2.0;
        if (scale <= 0) {
            return null;
        }
        RealMatrix normal = new Array2DRowRealMatrix(new double[][] {
            {a00 + damping * scale, a01},
            {a01, a11 + damping * scale}
        });
        DecompositionSolver solver = new LUDecomposition(normal).getSolver();
        if (!solver.isNonSingular()) {
            return new double[] {0.0, 0.0};
        }
        RealVector delta = solver.solve(new ArrayRealVector(new double[] {b0, b1}));
        return delta.toArray();
    }

    private static double cost(double[] p, double[] x, double[] y, double[] d, double[] w) {
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            double residual = Math.hypot(p[0] - x[i], p[1] - y[i]) - d[i];
            sum += w[i] * residual * residual;
        }
        return sum;
    }

    private static double rmsResidual(double[] p, double[] x, double[] y, double[] d) {
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            double residual = Math.hypot(p[0] - x[i], p[1] - y[i]) - d[i];
            sum += residual * residual;
        }
        return Math.sqrt(sum / x.length);
    }
}
