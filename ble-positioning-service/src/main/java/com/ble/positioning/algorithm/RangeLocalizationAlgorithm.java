package com.ble.positioning.algorithm;

import com.ble.positioning.model.EstimationMethod;
import java.util.List;

/**
 * Computes a 2-D position from gateway ranges.
 *
 * <p>Implementations receive the ranges already filtered to one floor and sorted by gateway id.
 * They must not depend on any other ordering, so the same input always yields the same output.
 * Geometric trouble is reported through {@link RangeSolution#conditions()}, never thrown.</p>
 */
public interface RangeLocalizationAlgorithm {

    /** The method this algorithm implements; the estimator dispatches on it. */
    EstimationMethod method();

    /**
     * @param ranges at least as many ranges as {@link #method()} requires
     * @return best position found, never null
     */
    RangeSolution solve(List<GatewayRange> ranges);
}
