package com.ble.positioning.algorithm;

import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RecoveredCondition;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of {@link PositionEstimator#estimate}: an estimate, or none when the data was
 * insufficient, plus every recovered condition met on the way.
 */
public record EstimationResult(PositionEstimate estimate, Set<RecoveredCondition> conditions) {

    public EstimationResult {
        conditions = Set.copyOf(conditions);
    }

    public static EstimationResult insufficient() {
        return new EstimationResult(null, Set.of(RecoveredCondition.INSUFFICIENT_GATEWAYS));
    }

    public boolean isInsufficient() {
        return estimate == null;
    }

    public Optional<PositionEstimate> position() {
        return Optional.ofNullable(estimate);
    }

    public boolean has(RecoveredCondition condition) {
        return conditions.contains(condition);
    }
}
