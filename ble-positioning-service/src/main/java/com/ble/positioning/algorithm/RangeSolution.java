package com.ble.positioning.algorithm;

import com.ble.positioning.model.Point;
import com.ble.positioning.model.RecoveredCondition;
import java.util.Set;

/**
 * Output of a {@link RangeLocalizationAlgorithm}: a point, its accuracy radius and the recovered
 * conditions met while computing it.
 */
public record RangeSolution(Point point, double accuracyRadius, Set<RecoveredCondition> conditions) {

    public RangeSolution {
        conditions = Set.copyOf(conditions);
    }

    public boolean isDegraded() {
        return !conditions.isEmpty();
    }
}
