package com.signalfusion.common.risk;

import java.util.Map;

/**
 * Result of {@link PositionSizer#recommend}: every method's sizing (capped to the
 * max-position percentage), its expected-value score, and the selected method.
 */
public record SizingRecommendation(
    Map<SizingMethod, PositionSizeResult> results,
    Map<SizingMethod, Double> expectedValues,
    SizingMethod recommendedMethod,
    Double riskReward,
    String reasoning
) {
    public PositionSizeResult recommended() {
        return results.get(recommendedMethod);
    }
}
