package com.signalfusion.drift.calculator;

/**
 * Per-metric trigger levels plus the composite bands.
 *
 * @param sentimentFlipFloor minimum magnitude both readings need before a sign change counts as a flip
 */
public record DriftThresholds(
    double price,
    double volume,
    double volatility,
    double sentiment,
    double compositeMedium,
    double compositeHigh,
    double sentimentFlipFloor
) {
    public DriftThresholds {
        if (compositeHigh < compositeMedium) {
            throw new IllegalArgumentException(
                "composite high threshold " + compositeHigh + " is below medium " + compositeMedium);
        }
    }

    public static DriftThresholds defaults() {
        return new DriftThresholds(0.05, 0.50, 0.30, 0.20, 0.15, 0.25, 0.05);
    }
}
