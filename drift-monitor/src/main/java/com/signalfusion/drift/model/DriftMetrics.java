package com.signalfusion.drift.model;

/**
 * Relative changes against the baseline. Sentiment is the absolute difference over 2 so that a
 * full swing from -1 to 1 reads as 1.0.
 */
public record DriftMetrics(
    double price,
    double volume,
    double volatility,
    double sentiment,
    double composite
) {
    public static final DriftMetrics ZERO = new DriftMetrics(0.0, 0.0, 0.0, 0.0, 0.0);
}
