package com.signalfusion.drift.model;

import java.time.Instant;

/**
 * Point-in-time market view used both as the baseline recorded at analysis completion and as
 * the current observation of each check.
 *
 * @param volatility relative volatility (stddev / mean), null when unknown
 * @param sentiment  sentiment in [-1, 1], null when unknown
 */
public record MarketSnapshot(
    String symbol,
    double price,
    long volume,
    Double volatility,
    Double sentiment,
    Instant observedAt
) {
    public MarketSnapshot {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (price <= 0.0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("volume must not be negative: " + volume);
        }
        if (sentiment != null) {
            sentiment = Math.max(-1.0, Math.min(1.0, sentiment));
        }
    }
}
