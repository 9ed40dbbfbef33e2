package com.signalfusion.common.lineage;

import java.time.Instant;

/**
 * Provenance of one emitted field.
 *
 * @param fieldName     output field, e.g. {@code stop_loss}
 * @param value         the value as emitted
 * @param source        producing source
 * @param reliability   trust tier
 * @param confidence    confidence in [0, 1]
 * @param dataTimestamp when the underlying data was observed, or null if unknown
 * @param freshness     age bucket at record time
 * @param cacheHit      true when the value was served from the response cache
 * @param citation      source reference, or null
 * @param recordedAt    when the tracker recorded it
 */
public record LineageRecord(
    String fieldName,
    Object value,
    DataSource source,
    DataReliability reliability,
    double confidence,
    Instant dataTimestamp,
    DataFreshness freshness,
    boolean cacheHit,
    String citation,
    Instant recordedAt
) {
    /** 0–100: reliability points + freshness points + confidence × 20, capped. */
    public double qualityScore() {
        double score = reliability.points() + freshness.points() + confidence * 20.0;
        return Math.min(100.0, score);
    }
}
