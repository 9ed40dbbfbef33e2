package com.signalfusion.drift.model;

import java.time.Instant;
import java.util.List;

/**
 * Read view of one watched analysis.
 *
 * @param severity      severity of the latest assessment, null before the first check
 * @param lastCheckedAt null before the first check
 */
public record DriftStatus(
    String analysisId,
    String symbol,
    DriftState state,
    DriftSeverity severity,
    DriftMetrics lastMetrics,
    Instant lastCheckedAt,
    int checks,
    int consecutiveFailures,
    boolean requiresReanalysis,
    List<DriftAlert> alerts
) {
    public DriftStatus {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
    }
}
