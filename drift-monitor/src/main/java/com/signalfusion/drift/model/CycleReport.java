package com.signalfusion.drift.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Summary of one pass over the active set. */
public record CycleReport(
    String cycleId,
    int checked,
    int unchanged,
    int drifted,
    int stale,
    int failed,
    List<DriftAlert> alerts,
    Instant startedAt,
    Instant completedAt
) {
    public CycleReport {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }
}
