package com.signalfusion.drift.model;

import java.time.Instant;

public record DriftAlert(
    String alertId,
    String analysisId,
    String symbol,
    DriftSeverity severity,
    Instant triggeredAt,
    String reason,
    String recommendation,
    DriftMetrics metrics
) {}
