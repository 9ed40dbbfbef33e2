package com.signalfusion.drift.model;

import java.util.List;

/**
 * Outcome of comparing one observation with its baseline.
 *
 * @param reasons human-readable triggers, empty when nothing drifted
 */
public record DriftAssessment(
    DriftMetrics metrics,
    boolean drifted,
    DriftSeverity severity,
    boolean bandBreached,
    boolean sentimentFlipped,
    List<String> reasons
) {
    public DriftAssessment {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public DriftState state() {
        return drifted ? DriftState.DRIFTED : DriftState.UNCHANGED;
    }

    public String reasonText() {
        return reasons.isEmpty() ? "no threshold breached" : String.join("; ", reasons);
    }
}
