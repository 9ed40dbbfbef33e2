package com.signalfusion.drift.model;

public enum DriftSeverity {

    LOW("Low priority. Normal market fluctuation."),
    MEDIUM("Monitor closely. Consider reanalysis if the move continues."),
    HIGH("Reanalysis strongly recommended. Significant market change detected.");

    private final String recommendation;

    DriftSeverity(String recommendation) {
        this.recommendation = recommendation;
    }

    /** Operator guidance attached to alerts of this severity. */
    public String recommendation() {
        return recommendation;
    }

    public boolean isAtLeast(DriftSeverity other) {
        return compareTo(other) >= 0;
    }
}
