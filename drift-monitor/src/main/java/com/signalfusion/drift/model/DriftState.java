package com.signalfusion.drift.model;

/**
 * Per-analysis monitoring state.
 *
 * <pre>
 *   ACTIVE ──check──▶ UNCHANGED | DRIFTED
 *   any    ──past monitoring window──▶ STALE (dropped from the active set)
 * </pre>
 */
public enum DriftState {
    ACTIVE,
    UNCHANGED,
    DRIFTED,
    STALE;

    public boolean isTerminal() {
        return this == STALE;
    }
}
