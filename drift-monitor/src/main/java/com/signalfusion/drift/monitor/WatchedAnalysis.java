package com.signalfusion.drift.monitor;

import com.signalfusion.drift.model.DriftAlert;
import com.signalfusion.drift.model.DriftAssessment;
import com.signalfusion.drift.model.DriftMetrics;
import com.signalfusion.drift.model.DriftSeverity;
import com.signalfusion.drift.model.DriftState;
import com.signalfusion.drift.model.DriftStatus;
import com.signalfusion.drift.model.MonitoredAnalysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable monitoring state of one analysis. All access is synchronized on the instance, so a
 * manual check and the background loop may touch the same analysis concurrently.
 */
class WatchedAnalysis {

    private static final int MAX_ALERTS_KEPT = 10;

    private final MonitoredAnalysis analysis;
    private final List<DriftAlert> alerts = new ArrayList<>();

    private DriftState state = DriftState.ACTIVE;
    private DriftSeverity severity;
    private DriftSeverity alertedSeverity;
    private DriftMetrics lastMetrics = DriftMetrics.ZERO;
    private Instant lastCheckedAt;
    private int checks;
    private int consecutiveFailures;

    WatchedAnalysis(MonitoredAnalysis analysis) {
        this.analysis = analysis;
    }

    MonitoredAnalysis analysis() {
        return analysis;
    }

    synchronized DriftState state() {
        return state;
    }

    /**
     * Records a successful check.
     *
     * @return true when an alert is due: the analysis just entered DRIFTED, or its severity rose
     *         above the highest severity already alerted during the current drift episode
     */
    synchronized boolean apply(DriftAssessment assessment, Instant checkedAt) {
        state = assessment.state();
        severity = assessment.severity();
        lastMetrics = assessment.metrics();
        lastCheckedAt = checkedAt;
        checks++;
        consecutiveFailures = 0;

        if (!assessment.drifted()) {
            alertedSeverity = null;
            return false;
        }
        if (alertedSeverity == null || !alertedSeverity.isAtLeast(severity)) {
            alertedSeverity = severity;
            return true;
        }
        return false;
    }

    synchronized void recordAlert(DriftAlert alert) {
        alerts.add(0, alert);
        if (alerts.size() > MAX_ALERTS_KEPT) {
            alerts.remove(alerts.size() - 1);
        }
    }

    synchronized int recordFailure() {
        return ++consecutiveFailures;
    }

    synchronized void markStale(Instant at) {
        state = DriftState.STALE;
        lastCheckedAt = at;
    }

    synchronized DriftStatus status() {
        boolean reanalysis = state == DriftState.DRIFTED
            && severity != null && severity.isAtLeast(DriftSeverity.MEDIUM);
        return new DriftStatus(analysis.analysisId(), analysis.symbol(), state, severity, lastMetrics,
                               lastCheckedAt, checks, consecutiveFailures, reanalysis, alerts);
    }
}
