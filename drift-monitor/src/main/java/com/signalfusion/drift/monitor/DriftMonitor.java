package com.signalfusion.drift.monitor;

import com.signalfusion.common.trace.TraceContextUtil;
import com.signalfusion.drift.alert.AlertSink;
import com.signalfusion.drift.calculator.DriftCalculator;
import com.signalfusion.drift.config.DriftProperties;
import com.signalfusion.drift.market.MarketSnapshotProvider;
import com.signalfusion.drift.model.CycleReport;
import com.signalfusion.drift.model.DriftAlert;
import com.signalfusion.drift.model.DriftAssessment;
import com.signalfusion.drift.model.DriftSeverity;
import com.signalfusion.drift.model.DriftState;
import com.signalfusion.drift.model.DriftStatus;
import com.signalfusion.drift.model.MarketSnapshot;
import com.signalfusion.drift.model.MonitoredAnalysis;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background watcher of completed recommendations.
 *
 * <p>Each cycle walks the active set sequentially:
 * <pre>
 *   past monitoring window → STALE, dropped from the active set
 *   snapshot → assess vs baseline → UNCHANGED | DRIFTED (+ alert on entry or escalation)
 *   snapshot missing or check failed → state kept, failure counted, retried next cycle
 * </pre>
 *
 * <p>The loop follows the recursive {@code Mono.delay → work → subscribe → reschedule} shape:
 * each cycle is a fresh pipeline and a failed cycle is logged and rescheduled, never
 * propagated. {@link #start()} and {@link #stop()} may be called at any time; a generation
 * counter keeps a stopped loop from rescheduling after a restart.
 *
 * <p>{@link #stop()} only cancels the pending delay. A cycle already in flight runs to
 * completion so no check is abandoned half-way. At most one cycle runs at a time: a
 * {@link #runCheckCycle()} issued while another cycle is in flight joins that cycle and
 * receives its report.
 */
public class DriftMonitor {

    private static final Logger log = LoggerFactory.getLogger(DriftMonitor.class);

    private final DriftCalculator calculator;
    private final MarketSnapshotProvider snapshotProvider;
    private final AlertSink alertSink;
    private final Clock clock;
    private final Scheduler scheduler;
    private final Duration checkInterval;
    private final Duration monitoringWindow;
    private final boolean autoStart;

    private final Map<String, WatchedAnalysis> watched = new ConcurrentHashMap<>();

    private boolean running;
    private long generation;
    private Disposable pendingDelay;

    // guarded by this
    private Mono<CycleReport> inFlight;
    private long cycleSequence;

    public DriftMonitor(DriftCalculator calculator,
                        MarketSnapshotProvider snapshotProvider,
                        AlertSink alertSink,
                        DriftProperties properties,
                        Clock clock,
                        Scheduler scheduler) {
        this.calculator       = calculator;
        this.snapshotProvider = snapshotProvider;
        this.alertSink        = alertSink;
        this.clock            = clock;
        this.scheduler        = scheduler;
        this.checkInterval    = properties.getCheckInterval();
        this.monitoringWindow = properties.getMonitoringWindow();
        this.autoStart        = properties.isAutoStart();
    }

    @PostConstruct
    public void init() {
        if (autoStart) {
            start();
        } else {
            log.info("DRIFT_MONITOR_IDLE autoStart=false");
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // ── registration ──────────────────────────────────────────────────────────

    /** Starts (or restarts) watching an analysis; any earlier state for the same id is replaced. */
    public DriftStatus watch(MonitoredAnalysis analysis) {
        WatchedAnalysis w = new WatchedAnalysis(analysis);
        watched.put(analysis.analysisId(), w);
        log.info("DRIFT_WATCH_REGISTERED analysisId={} symbol={} action={} completedAt={}",
                 analysis.analysisId(), analysis.symbol(), analysis.action(), analysis.completedAt());
        return w.status();
    }

    public boolean unwatch(String analysisId) {
        boolean removed = watched.remove(analysisId) != null;
        if (removed) {
            log.info("DRIFT_WATCH_REMOVED analysisId={}", analysisId);
        }
        return removed;
    }

    public Optional<DriftStatus> status(String analysisId) {
        return Optional.ofNullable(watched.get(analysisId)).map(WatchedAnalysis::status);
    }

    /** True when the analysis drifted with at least MEDIUM severity on its latest check. */
    public boolean requiresReanalysis(String analysisId) {
        return status(analysisId).map(DriftStatus::requiresReanalysis).orElse(false);
    }

    public int activeCount() {
        return (int) watched.values().stream().filter(w -> !w.state().isTerminal()).count();
    }

    // ── loop control ──────────────────────────────────────────────────────────

    /** @return false when the loop was already running */
    public synchronized boolean start() {
        if (running) {
            log.warn("DRIFT_MONITOR_ALREADY_RUNNING");
            return false;
        }
        running = true;
        generation++;
        log.info("DRIFT_MONITOR_STARTED intervalSeconds={} windowHours={}",
                 checkInterval.toSeconds(), monitoringWindow.toHours());
        scheduleNextCycle(generation);
        return true;
    }

    /** @return false when the loop was not running */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        generation++;
        if (pendingDelay != null) {
            pendingDelay.dispose();
            pendingDelay = null;
        }
        log.info("DRIFT_MONITOR_STOPPED active={} cycleInFlight={}", activeCount(), inFlight != null);
        return true;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private synchronized void scheduleNextCycle(long cycleGeneration) {
        if (!running || generation != cycleGeneration) {
            return;
        }
        pendingDelay = Mono.delay(checkInterval, scheduler)
            .subscribe(tick -> runScheduledCycle(cycleGeneration));
    }

    // Not tracked in pendingDelay: an in-flight cycle outlives stop().
    private void runScheduledCycle(long cycleGeneration) {
        runCheckCycle().subscribe(
            report -> scheduleNextCycle(cycleGeneration),
            err -> {
                log.error("DRIFT_CYCLE_FAILED rescheduling in {}s", checkInterval.toSeconds(), err);
                scheduleNextCycle(cycleGeneration);
            }
        );
    }

    // ── check cycle ───────────────────────────────────────────────────────────

    /**
     * One pass over the active set. Individual check failures never fail the cycle.
     * When a cycle is already in flight the returned Mono joins it instead of starting another.
     */
    public Mono<CycleReport> runCheckCycle() {
        return Mono.defer(this::joinOrStartCycle);
    }

    private synchronized Mono<CycleReport> joinOrStartCycle() {
        if (inFlight != null) {
            log.info("DRIFT_CYCLE_JOINED joining the cycle already in flight");
            return inFlight;
        }
        long sequence = ++cycleSequence;
        inFlight = executeCycle()
            .doFinally(signal -> clearInFlight(sequence))
            .cache();
        return inFlight;
    }

    private synchronized void clearInFlight(long sequence) {
        if (cycleSequence == sequence) {
            inFlight = null;
        }
    }

    private Mono<CycleReport> executeCycle() {
        return Mono.defer(() -> {
            String cycleId = TraceContextUtil.newTraceId();
            Instant startedAt = clock.instant();
            List<WatchedAnalysis> active = watched.values().stream()
                .filter(w -> !w.state().isTerminal())
                .sorted(Comparator.comparing(w -> w.analysis().analysisId()))
                .toList();
            log.info("DRIFT_CYCLE_STARTED cycleId={} active={}", cycleId, active.size());

            return Flux.fromIterable(active)
                .concatMap(w -> check(w, cycleId))
                .collectList()
                .map(outcomes -> summarize(cycleId, outcomes, startedAt));
        });
    }

    private Mono<CheckOutcome> check(WatchedAnalysis w, String cycleId) {
        MonitoredAnalysis analysis = w.analysis();
        Instant now = clock.instant();
        if (now.isAfter(analysis.completedAt().plus(monitoringWindow))) {
            w.markStale(now);
            TraceContextUtil.withMdc(cycleId, analysis.symbol(), () ->
                log.info("DRIFT_STALE analysisId={} completedAt={}", analysis.analysisId(), analysis.completedAt()));
            return Mono.just(CheckOutcome.of(DriftState.STALE, null));
        }

        return Mono.defer(() -> snapshotProvider.snapshot(analysis.symbol()))
            .map(snapshot -> evaluate(w, snapshot, cycleId))
            .switchIfEmpty(Mono.fromSupplier(() -> failed(w, cycleId, "no market snapshot")))
            .onErrorResume(e -> Mono.just(failed(w, cycleId, e.getMessage())));
    }

    private CheckOutcome evaluate(WatchedAnalysis w, MarketSnapshot snapshot, String cycleId) {
        MonitoredAnalysis analysis = w.analysis();
        DriftAssessment assessment = calculator.assess(analysis, snapshot);
        Instant now = clock.instant();
        boolean alertDue = w.apply(assessment, now);

        TraceContextUtil.withMdc(cycleId, analysis.symbol(), () ->
            log.info("DRIFT_CHECKED analysisId={} state={} severity={} composite={}",
                     analysis.analysisId(), assessment.state(), assessment.severity(),
                     String.format("%.3f", assessment.metrics().composite())));

        DriftAlert alert = null;
        if (alertDue) {
            DriftSeverity severity = assessment.severity();
            alert = new DriftAlert(UUID.randomUUID().toString(), analysis.analysisId(), analysis.symbol(),
                                   severity, now, assessment.reasonText(), severity.recommendation(),
                                   assessment.metrics());
            w.recordAlert(alert);
            emit(alert, cycleId);
        }
        return CheckOutcome.of(assessment.state(), alert);
    }

    private void emit(DriftAlert alert, String cycleId) {
        try {
            alertSink.emit(alert);
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(cycleId, alert.symbol(), () ->
                log.error("DRIFT_ALERT_SINK_FAILED analysisId={} alertId={}",
                          alert.analysisId(), alert.alertId(), e));
        }
    }

    private CheckOutcome failed(WatchedAnalysis w, String cycleId, String reason) {
        int failures = w.recordFailure();
        TraceContextUtil.withMdc(cycleId, w.analysis().symbol(), () ->
            log.warn("DRIFT_CHECK_FAILED analysisId={} consecutiveFailures={} reason={}",
                     w.analysis().analysisId(), failures, reason));
        return CheckOutcome.failure();
    }

    private CycleReport summarize(String cycleId, List<CheckOutcome> outcomes, Instant startedAt) {
        int unchanged = 0, drifted = 0, stale = 0, failed = 0;
        List<DriftAlert> alerts = new ArrayList<>();
        for (CheckOutcome o : outcomes) {
            if (o.failed()) {
                failed++;
                continue;
            }
            switch (o.state()) {
                case UNCHANGED -> unchanged++;
                case DRIFTED   -> drifted++;
                case STALE     -> stale++;
                default        -> { }
            }
            if (o.alert() != null) alerts.add(o.alert());
        }
        CycleReport report = new CycleReport(cycleId, outcomes.size(), unchanged, drifted, stale, failed,
                                             alerts, startedAt, clock.instant());
        log.info("DRIFT_CYCLE_COMPLETED cycleId={} checked={} unchanged={} drifted={} stale={} failed={} alerts={}",
                 cycleId, report.checked(), unchanged, drifted, stale, failed, alerts.size());
        return report;
    }

    private record CheckOutcome(DriftState state, DriftAlert alert, boolean failed) {

        static CheckOutcome of(DriftState state, DriftAlert alert) {
            return new CheckOutcome(state, alert, false);
        }

        static CheckOutcome failure() {
            return new CheckOutcome(null, null, true);
        }
    }
}
