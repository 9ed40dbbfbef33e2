package com.signalfusion.common.lineage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-request provenance collector.
 *
 * <p>Keeps one current {@link LineageRecord} per field (the latest write wins) and an append-only
 * history of every write, so a field that merging overwrote still shows where its earlier value
 * came from. A tracker instance belongs to one request; {@link #reset()} starts the next one.
 *
 * <p>Methods are synchronized: specialists may report from different threads while the
 * orchestrator merges.
 */
public class LineageTracker {

    private final Clock clock;
    private final Map<String, LineageRecord> current = new LinkedHashMap<>();
    private final List<LineageRecord> history = new ArrayList<>();

    public LineageTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LineageTracker() {
        this(Clock.systemUTC());
    }

    // ── recording ─────────────────────────────────────────────────────────────

    public synchronized LineageRecord track(String field, Object value, DataSource source,
                                            DataReliability reliability, double confidence,
                                            Instant dataTimestamp, boolean cacheHit, String citation) {
        Instant now = clock.instant();
        LineageRecord record = new LineageRecord(
            field, value, source, reliability,
            Math.max(0.0, Math.min(1.0, confidence)),
            dataTimestamp, DataFreshness.classify(dataTimestamp, now),
            cacheHit, citation, now);
        current.put(field, record);
        history.add(record);
        return record;
    }

    /**
     * Records a value derived from other tracked fields. Reliability is the weakest among the
     * inputs that are tracked (MEDIUM when none are); the data timestamp is the oldest input's.
     */
    public synchronized LineageRecord trackCalculated(String field, Object value,
                                                      Collection<String> inputFields, double confidence) {
        DataReliability reliability = null;
        Instant oldest = null;
        for (String input : inputFields) {
            LineageRecord upstream = current.get(input);
            if (upstream == null) continue;
            reliability = reliability == null ? upstream.reliability()
                                              : DataReliability.weakest(reliability, upstream.reliability());
            Instant ts = upstream.dataTimestamp();
            if (ts != null && (oldest == null || ts.isBefore(oldest))) oldest = ts;
        }
        return track(field, value, DataSource.CALCULATED,
                     reliability != null ? reliability : DataReliability.MEDIUM,
                     confidence, oldest != null ? oldest : clock.instant(), false,
                     "derived from " + String.join(", ", inputFields));
    }

    /** Records model-generated text; reliability follows the model's confidence. */
    public synchronized LineageRecord trackGenerated(String field, Object value, String model, double confidence) {
        DataReliability reliability = confidence >= 0.7 ? DataReliability.MEDIUM : DataReliability.LOW;
        return track(field, value, DataSource.LLM, reliability, confidence, clock.instant(), false, model);
    }

    /** Clears everything; call at the start of each new request. */
    public synchronized void reset() {
        current.clear();
        history.clear();
    }

    // ── reading ───────────────────────────────────────────────────────────────

    public synchronized LineageRecord get(String field) {
        return current.get(field);
    }

    /** Latest record per field, in first-write order. */
    public synchronized Map<String, LineageRecord> records() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(current));
    }

    /** Every write, oldest first, including overwritten ones. */
    public synchronized List<LineageRecord> history() {
        return List.copyOf(history);
    }

    /** Distinct non-blank citations of the current records, in first-seen order. */
    public synchronized List<String> citations() {
        Set<String> seen = new LinkedHashSet<>();
        for (LineageRecord r : current.values()) {
            if (r.citation() != null && !r.citation().isBlank()) seen.add(r.citation());
        }
        return List.copyOf(seen);
    }

    public synchronized LineageSummary summary() {
        Map<DataSource, Long> bySource = new EnumMap<>(DataSource.class);
        Map<DataFreshness, Long> byFreshness = new EnumMap<>(DataFreshness.class);
        Map<DataReliability, Long> byReliability = new EnumMap<>(DataReliability.class);
        long cacheHits = 0;
        double confidenceSum = 0.0;
        double qualitySum = 0.0;

        for (LineageRecord r : current.values()) {
            bySource.merge(r.source(), 1L, Long::sum);
            byFreshness.merge(r.freshness(), 1L, Long::sum);
            byReliability.merge(r.reliability(), 1L, Long::sum);
            if (r.cacheHit()) cacheHits++;
            confidenceSum += r.confidence();
            qualitySum += r.qualityScore();
        }

        int n = current.size();
        return new LineageSummary(
            n, bySource, byFreshness, byReliability,
            n == 0 ? 0.0 : (double) cacheHits / n,
            n == 0 ? 0.0 : confidenceSum / n,
            n == 0 ? 0.0 : qualitySum / n,
            citations());
    }
}
