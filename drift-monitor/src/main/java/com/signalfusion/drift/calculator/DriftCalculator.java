package com.signalfusion.drift.calculator;

import com.signalfusion.drift.model.DriftAssessment;
import com.signalfusion.drift.model.DriftMetrics;
import com.signalfusion.drift.model.DriftSeverity;
import com.signalfusion.drift.model.MarketSnapshot;
import com.signalfusion.drift.model.MonitoredAnalysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares a current {@link MarketSnapshot} with the baseline recorded for a
 * {@link MonitoredAnalysis}.
 *
 * <h3>Metrics</h3>
 * <pre>
 *   price      = |now − base| / base
 *   volume     = |now − base| / base           (0 when the baseline volume is 0)
 *   volatility = |now − base| / base           (0 when either side is unknown)
 *   sentiment  = |now − base| / 2              (0 when either side is unknown)
 *   composite  = 0.40·price + 0.25·volume + 0.20·volatility + 0.15·sentiment
 * </pre>
 *
 * <h3>Verdict</h3>
 * DRIFTED when the price left the original stop/target band, sentiment flipped sign, any
 * metric exceeded its threshold, or the composite reached the medium band. Severity is HIGH
 * on a band breach or a composite in the high band, MEDIUM on a sentiment flip or a
 * composite in the medium band, LOW otherwise.
 *
 * <p>Pure and stateless; safe to share.
 */
public class DriftCalculator {

    static final double PRICE_WEIGHT      = 0.40;
    static final double VOLUME_WEIGHT     = 0.25;
    static final double VOLATILITY_WEIGHT = 0.20;
    static final double SENTIMENT_WEIGHT  = 0.15;

    private final DriftThresholds thresholds;

    public DriftCalculator(DriftThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public DriftCalculator() {
        this(DriftThresholds.defaults());
    }

    public DriftThresholds thresholds() {
        return thresholds;
    }

    public DriftMetrics metrics(MarketSnapshot baseline, MarketSnapshot current) {
        double price = relative(current.price(), baseline.price());
        double volume = baseline.volume() > 0 ? relative(current.volume(), baseline.volume()) : 0.0;
        double volatility = baseline.volatility() != null && current.volatility() != null
            && baseline.volatility() > 0.0
            ? relative(current.volatility(), baseline.volatility())
            : 0.0;
        double sentiment = baseline.sentiment() != null && current.sentiment() != null
            ? Math.abs(current.sentiment() - baseline.sentiment()) / 2.0
            : 0.0;
        double composite = PRICE_WEIGHT * price + VOLUME_WEIGHT * volume
                         + VOLATILITY_WEIGHT * volatility + SENTIMENT_WEIGHT * sentiment;
        return new DriftMetrics(price, volume, volatility, sentiment, composite);
    }

    public DriftAssessment assess(MonitoredAnalysis analysis, MarketSnapshot current) {
        MarketSnapshot baseline = analysis.baseline();
        DriftMetrics m = metrics(baseline, current);
        List<String> reasons = new ArrayList<>();

        boolean bandBreached = bandBreached(analysis, current.price());
        if (bandBreached) {
            reasons.add(String.format("price %.2f left the stop/target band [%.2f, %.2f]",
                                      current.price(),
                                      Math.min(analysis.stopLoss(), analysis.targetPrice()),
                                      Math.max(analysis.stopLoss(), analysis.targetPrice())));
        }

        boolean flipped = sentimentFlipped(baseline.sentiment(), current.sentiment());
        if (flipped) {
            reasons.add(String.format("sentiment flipped from %.2f to %.2f",
                                      baseline.sentiment(), current.sentiment()));
        }

        exceeded(reasons, "price", m.price(), thresholds.price());
        exceeded(reasons, "volume", m.volume(), thresholds.volume());
        exceeded(reasons, "volatility", m.volatility(), thresholds.volatility());
        exceeded(reasons, "sentiment", m.sentiment(), thresholds.sentiment());

        boolean compositeMedium = m.composite() >= thresholds.compositeMedium();
        boolean compositeHigh = m.composite() >= thresholds.compositeHigh();
        if (compositeMedium) {
            reasons.add(String.format("composite drift %.3f", m.composite()));
        }

        boolean drifted = !reasons.isEmpty();
        DriftSeverity severity;
        if (bandBreached || compositeHigh) {
            severity = DriftSeverity.HIGH;
        } else if (flipped || compositeMedium) {
            severity = DriftSeverity.MEDIUM;
        } else {
            severity = DriftSeverity.LOW;
        }
        return new DriftAssessment(m, drifted, severity, bandBreached, flipped, reasons);
    }

    private static boolean bandBreached(MonitoredAnalysis analysis, double price) {
        if (!analysis.hasBand()) return false;
        double low = Math.min(analysis.stopLoss(), analysis.targetPrice());
        double high = Math.max(analysis.stopLoss(), analysis.targetPrice());
        return price <= low || price >= high;
    }

    private boolean sentimentFlipped(Double before, Double now) {
        if (before == null || now == null) return false;
        double floor = thresholds.sentimentFlipFloor();
        return Math.abs(before) > floor && Math.abs(now) > floor && Math.signum(before) != Math.signum(now);
    }

    private static void exceeded(List<String> reasons, String metric, double value, double threshold) {
        if (value > threshold) {
            reasons.add(String.format("%s drift %.1f%% over %.0f%%", metric, value * 100, threshold * 100));
        }
    }

    private static double relative(double now, double base) {
        return Math.abs(now - base) / base;
    }
}
