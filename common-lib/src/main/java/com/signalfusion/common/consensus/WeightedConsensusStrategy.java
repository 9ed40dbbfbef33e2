package com.signalfusion.common.consensus;

import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.SpecialistContribution;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Confidence- and weight-blended consensus over the specialists that responded.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Read each specialist's signal via {@link SignalInterpreter} and map it to
 *       {@link Action#score()}: STRONG_BUY=+1.0, BUY=+0.5, HOLD=0, SELL=−0.5, STRONG_SELL=−1.0.</li>
 *   <li>Redistribute absent weight: {@code effective_i = w_i / Σ w(responding)}.</li>
 *   <li>{@code score = Σ(s_i × c_i × w_i) / Σ(c_i × w_i)} → [−1, +1].</li>
 *   <li>Risk adjustment (elevated risk only): positive score × 0.8; capped into HOLD when
 *       Sharpe &lt; 0.5 or max drawdown &gt; 30%.</li>
 *   <li>Band the score via {@link Action#fromScore(double)}.</li>
 * </ol>
 *
 * <h3>Confidence</h3>
 * <pre>
 *   0.4 × agreement + 0.4 × Σ(c_i × effective_i) + 0.2 × |score|
 *   × 0.7 when agreement &lt; 0.3, clamped to [0.1, 0.95]
 * </pre>
 *
 * <p>This class is stateless and thread-safe. It does NOT modify {@link SpecialistResult} instances.
 */
public class WeightedConsensusStrategy implements ConsensusEngine {

    private static final double HIGH_RISK_DAMPING      = 0.8;
    private static final double MIN_SHARPE             = 0.5;
    private static final double MAX_DRAWDOWN_PCT       = 30.0;
    private static final double HOLD_CAP               = 0.2;
    private static final double DISSENT_DIVERGENCE     = 0.5;
    private static final double LOW_AGREEMENT          = 0.3;
    private static final double LOW_AGREEMENT_PENALTY  = 0.7;
    private static final double MIN_CONFIDENCE         = 0.1;
    private static final double MAX_CONFIDENCE         = 0.95;

    private final ConsensusWeights weights;

    public WeightedConsensusStrategy(ConsensusWeights weights) {
        this.weights = weights;
    }

    public WeightedConsensusStrategy() {
        this(ConsensusWeights.defaults());
    }

    @Override
    public ConsensusResult compute(List<SpecialistResult> results, Set<SpecialistKind> requested) {
        // ── signals and static weights ──
        Map<SpecialistKind, SpecialistResult> byKind = new LinkedHashMap<>();
        for (SpecialistResult r : results) {
            byKind.put(r.kind(), r);
        }
        Map<SpecialistKind, Action> signals = new LinkedHashMap<>();
        double staticSum = 0.0;
        for (SpecialistResult r : byKind.values()) {
            signals.put(r.kind(), SignalInterpreter.interpret(r));
            staticSum += weights.weightOf(r.kind());
        }

        // ── weighted score ──
        double weightedSum = 0.0;
        double denominator = 0.0;
        for (SpecialistResult r : byKind.values()) {
            double w = weights.weightOf(r.kind());
            weightedSum += signals.get(r.kind()).score() * r.confidence() * w;
            denominator += r.confidence() * w;
        }
        double rawScore = denominator > 0.0 ? weightedSum / denominator : 0.0;

        Map<SpecialistKind, SpecialistContribution> contributions = new LinkedHashMap<>();
        double weightedConfidence = 0.0;
        for (SpecialistResult r : byKind.values()) {
            double w = weights.weightOf(r.kind());
            double effective = staticSum > 0.0 ? w / staticSum : 0.0;
            double share = denominator > 0.0
                ? signals.get(r.kind()).score() * r.confidence() * w / denominator : 0.0;
            contributions.put(r.kind(), new SpecialistContribution(
                r.kind(), signals.get(r.kind()), r.confidence(), w, effective, share));
            weightedConfidence += r.confidence() * effective;
        }

        // ── risk adjustment ──
        List<String> adjustments = new ArrayList<>();
        double score = applyRiskAdjustment(rawScore, byKind.get(SpecialistKind.RISK), adjustments);
        Action action = Action.fromScore(score);

        // ── agreement / dissent ──
        int agreeing = 0;
        List<SpecialistKind> dissenters = new ArrayList<>();
        for (Map.Entry<SpecialistKind, Action> e : signals.entrySet()) {
            if (e.getValue().direction() == action.direction()) agreeing++;
            if (Math.abs(e.getValue().score() - score) > DISSENT_DIVERGENCE) dissenters.add(e.getKey());
        }
        double agreement = signals.isEmpty() ? 0.0 : (double) agreeing / signals.size();

        double confidence = 0.4 * agreement + 0.4 * weightedConfidence + 0.2 * Math.abs(score);
        if (agreement < LOW_AGREEMENT) confidence *= LOW_AGREEMENT_PENALTY;
        confidence = Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));

        List<SpecialistKind> absent = new ArrayList<>();
        for (SpecialistKind kind : requested) {
            if (!byKind.containsKey(kind)) absent.add(kind);
        }

        String reasoning = String.format(
            "weighted score %.3f → %s; agreement %.0f%% of %d specialists%s%s%s",
            score, action, agreement * 100, signals.size(),
            dissenters.isEmpty() ? "" : "; dissent: " + dissenters,
            absent.isEmpty() ? "" : "; absent: " + absent,
            adjustments.isEmpty() ? "" : "; " + String.join("; ", adjustments));

        return new ConsensusResult(action, score, confidence, agreement, contributions,
                                   absent, dissenters, adjustments, reasoning);
    }

    private double applyRiskAdjustment(double score, SpecialistResult risk, List<String> adjustments) {
        RiskLevel level = SignalInterpreter.riskLevel(risk);
        if (level == null || !level.isElevated() || score <= 0.0) {
            return score;
        }
        double adjusted = score * HIGH_RISK_DAMPING;
        adjustments.add(String.format("%s risk: score %.3f × %.1f", level, score, HIGH_RISK_DAMPING));

        Double sharpe = ValueExtractor.firstNumber(risk.payload(), "sharpe_ratio", "sharpe");
        if (sharpe != null && sharpe < MIN_SHARPE && adjusted > HOLD_CAP) {
            adjustments.add(String.format("Sharpe %.2f < %.1f with %s risk: capped to HOLD", sharpe, MIN_SHARPE, level));
            adjusted = HOLD_CAP;
        }

        Double drawdown = ValueExtractor.firstNumber(risk.payload(), "max_drawdown", "max_drawdown_pct");
        if (drawdown != null) {
            double pct = Math.abs(drawdown) <= 1.0 ? Math.abs(drawdown) * 100.0 : Math.abs(drawdown);
            if (pct > MAX_DRAWDOWN_PCT && adjusted > HOLD_CAP) {
                adjustments.add(String.format("max drawdown %.1f%% > %.0f%% with %s risk: capped to HOLD",
                                              pct, MAX_DRAWDOWN_PCT, level));
                adjusted = HOLD_CAP;
            }
        }
        return adjusted;
    }
}
