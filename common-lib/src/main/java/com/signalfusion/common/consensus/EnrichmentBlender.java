package com.signalfusion.common.consensus;

import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.ConsensusBreakdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Second-pass re-weighting of a base consensus with news, retail and macro context.
 *
 * <h3>Adjustment</h3>
 * <pre>
 *   news   = sentiment × enrichmentScore
 *   retail = sentiment × 0.3   (divergence &gt; 0.5)
 *          = sentiment × 0.5   (otherwise)
 *   macro  = contextScore
 *   adjustment = mean(present parts), clamped to [-1, 1]
 * </pre>
 *
 * <h3>Blend</h3>
 * <pre>
 *   finalScore      = baseScore × baseWeight + adjustment × enrichmentWeight
 *   finalConfidence = baseConfidence × baseWeight + enrichmentConfidence × enrichmentWeight
 * </pre>
 * Weights are normalised to sum to 1. With no enrichment parts the base result passes through
 * with an enrichment weight of 0.
 */
public final class EnrichmentBlender {

    private static final double HIGH_DIVERGENCE          = 0.5;
    private static final double DIVERGENT_RETAIL_FACTOR  = 0.3;
    private static final double ALIGNED_RETAIL_FACTOR    = 0.5;
    private static final double DEFAULT_PART_CONFIDENCE  = 0.5;

    private EnrichmentBlender() {}

    public static BlendedConsensus blend(ConsensusResult base, EnrichmentContext context, ConsensusWeights weights) {
        if (context == null || context.isEmpty() || weights.enrichmentWeight() <= 0.0) {
            return passThrough(base);
        }

        List<Double> parts = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();
        List<String> applied = new ArrayList<>();

        if (context.hasNews()) {
            double scale = context.newsEnrichmentScore() != null ? clamp(context.newsEnrichmentScore(), 0.0, 1.0) : 1.0;
            parts.add(clamp(context.newsSentiment(), -1.0, 1.0) * scale);
            confidences.add(orDefault(context.newsConfidence()));
            applied.add("news");
        }
        if (context.hasRetail()) {
            double divergence = context.retailDivergence() != null ? context.retailDivergence() : 0.0;
            double factor = divergence > HIGH_DIVERGENCE ? DIVERGENT_RETAIL_FACTOR : ALIGNED_RETAIL_FACTOR;
            parts.add(clamp(context.retailSentiment(), -1.0, 1.0) * factor);
            confidences.add(orDefault(context.retailConfidence()));
            applied.add("retail");
        }
        if (context.hasMacro()) {
            parts.add(clamp(context.macroContextScore(), -1.0, 1.0));
            confidences.add(orDefault(context.macroConfidence()));
            applied.add("macro");
        }

        double adjustment = clamp(mean(parts), -1.0, 1.0);
        double enrichmentConfidence = clamp(mean(confidences), 0.0, 1.0);
        double bw = weights.normalizedBaseWeight();
        double ew = weights.normalizedEnrichmentWeight();

        double finalScore = clamp(base.score() * bw + adjustment * ew, -1.0, 1.0);
        double finalConfidence = clamp(base.confidence() * bw + enrichmentConfidence * ew, 0.0, 1.0);

        return new BlendedConsensus(Action.fromScore(finalScore), finalScore, finalConfidence,
                                    adjustment, enrichmentConfidence, bw, ew, applied);
    }

    public static BlendedConsensus passThrough(ConsensusResult base) {
        return new BlendedConsensus(base.action(), base.score(), base.confidence(),
                                    0.0, 0.0, 1.0, 0.0, List.of());
    }

    /** Audit record combining the base merge with the blend applied on top of it. */
    public static ConsensusBreakdown breakdown(ConsensusResult base, BlendedConsensus blend) {
        return new ConsensusBreakdown(
            base.action(), base.score(), base.confidence(), blend.baseWeight(),
            blend.adjustment(), blend.enrichmentConfidence(), blend.enrichmentWeight(),
            blend.finalScore(), blend.finalConfidence(), base.agreement(),
            base.contributions(), base.absent(), base.dissenters(), base.riskAdjustments());
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double orDefault(Double confidence) {
        return confidence != null ? confidence : DEFAULT_PART_CONFIDENCE;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
