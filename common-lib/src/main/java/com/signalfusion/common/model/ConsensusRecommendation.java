package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Fused, per-symbol trading recommendation.
 *
 * <p>Built once per task and symbol by the consensus merge. The validator never edits it:
 * corrections produce a new frozen instance via {@link #withCorrections(Map)}.
 *
 * <p>{@code atr} is the average true range reported by the technical specialist, or null
 * when unknown; the validator uses it to check the stop distance.
 */
public record ConsensusRecommendation(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("action") Action action,
    @JsonProperty("entryPrice") double entryPrice,
    @JsonProperty("targetPrice") double targetPrice,
    @JsonProperty("stopLoss") double stopLoss,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("atr") Double atr,
    @JsonProperty("consensusBreakdown") ConsensusBreakdown consensusBreakdown
) {
    public static final String ENTRY_PRICE  = "entry_price";
    public static final String TARGET_PRICE = "target_price";
    public static final String STOP_LOSS    = "stop_loss";
    public static final String CONFIDENCE   = "confidence";

    /**
     * Returns a copy with the given fields replaced. Keys are the field constants above;
     * unknown keys are ignored.
     */
    public ConsensusRecommendation withCorrections(Map<String, Double> corrections) {
        if (corrections == null || corrections.isEmpty()) return this;
        return new ConsensusRecommendation(
            symbol, action,
            corrections.getOrDefault(ENTRY_PRICE, entryPrice),
            corrections.getOrDefault(TARGET_PRICE, targetPrice),
            corrections.getOrDefault(STOP_LOSS, stopLoss),
            corrections.getOrDefault(CONFIDENCE, confidence),
            reasoning, atr, consensusBreakdown);
    }

    public ConsensusRecommendation withReasoning(String newReasoning) {
        return new ConsensusRecommendation(symbol, action, entryPrice, targetPrice, stopLoss,
                                           confidence, newReasoning, atr, consensusBreakdown);
    }

    /** Numeric value of a named field, or null if the name is not a price/confidence field. */
    public Double fieldValue(String field) {
        return switch (field) {
            case ENTRY_PRICE  -> entryPrice;
            case TARGET_PRICE -> targetPrice;
            case STOP_LOSS    -> stopLoss;
            case CONFIDENCE   -> confidence;
            default           -> null;
        };
    }
}
