package com.signalfusion.orchestrator.ai;

import java.util.Map;

/**
 * Snapshot of {@link ModelTierRouter} usage.
 * {@code alwaysExpensiveCost} prices every recorded call at the expensive tier's rate.
 */
public record RouterStats(
    Map<ModelTier, Long> callsByTier,
    Map<ModelTier, Long> tokensByTier,
    long totalCalls,
    double cheapPercentage,
    double actualCost,
    double alwaysExpensiveCost,
    double costSaved,
    double averageCostPerCall
) {}
