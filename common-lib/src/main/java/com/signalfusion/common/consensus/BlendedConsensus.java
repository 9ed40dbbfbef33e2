package com.signalfusion.common.consensus;

import com.signalfusion.common.model.Action;

import java.util.List;

/**
 * Result of blending a base consensus with enrichment.
 * {@code enrichmentWeight} is 0 when no enrichment was applied.
 */
public record BlendedConsensus(
    Action action,
    double finalScore,
    double finalConfidence,
    double adjustment,
    double enrichmentConfidence,
    double baseWeight,
    double enrichmentWeight,
    List<String> partsApplied
) {}
