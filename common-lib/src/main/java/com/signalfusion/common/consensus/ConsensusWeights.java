package com.signalfusion.common.consensus;

import com.signalfusion.common.model.SpecialistKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable consensus parameters: static per-specialist weights and the base/enrichment blend.
 *
 * <p>Defaults: fundamental 0.35, technical 0.25, risk 0.20, news 0.15, sentiment 0.10,
 * macro 0.10; blend 70% base / 30% enrichment. Static weights need not sum to 1 since
 * they are normalised over the specialists that responded.
 */
public record ConsensusWeights(
    Map<SpecialistKind, Double> staticWeights,
    double baseWeight,
    double enrichmentWeight
) {
    public ConsensusWeights {
        if (baseWeight < 0.0 || enrichmentWeight < 0.0 || baseWeight + enrichmentWeight <= 0.0) {
            throw new IllegalArgumentException(
                "blend weights must be non-negative and not both zero: base=" + baseWeight
                + " enrichment=" + enrichmentWeight);
        }
        Map<SpecialistKind, Double> copy = new EnumMap<>(SpecialistKind.class);
        if (staticWeights != null) {
            staticWeights.forEach((kind, w) -> {
                if (w == null || w < 0.0) {
                    throw new IllegalArgumentException("weight for " + kind + " must be non-negative");
                }
                copy.put(kind, w);
            });
        }
        staticWeights = Collections.unmodifiableMap(copy);
    }

    public static ConsensusWeights defaults() {
        Map<SpecialistKind, Double> weights = new EnumMap<>(SpecialistKind.class);
        weights.put(SpecialistKind.FUNDAMENTAL, 0.35);
        weights.put(SpecialistKind.TECHNICAL,   0.25);
        weights.put(SpecialistKind.RISK,        0.20);
        weights.put(SpecialistKind.NEWS,        0.15);
        weights.put(SpecialistKind.SENTIMENT,   0.10);
        weights.put(SpecialistKind.MACRO,       0.10);
        return new ConsensusWeights(weights, 0.7, 0.3);
    }

    public double weightOf(SpecialistKind kind) {
        return staticWeights.getOrDefault(kind, 0.0);
    }

    /** Base share of the blend, normalised so base + enrichment = 1. */
    public double normalizedBaseWeight() {
        return baseWeight / (baseWeight + enrichmentWeight);
    }

    public double normalizedEnrichmentWeight() {
        return enrichmentWeight / (baseWeight + enrichmentWeight);
    }
}
