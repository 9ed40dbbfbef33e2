package com.signalfusion.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of how a {@link ConsensusRecommendation} was fused.
 *
 * <p>Records the base merge, the enrichment adjustment and the blend between them,
 * plus every responding specialist's effective weight. Absent specialists are listed
 * separately so a reader can see whose weight was redistributed.
 */
public record ConsensusBreakdown(
    Action baseAction,
    double baseScore,
    double baseConfidence,
    double baseWeight,
    double enrichmentAdjustment,
    double enrichmentConfidence,
    double enrichmentWeight,
    double finalScore,
    double finalConfidence,
    double agreementLevel,
    Map<SpecialistKind, SpecialistContribution> contributions,
    List<SpecialistKind> absentSpecialists,
    List<SpecialistKind> dissenters,
    List<String> riskAdjustments
) {
    public ConsensusBreakdown {
        contributions = contributions == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(contributions));
        absentSpecialists = absentSpecialists == null ? List.of() : List.copyOf(absentSpecialists);
        dissenters = dissenters == null ? List.of() : List.copyOf(dissenters);
        riskAdjustments = riskAdjustments == null ? List.of() : List.copyOf(riskAdjustments);
    }

    /** True when the enrichment pass moved the result (non-zero blend weight). */
    public boolean enriched() {
        return enrichmentWeight > 0.0;
    }
}
