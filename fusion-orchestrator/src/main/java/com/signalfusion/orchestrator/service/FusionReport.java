package com.signalfusion.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.lineage.LineageSummary;
import com.signalfusion.common.model.ConsensusRecommendation;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.risk.SizingRecommendation;
import com.signalfusion.common.validation.ValidationOutcome;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything the pipeline produced for one symbol of a task. This is the document handed to
 * the store.
 *
 * <p>{@code recommendation} is already corrected by the validator. {@code sizing} is null
 * when the recommendation was not finalized or its action is HOLD.
 */
public record FusionReport(
    @JsonProperty("taskId") String taskId,
    @JsonProperty("traceId") String traceId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("recommendation") ConsensusRecommendation recommendation,
    @JsonProperty("validation") ValidationOutcome validation,
    @JsonProperty("sizing") SizingRecommendation sizing,
    @JsonProperty("lineage") LineageSummary lineage,
    @JsonProperty("specialists") Map<SpecialistKind, SpecialistOutcome.Status> specialists,
    @JsonProperty("finalized") boolean finalized,
    @JsonProperty("completedAt") Instant completedAt
) {
    public FusionReport {
        specialists = specialists == null || specialists.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(specialists));
    }
}
