package com.signalfusion.common.consensus;

import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.SpecialistContribution;
import com.signalfusion.common.model.SpecialistKind;

import java.util.List;
import java.util.Map;

/**
 * Base (pre-enrichment) output of a {@link ConsensusEngine} run.
 *
 * <ul>
 *   <li>{@code score}: risk-adjusted weighted score in [-1, 1]</li>
 *   <li>{@code confidence}: blended agreement/confidence/strength in [0.1, 0.95]</li>
 *   <li>{@code agreement}: share of responders whose direction matches {@code action}</li>
 *   <li>{@code contributions}: per-responder weights, in dispatch order</li>
 * </ul>
 *
 * <p>Pure data.
 */
public record ConsensusResult(
    Action action,
    double score,
    double confidence,
    double agreement,
    Map<SpecialistKind, SpecialistContribution> contributions,
    List<SpecialistKind> absent,
    List<SpecialistKind> dissenters,
    List<String> riskAdjustments,
    String reasoning
) {}
