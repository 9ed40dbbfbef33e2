package com.signalfusion.common.model;

/**
 * One specialist's share of a consensus merge.
 *
 * @param kind            the specialist
 * @param signal          directional action read from its payload
 * @param confidence      the specialist's own confidence in [0, 1]
 * @param staticWeight    configured weight before redistribution
 * @param effectiveWeight weight after absent specialists were redistributed (sums to 1 across responders)
 * @param contribution    share of the weighted score: {@code signal × confidence × w / Σ(confidence × w)}
 */
public record SpecialistContribution(
    SpecialistKind kind,
    Action signal,
    double confidence,
    double staticWeight,
    double effectiveWeight,
    double contribution
) {}
