package com.signalfusion.common.consensus;

import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;

import java.util.List;
import java.util.Set;

/**
 * Strategy contract for merging specialist results into a base recommendation.
 *
 * <p>Implementations must be stateless, pure (no logging, no reactive types) and must
 * always return a result. Quorum is enforced by the caller before the merge.
 *
 * <p>Register as a Spring {@code @Bean} to swap strategies without touching the orchestrator.
 */
public interface ConsensusEngine {

    /**
     * @param results   non-empty list of successful specialist results for one symbol
     * @param requested every specialist kind that was dispatched; the ones missing from
     *                  {@code results} are reported as absent
     */
    ConsensusResult compute(List<SpecialistResult> results, Set<SpecialistKind> requested);
}
