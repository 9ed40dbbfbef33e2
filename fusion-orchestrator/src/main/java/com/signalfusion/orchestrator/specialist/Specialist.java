package com.signalfusion.orchestrator.specialist;

import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import reactor.core.publisher.Mono;

/**
 * One analysis domain, invoked through a uniform asynchronous contract.
 *
 * <p>Implementations must not block the calling thread. Timeout and retry are applied by the
 * dispatcher, so an implementation signals failure by erroring the returned {@code Mono}.
 */
public interface Specialist {

    SpecialistKind kind();

    Mono<SpecialistResult> analyze(SpecialistContext context);
}
