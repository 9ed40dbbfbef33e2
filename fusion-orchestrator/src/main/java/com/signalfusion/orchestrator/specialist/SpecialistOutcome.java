package com.signalfusion.orchestrator.specialist;

import com.signalfusion.common.exception.SpecialistException;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;

/**
 * What became of one specialist call after timeout and retries: a result, or the reason
 * there is none. Only {@link Status#SUCCESS} outcomes take part in the consensus merge.
 *
 * @param attempts number of subscriptions made, including the first
 */
public record SpecialistOutcome(
    SpecialistKind kind,
    Status status,
    SpecialistResult result,
    SpecialistException error,
    int attempts
) {
    public enum Status {
        SUCCESS,
        /** Timed out on every attempt, or no specialist is registered for the kind. */
        ABSENT,
        /** Raised on the last attempt. */
        FAILED
    }

    public static SpecialistOutcome success(SpecialistResult result, int attempts) {
        return new SpecialistOutcome(result.kind(), Status.SUCCESS, result, null, attempts);
    }

    public static SpecialistOutcome absent(SpecialistKind kind, SpecialistException error, int attempts) {
        return new SpecialistOutcome(kind, Status.ABSENT, null, error, attempts);
    }

    public static SpecialistOutcome failed(SpecialistKind kind, SpecialistException error, int attempts) {
        return new SpecialistOutcome(kind, Status.FAILED, null, error, attempts);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
