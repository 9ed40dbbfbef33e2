package com.signalfusion.common.consensus;

import com.signalfusion.common.exception.InsufficientQuorumException;
import com.signalfusion.common.model.SpecialistKind;

import java.util.Collection;
import java.util.List;

/**
 * Minimum responder set for a merge: at least {@code minSpecialists} successful specialists,
 * at least one of which is technical or fundamental.
 */
public record QuorumPolicy(int minSpecialists) {

    public static final int DEFAULT_MIN_SPECIALISTS = 2;

    public QuorumPolicy {
        if (minSpecialists < 1) {
            throw new IllegalArgumentException("minSpecialists must be at least 1: " + minSpecialists);
        }
    }

    public static QuorumPolicy defaults() {
        return new QuorumPolicy(DEFAULT_MIN_SPECIALISTS);
    }

    public boolean isSatisfied(Collection<SpecialistKind> responded) {
        return responded.size() >= minSpecialists
            && responded.stream().anyMatch(SpecialistKind::isAnchor);
    }

    /** @throws InsufficientQuorumException when {@link #isSatisfied} is false */
    public void enforce(String symbol, Collection<SpecialistKind> responded) {
        if (!isSatisfied(responded)) {
            throw new InsufficientQuorumException(symbol, List.copyOf(responded), minSpecialists);
        }
    }
}
