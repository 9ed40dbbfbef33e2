package com.signalfusion.common.exception;

import com.signalfusion.common.model.SpecialistKind;

import java.util.List;

/**
 * Fewer specialists answered than the quorum allows, or none of the anchors
 * (technical, fundamental) did. Fatal for the task.
 */
public class InsufficientQuorumException extends FusionException {
    private final List<SpecialistKind> responded;
    private final int minimumRequired;

    public InsufficientQuorumException(String symbol, List<SpecialistKind> responded, int minimumRequired) {
        super(symbol, String.format("insufficient quorum: %d responded %s, need %d including technical or fundamental",
                                    responded.size(), responded, minimumRequired));
        this.responded = List.copyOf(responded);
        this.minimumRequired = minimumRequired;
    }

    public List<SpecialistKind> getResponded() {
        return responded;
    }

    public int getMinimumRequired() {
        return minimumRequired;
    }
}
