package com.signalfusion.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Flags a caller can request on an {@link AnalysisTask}.
 *
 * <p>Every flag except {@link #ENRICHMENT} enables one {@link SpecialistKind}.
 * {@code ENRICHMENT} enables the second-pass news/social/macro blend.
 */
public enum Capability {
    TECHNICAL(SpecialistKind.TECHNICAL),
    FUNDAMENTAL(SpecialistKind.FUNDAMENTAL),
    SENTIMENT(SpecialistKind.SENTIMENT),
    RISK(SpecialistKind.RISK),
    MACRO(SpecialistKind.MACRO),
    NEWS(SpecialistKind.NEWS),
    ENRICHMENT(null);

    private final SpecialistKind specialistKind;

    Capability(SpecialistKind specialistKind) {
        this.specialistKind = specialistKind;
    }

    /** The specialist this flag enables, or null for {@link #ENRICHMENT}. */
    public SpecialistKind specialistKind() {
        return specialistKind;
    }

    /** Every flag, i.e. all six specialists plus enrichment. */
    public static Set<Capability> all() {
        return EnumSet.allOf(Capability.class);
    }
}
