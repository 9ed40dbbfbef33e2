package com.signalfusion.common.model;

import java.util.Locale;

/**
 * The six analysis domains a specialist can cover.
 * Each kind is dispatched at most once per (task, symbol).
 */
public enum SpecialistKind {
    TECHNICAL,
    FUNDAMENTAL,
    SENTIMENT,
    RISK,
    MACRO,
    NEWS;

    /** Lower-case wire name, used in URLs and payload keys. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire name ("technical", "Technical", "TECHNICAL") to its kind.
     * Returns null for unrecognized names.
     */
    public static SpecialistKind fromName(String name) {
        if (name == null || name.isBlank()) return null;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** True for the kinds that can anchor a quorum on their own (technical, fundamental). */
    public boolean isAnchor() {
        return this == TECHNICAL || this == FUNDAMENTAL;
    }
}
