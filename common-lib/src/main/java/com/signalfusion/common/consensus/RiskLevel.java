package com.signalfusion.common.consensus;

import com.signalfusion.common.model.Action;

import java.util.Locale;

/** Risk specialist's categorical verdict and the directional signal it implies. */
public enum RiskLevel {
    LOW(Action.BUY),
    MEDIUM(Action.HOLD),
    HIGH(Action.SELL),
    VERY_HIGH(Action.STRONG_SELL);

    private final Action impliedSignal;

    RiskLevel(Action impliedSignal) {
        this.impliedSignal = impliedSignal;
    }

    public Action impliedSignal() {
        return impliedSignal;
    }

    public boolean isElevated() {
        return this == HIGH || this == VERY_HIGH;
    }

    /** Parses "high", "Very High", "very_high", "very-high". Null when unrecognised. */
    public static RiskLevel parse(String text) {
        if (text == null || text.isBlank()) return null;
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
