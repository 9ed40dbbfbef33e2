package com.signalfusion.common.model;

import java.util.Locale;

/**
 * Five-band trading action with its numeric consensus score.
 *
 * <h3>Score bands</h3>
 * <pre>
 *   score &gt;=  0.75  → STRONG_BUY
 *   score &gt;=  0.25  → BUY
 *   score &gt;  -0.25  → HOLD
 *   score &gt;  -0.75  → SELL
 *   otherwise       → STRONG_SELL
 * </pre>
 */
public enum Action {
    STRONG_BUY(1.0),
    BUY(0.5),
    HOLD(0.0),
    SELL(-0.5),
    STRONG_SELL(-1.0);

    private static final double STRONG_THRESHOLD = 0.75;
    private static final double THRESHOLD        = 0.25;

    private final double score;

    Action(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public boolean isBuyClass() {
        return this == BUY || this == STRONG_BUY;
    }

    public boolean isSellClass() {
        return this == SELL || this == STRONG_SELL;
    }

    /** Direction sign: +1 buy-class, -1 sell-class, 0 hold. */
    public int direction() {
        return isBuyClass() ? 1 : isSellClass() ? -1 : 0;
    }

    /** Thresholds a fused scalar in [-1, 1] into one of the five bands. */
    public static Action fromScore(double score) {
        if (score >= STRONG_THRESHOLD)  return STRONG_BUY;
        if (score >= THRESHOLD)         return BUY;
        if (score > -THRESHOLD)         return HOLD;
        if (score > -STRONG_THRESHOLD)  return SELL;
        return STRONG_SELL;
    }

    /**
     * Lenient parse: accepts any case and space/hyphen separators ("strong buy", "Strong-Sell").
     * Returns null when the text is not a recognised action.
     */
    public static Action parse(String text) {
        if (text == null || text.isBlank()) return null;
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
