package com.signalfusion.common.risk;

import com.signalfusion.common.model.Action;

/**
 * Stop-loss reference levels shared by price-level derivation and the synthesis validator.
 *
 * <h3>Fallback formula</h3>
 * <pre>
 *   ATR known   → BUY/HOLD: entry − k × ATR      SELL: entry + k × ATR     (k = 2.0)
 *   ATR absent  → BUY/HOLD: entry × 0.98         SELL: entry × 1.02
 * </pre>
 * An ATR stop that would land at or below zero falls back to the percentage stop.
 */
public final class StopLossCalculator {

    public static final double DEFAULT_ATR_MULTIPLIER = 2.0;

    static final double LONG_STOP_FACTOR  = 0.98;
    static final double SHORT_STOP_FACTOR = 1.02;

    /** A stop this many times the entry is a unit error, not a level. */
    private static final double IMPLAUSIBLE_MULTIPLE = 10.0;

    private StopLossCalculator() {}

    /** Fallback stop with the default multiplier. */
    public static double fallbackStop(Action action, double entry, Double atr) {
        return fallbackStop(action, entry, atr, DEFAULT_ATR_MULTIPLIER);
    }

    public static double fallbackStop(Action action, double entry, Double atr, double atrMultiplier) {
        boolean shortSide = action != null && action.isSellClass();
        if (atr != null && atr > 0.0) {
            double stop = shortSide ? entry + atrMultiplier * atr : entry - atrMultiplier * atr;
            if (stop > 0.0) return stop;
        }
        return percentageStop(action, entry);
    }

    /** Fixed 2% stop on the losing side of entry. */
    public static double percentageStop(Action action, double entry) {
        boolean shortSide = action != null && action.isSellClass();
        return shortSide ? entry * SHORT_STOP_FACTOR : entry * LONG_STOP_FACTOR;
    }

    /**
     * True when {@code stop} cannot be a price level for {@code entry}: non-positive,
     * at least ten times the entry, or below 1.0 while the entry is above 1.0 (a percentage
     * passed where a price was expected).
     */
    public static boolean isImplausible(double stop, double entry) {
        if (!Double.isFinite(stop) || stop <= 0.0) return true;
        if (stop >= IMPLAUSIBLE_MULTIPLE * entry) return true;
        return stop < 1.0 && entry > 1.0;
    }
}
