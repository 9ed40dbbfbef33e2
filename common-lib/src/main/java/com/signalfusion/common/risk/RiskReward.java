package com.signalfusion.common.risk;

import com.signalfusion.common.model.Action;

/** Risk/reward ratio, mirrored for short-side actions. */
public final class RiskReward {

    private RiskReward() {}

    /**
     * <pre>
     *   BUY/HOLD : (target − entry) / (entry − stop)
     *   SELL     : (entry − target) / (stop − entry)
     * </pre>
     *
     * @return the ratio, or null when the risk leg is zero or negative (undefined)
     */
    public static Double ratio(Action action, double entry, double target, double stop) {
        boolean shortSide = action != null && action.isSellClass();
        double reward = shortSide ? entry - target : target - entry;
        double risk   = shortSide ? stop - entry   : entry - stop;
        if (risk <= 0.0 || !Double.isFinite(risk)) return null;
        return reward / risk;
    }

    /** Ratio rounded to two decimals for display; null stays null. */
    public static Double rounded(Double ratio) {
        return ratio == null ? null : Math.round(ratio * 100.0) / 100.0;
    }
}
