package com.signalfusion.common.consensus;

import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.SpecialistResult;
import com.signalfusion.common.risk.StopLossCalculator;

import java.util.Map;

/**
 * Picks entry, target and stop for a consensus action.
 *
 * <p>The technical specialist's levels win when it supplied all three. Otherwise the levels
 * are derived from the market price and the fundamental valuation band:
 * <pre>
 *   BUY-class  target = fair_value_high | fair_value | price × 1.15    stop = price − 2·ATR | price × 0.98
 *   SELL-class target = fair_value_low  | fair_value | price × 0.85    stop = price + 2·ATR | price × 1.02
 *   HOLD       target = band midpoint   | fair_value | price × 1.05    stop as BUY
 * </pre>
 * A valuation target on the wrong side of entry falls back to the percentage target.
 */
public final class PriceLevelResolver {

    private static final double BUY_TARGET_FACTOR  = 1.15;
    private static final double SELL_TARGET_FACTOR = 0.85;
    private static final double HOLD_TARGET_FACTOR = 1.05;

    private PriceLevelResolver() {}

    /**
     * @param technical   technical result, or null when absent
     * @param fundamental fundamental result, or null when absent
     */
    public static PriceLevels resolve(Action action, double marketPrice,
                                      SpecialistResult technical, SpecialistResult fundamental) {
        Map<String, Object> tech = technical != null ? technical.payload() : Map.of();
        Double atr = ValueExtractor.firstPrice(tech, "atr", "atr_14");

        Double techEntry  = ValueExtractor.firstPrice(tech, "entry_price", "entry");
        Double techTarget = ValueExtractor.firstPrice(tech, "target_price", "target");
        Double techStop   = ValueExtractor.firstPrice(tech, "stop_loss", "stop");
        if (techEntry != null && techTarget != null && techStop != null) {
            return new PriceLevels(techEntry, techTarget, techStop, atr, true, "technical specialist levels");
        }

        double entry = marketPrice;
        double stop = StopLossCalculator.fallbackStop(action, entry, atr);
        Map<String, Object> fund = fundamental != null ? fundamental.payload() : Map.of();
        Double fairValue = ValueExtractor.firstPrice(fund, "fair_value", "intrinsic_value");
        Double bandHigh  = ValueExtractor.firstPrice(fund, "fair_value_high", "valuation_high");
        Double bandLow   = ValueExtractor.firstPrice(fund, "fair_value_low", "valuation_low");

        double target;
        String basis;
        if (action.isSellClass()) {
            Double candidate = bandLow != null ? bandLow : fairValue;
            boolean usable = candidate != null && candidate < entry;
            target = usable ? candidate : entry * SELL_TARGET_FACTOR;
            basis = usable ? "fundamental valuation band (low)" : "percentage target";
        } else if (action.isBuyClass()) {
            Double candidate = bandHigh != null ? bandHigh : fairValue;
            boolean usable = candidate != null && candidate > entry;
            target = usable ? candidate : entry * BUY_TARGET_FACTOR;
            basis = usable ? "fundamental valuation band (high)" : "percentage target";
        } else {
            Double candidate = (bandHigh != null && bandLow != null)
                ? Double.valueOf((bandHigh + bandLow) / 2.0)
                : fairValue;
            boolean usable = candidate != null && candidate > entry;
            target = usable ? candidate : entry * HOLD_TARGET_FACTOR;
            basis = usable ? "fundamental valuation midpoint" : "percentage target";
        }
        String stopBasis = atr != null ? String.format("ATR stop (ATR=%.2f)", atr) : "2% stop";
        return new PriceLevels(entry, target, stop, atr, false, basis + ", " + stopBasis);
    }
}
