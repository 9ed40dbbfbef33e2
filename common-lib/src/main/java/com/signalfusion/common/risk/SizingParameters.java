package com.signalfusion.common.risk;

/**
 * Tunables for {@link PositionSizer}. Nullable fields mean "not known"; the sizer
 * substitutes its documented defaults.
 *
 * @param riskPct          fraction of account risked per trade (0.01 = 1%)
 * @param winRate          historical win rate in [0, 1], or null (Kelly assumes 0.5)
 * @param avgWinLossRatio  average win / average loss, or null (Kelly uses the trade's R/R, else 2.0)
 * @param maxKellyFraction ceiling on the Kelly fraction
 * @param volatility       annualised volatility of the instrument, or null
 * @param targetVolatility volatility at which the volatility-adjusted multiplier is 1.0
 * @param minVolMultiplier lower clamp of the volatility multiplier
 * @param maxVolMultiplier upper clamp of the volatility multiplier
 * @param maxRiskPct       hard ceiling on the volatility-scaled risk fraction
 * @param maxPositionPct   cap on position value as a fraction of account, applied by {@code recommend}
 */
public record SizingParameters(
    double riskPct,
    Double winRate,
    Double avgWinLossRatio,
    double maxKellyFraction,
    Double volatility,
    double targetVolatility,
    double minVolMultiplier,
    double maxVolMultiplier,
    double maxRiskPct,
    double maxPositionPct
) {
    public static final double DEFAULT_RISK_PCT          = 0.01;
    public static final double DEFAULT_MAX_KELLY         = 0.25;
    public static final double DEFAULT_TARGET_VOLATILITY = 0.20;
    public static final double DEFAULT_MAX_POSITION_PCT  = 0.20;

    public SizingParameters {
        if (riskPct <= 0.0 || riskPct >= 1.0) {
            throw new IllegalArgumentException("riskPct must be in (0, 1): " + riskPct);
        }
        if (maxPositionPct <= 0.0 || maxPositionPct > 1.0) {
            throw new IllegalArgumentException("maxPositionPct must be in (0, 1]: " + maxPositionPct);
        }
    }

    public static SizingParameters defaults() {
        return new SizingParameters(DEFAULT_RISK_PCT, null, null, DEFAULT_MAX_KELLY,
                                    null, DEFAULT_TARGET_VOLATILITY, 0.25, 2.0, 0.03,
                                    DEFAULT_MAX_POSITION_PCT);
    }

    public SizingParameters withRiskPct(double pct) {
        return new SizingParameters(pct, winRate, avgWinLossRatio, maxKellyFraction, volatility,
                                    targetVolatility, minVolMultiplier, maxVolMultiplier, maxRiskPct,
                                    maxPositionPct);
    }

    public SizingParameters withWinRate(Double rate, Double winLossRatio) {
        return new SizingParameters(riskPct, rate, winLossRatio, maxKellyFraction, volatility,
                                    targetVolatility, minVolMultiplier, maxVolMultiplier, maxRiskPct,
                                    maxPositionPct);
    }

    public SizingParameters withVolatility(Double vol) {
        return new SizingParameters(riskPct, winRate, avgWinLossRatio, maxKellyFraction, vol,
                                    targetVolatility, minVolMultiplier, maxVolMultiplier, maxRiskPct,
                                    maxPositionPct);
    }

    public SizingParameters withMaxPositionPct(double pct) {
        return new SizingParameters(riskPct, winRate, avgWinLossRatio, maxKellyFraction, volatility,
                                    targetVolatility, minVolMultiplier, maxVolMultiplier, maxRiskPct,
                                    pct);
    }
}
