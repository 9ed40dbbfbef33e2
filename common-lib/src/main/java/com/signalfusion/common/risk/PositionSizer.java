package com.signalfusion.common.risk;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a validated entry/stop/target into a whole-share position size.
 *
 * <h3>Methods</h3>
 * <pre>
 *   FIXED_FRACTIONAL    shares = floor(account × riskPct / |entry − stop|)
 *   KELLY_CRITERION     f = W − (1 − W) / R, clamped to [0, maxKellyFraction]
 *                       shares = floor(f × account / entry)
 *   VOLATILITY_ADJUSTED m = clamp(targetVol / vol, minVolMultiplier, maxVolMultiplier)
 *                       riskPct' = min(riskPct × m, maxRiskPct), then fixed fractional
 * </pre>
 *
 * <h3>Hard limits (every method)</h3>
 * <ul>
 *   <li>shares are floored to whole shares and never negative</li>
 *   <li>capital at risk is re-derived after flooring and never exceeds the method's risk budget</li>
 *   <li>position value never exceeds the account (no leverage)</li>
 * </ul>
 *
 * <p>Degenerate levels (stop on the wrong side of entry, zero risk per share, non-positive
 * prices or account) return a zero-share result with a reason instead of throwing.
 *
 * <p>Stateless and thread-safe.
 */
public final class PositionSizer {

    private static final double EPSILON = 1e-9;

    /** Win rate assumed by Kelly and the expected-value score when none is known. */
    static final double DEFAULT_WIN_RATE = 0.5;

    /** Win/loss ratio assumed by Kelly when neither the caller nor the trade supplies one. */
    static final double DEFAULT_WIN_LOSS_RATIO = 2.0;

    private PositionSizer() {}

    /**
     * Sizes one trade under one method.
     *
     * @param accountValue account equity, must be positive
     * @param entry        entry price
     * @param stop         stop-loss price
     * @param target       target price, or null when unknown
     * @param method       sizing model
     * @param params       tunables; see {@link SizingParameters}
     * @return the sizing, never null; zero shares with a reason when infeasible
     */
    public static PositionSizeResult size(double accountValue, double entry, double stop, Double target,
                                          SizingMethod method, SizingParameters params) {
        String degenerate = checkLevels(accountValue, entry, stop, target);
        if (degenerate != null) {
            return PositionSizeResult.infeasible(method, degenerate);
        }
        double riskPerShare = Math.abs(entry - stop);

        return switch (method) {
            case FIXED_FRACTIONAL    -> fixedFractional(accountValue, entry, riskPerShare, params.riskPct(),
                                                        method, String.format("risk %.2f%% of account", params.riskPct() * 100));
            case KELLY_CRITERION     -> kelly(accountValue, entry, stop, target, riskPerShare, params);
            case VOLATILITY_ADJUSTED -> volatilityAdjusted(accountValue, entry, riskPerShare, params);
        };
    }

    /**
     * Sizes under every method, caps each to {@code maxPositionPct} of the account, and selects
     * the method with the highest expected value:
     * <pre>
     *   EV = capitalAtRisk × (W × R/R − (1 − W))
     * </pre>
     * Ties keep the earliest method in {@link SizingMethod} declaration order.
     */
    public static SizingRecommendation recommend(double accountValue, double entry, double stop, double target,
                                                 Double volatility, Double winRate) {
        SizingParameters params = SizingParameters.defaults()
            .withVolatility(volatility)
            .withWinRate(winRate, null);
        return recommend(accountValue, entry, stop, target, params);
    }

    public static SizingRecommendation recommend(double accountValue, double entry, double stop, double target,
                                                 SizingParameters params) {
        Double rr = rewardToRisk(entry, stop, target);
        double w = params.winRate() != null ? params.winRate() : DEFAULT_WIN_RATE;

        Map<SizingMethod, PositionSizeResult> results = new EnumMap<>(SizingMethod.class);
        Map<SizingMethod, Double> expectedValues = new EnumMap<>(SizingMethod.class);
        SizingMethod best = SizingMethod.FIXED_FRACTIONAL;
        double bestEv = Double.NEGATIVE_INFINITY;

        for (SizingMethod method : SizingMethod.values()) {
            PositionSizeResult raw = size(accountValue, entry, stop, target, method, params);
            PositionSizeResult capped = capPosition(raw, accountValue, entry, params.maxPositionPct());
            results.put(method, capped);

            double edge = rr != null ? w * rr - (1.0 - w) : -(1.0 - w);
            double ev = capped.feasible() ? capped.capitalAtRisk() * edge : Double.NEGATIVE_INFINITY;
            expectedValues.put(method, capped.feasible() ? ev : 0.0);

            if (ev > bestEv + EPSILON) {
                bestEv = ev;
                best = method;
            }
        }

        String reasoning = String.format("rr=%s winRate=%.2f cap=%.0f%% → %s (ev=%.2f)",
            rr == null ? "n/a" : String.format("%.2f", rr), w, params.maxPositionPct() * 100,
            best.wireName(), expectedValues.get(best));
        return new SizingRecommendation(results, expectedValues, best, RiskReward.rounded(rr), reasoning);
    }

    // ── methods ───────────────────────────────────────────────────────────────

    private static PositionSizeResult fixedFractional(double account, double entry, double riskPerShare,
                                                      double riskPct, SizingMethod method, String basis) {
        double budget = account * riskPct;
        long shares = (long) Math.floor(budget / riskPerShare);
        return finish(method, account, entry, riskPerShare, riskPct, shares, basis);
    }

    private static PositionSizeResult kelly(double account, double entry, double stop, Double target,
                                            double riskPerShare, SizingParameters params) {
        double w = params.winRate() != null ? params.winRate() : DEFAULT_WIN_RATE;
        Double tradeRr = target != null ? rewardToRisk(entry, stop, target) : null;
        double r = params.avgWinLossRatio() != null ? params.avgWinLossRatio()
                 : (tradeRr != null && tradeRr > 0.0) ? tradeRr : DEFAULT_WIN_LOSS_RATIO;

        double fraction = w - (1.0 - w) / r;
        double clamped = Math.max(0.0, Math.min(params.maxKellyFraction(), fraction));
        if (clamped <= 0.0) {
            return PositionSizeResult.infeasible(SizingMethod.KELLY_CRITERION,
                String.format("kelly fraction %.4f ≤ 0 (W=%.2f R=%.2f): no edge", fraction, w, r));
        }
        long shares = (long) Math.floor(clamped * account / entry);
        return finish(SizingMethod.KELLY_CRITERION, account, entry, riskPerShare, params.riskPct(), shares,
            String.format("kelly f=%.4f clamped=%.4f (W=%.2f R=%.2f)", fraction, clamped, w, r));
    }

    private static PositionSizeResult volatilityAdjusted(double account, double entry, double riskPerShare,
                                                         SizingParameters params) {
        double multiplier = 1.0;
        String basis = "no volatility supplied, multiplier 1.00";
        Double vol = params.volatility();
        if (vol != null && vol > 0.0) {
            double raw = params.targetVolatility() / vol;
            multiplier = Math.max(params.minVolMultiplier(), Math.min(params.maxVolMultiplier(), raw));
            basis = String.format("vol=%.3f target=%.3f multiplier=%.2f", vol, params.targetVolatility(), multiplier);
        }
        double riskPct = Math.min(params.riskPct() * multiplier, params.maxRiskPct());
        return fixedFractional(account, entry, riskPerShare, riskPct, SizingMethod.VOLATILITY_ADJUSTED,
            basis + String.format(" → risk %.2f%%", riskPct * 100));
    }

    // ── shared limits ─────────────────────────────────────────────────────────

    /**
     * Applies the no-leverage and risk-budget limits to a floored share count and builds the result.
     * Capital at risk is re-derived from the final share count.
     */
    private static PositionSizeResult finish(SizingMethod method, double account, double entry,
                                             double riskPerShare, double riskPct, long shares, String basis) {
        long maxAffordable = (long) Math.floor(account / entry);
        shares = Math.max(0L, Math.min(shares, maxAffordable));

        double budget = account * riskPct;
        if (shares * riskPerShare > budget + EPSILON) {
            shares = (long) Math.floor(budget / riskPerShare);
        }
        if (shares == 0L) {
            return PositionSizeResult.infeasible(method,
                basis + String.format("; risk per share %.2f exceeds budget %.2f", riskPerShare, budget));
        }

        double positionValue = shares * entry;
        double capitalAtRisk = shares * riskPerShare;
        return new PositionSizeResult(method, shares, positionValue, capitalAtRisk,
                                      positionValue / account, riskPerShare, riskPct, basis);
    }

    private static PositionSizeResult capPosition(PositionSizeResult result, double account, double entry,
                                                  double maxPositionPct) {
        if (!result.feasible() || result.positionPctOfAccount() <= maxPositionPct + EPSILON) {
            return result;
        }
        long shares = (long) Math.floor(account * maxPositionPct / entry);
        if (shares == 0L) {
            return PositionSizeResult.infeasible(result.method(),
                String.format("one share exceeds the %.0f%% position cap", maxPositionPct * 100));
        }
        double positionValue = shares * entry;
        return new PositionSizeResult(result.method(), shares, positionValue, shares * result.riskPerShare(),
            positionValue / account, result.riskPerShare(), result.riskPct(),
            result.reason() + String.format("; capped at %.0f%% of account", maxPositionPct * 100));
    }

    /**
     * Returns a reason string when the levels cannot be sized, else null.
     * Direction comes from the target when known, otherwise from the stop side.
     */
    private static String checkLevels(double account, double entry, double stop, Double target) {
        if (!(account > 0.0))  return "account value must be positive";
        if (!(entry > 0.0))    return "entry price must be positive";
        if (!(stop > 0.0))     return "stop loss must be positive";
        if (entry == stop)     return "stop equals entry: zero risk per share";
        if (target != null) {
            if (target > entry && stop >= entry) return "stop at or above entry for a long position";
            if (target < entry && stop <= entry) return "stop at or below entry for a short position";
        }
        return null;
    }

    /** Direction-agnostic reward/risk; null when undefined. */
    private static Double rewardToRisk(double entry, double stop, double target) {
        double risk = Math.abs(entry - stop);
        if (risk <= 0.0) return null;
        boolean shortSide = stop > entry;
        double reward = shortSide ? entry - target : target - entry;
        return reward / risk;
    }
}
