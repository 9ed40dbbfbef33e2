package com.signalfusion.common.validation;

import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.ConsensusRecommendation;
import com.signalfusion.common.risk.RiskReward;
import com.signalfusion.common.risk.StopLossCalculator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.signalfusion.common.model.ConsensusRecommendation.CONFIDENCE;
import static com.signalfusion.common.model.ConsensusRecommendation.ENTRY_PRICE;
import static com.signalfusion.common.model.ConsensusRecommendation.STOP_LOSS;
import static com.signalfusion.common.model.ConsensusRecommendation.TARGET_PRICE;

/**
 * Enforces the numeric and logical invariants of a fused recommendation and auto-corrects
 * the malformations that have a known-safe fallback.
 *
 * <h3>Battery (in order)</h3>
 * <ol>
 *   <li><b>Price ordering</b>: BUY-class: stop &lt; entry &lt; target; SELL-class: target &lt; entry &lt; stop.</li>
 *   <li><b>Stop-loss sanity</b>: a stop that is non-positive, ≥ 10× entry, or &lt; 1.0 while entry &gt; 1.0
 *       is a unit error: flagged, then replaced by {@link StopLossCalculator#fallbackStop}.
 *       With ATR known, a stop off {@code entry ∓ k × ATR} by more than the tolerance is a warning.</li>
 *   <li><b>Risk/reward</b>: undefined or negative ratio is an error; low or extreme ratios warn.</li>
 *   <li><b>Action/target</b>: BUY-class target ≤ current price (mirrored for SELL) is an error.</li>
 *   <li><b>Range plausibility</b>: confidence outside [0, 1] (clamped) or any price ≤ 0 is an error.</li>
 *   <li><b>Fundamentals</b>: negative P/E, ROE below −100%, margin of safety or profit margin
 *       outside ±100% are errors; P/E above 1000 or ROE above 200% warn.</li>
 *   <li><b>Risk metrics</b>: Sharpe above 10 or max drawdown outside [0, 100]% is an error;
 *       Sharpe above 5, Sortino far below Sharpe, or a zero drawdown over many periods warn.</li>
 * </ol>
 *
 * <p>Corrections are applied and the hard checks re-run on the corrected values; an original error
 * that does not recur is marked resolved. The outcome is valid only if nothing unresolved remains.
 * Fundamental and risk-metric errors have no correction and always block.
 *
 * <p>Pure and deterministic: no I/O, no logging, no clock. Safe to share across threads.
 */
public class SynthesisValidator {

    /** Tolerance on the ATR stop, as a fraction of entry. */
    public static final double DEFAULT_ATR_TOLERANCE = 0.01;

    private static final double MIN_BUY_RISK_REWARD        = 2.0;
    private static final double MAX_PLAUSIBLE_RISK_REWARD  = 10.0;
    private static final double HIGH_CONFIDENCE            = 0.8;
    private static final double HIGH_CONFIDENCE_MIN_RR     = 1.5;
    private static final double MAX_TARGET_MULTIPLE        = 3.0;
    private static final double MIN_TARGET_MULTIPLE        = 0.5;
    private static final double WIDE_STOP_FRACTION         = 0.15;
    private static final double EXTREME_PE                 = 1000.0;
    private static final double EXTREME_ROE_PCT            = 200.0;
    private static final double MAX_SHARPE                 = 10.0;
    private static final double RARE_SHARPE                = 5.0;
    private static final double SORTINO_SHARPE_FLOOR       = 0.3;
    private static final int    LONG_BACKTEST_PERIODS      = 10;

    private final double atrMultiplier;
    private final double atrTolerance;

    public SynthesisValidator() {
        this(StopLossCalculator.DEFAULT_ATR_MULTIPLIER, DEFAULT_ATR_TOLERANCE);
    }

    public SynthesisValidator(double atrMultiplier, double atrTolerance) {
        this.atrMultiplier = atrMultiplier;
        this.atrTolerance = atrTolerance;
    }

    /**
     * Validates {@code recommendation} against {@code currentPrice}.
     *
     * @return the outcome, never null
     */
    public ValidationOutcome validate(ConsensusRecommendation recommendation, double currentPrice) {
        return validate(recommendation, currentPrice, Map.of(), Map.of());
    }

    /**
     * Validates {@code recommendation} against {@code currentPrice} together with the metrics the
     * fundamental and risk specialists reported. Percent-valued metrics are in percent (ROE 25 = 25%).
     *
     * @param fundamentals fundamental payload; null or empty skips the fundamentals check
     * @param riskMetrics  risk payload; null or empty skips the risk-metrics check
     * @return the outcome, never null
     */
    public ValidationOutcome validate(ConsensusRecommendation recommendation, double currentPrice,
                                      Map<String, ?> fundamentals, Map<String, ?> riskMetrics) {
        Objects.requireNonNull(recommendation, "recommendation");
        Levels original = Levels.of(recommendation);

        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Map<String, Double> corrections = new LinkedHashMap<>();
        runBattery(recommendation.action(), original, recommendation.atr(), currentPrice,
                   errors, warnings, corrections);

        List<ValidationIssue> metricErrors = new ArrayList<>();
        checkFundamentals(fundamentals != null ? fundamentals : Map.of(), metricErrors, warnings);
        checkRiskMetrics(riskMetrics != null ? riskMetrics : Map.of(), metricErrors, warnings);

        if (corrections.isEmpty()) {
            errors.addAll(metricErrors);
            return new ValidationOutcome(errors.isEmpty(), errors, warnings, corrections);
        }

        // ── re-check with corrections applied ──
        Levels corrected = original.with(corrections);
        List<ValidationIssue> remaining = new ArrayList<>();
        runBattery(recommendation.action(), corrected, recommendation.atr(), currentPrice,
                   remaining, new ArrayList<>(), new LinkedHashMap<>());

        Set<String> remainingKeys = new HashSet<>();
        remaining.forEach(e -> remainingKeys.add(key(e)));

        List<ValidationIssue> reconciled = new ArrayList<>();
        Set<String> originalKeys = new HashSet<>();
        for (ValidationIssue e : errors) {
            originalKeys.add(key(e));
            reconciled.add(remainingKeys.contains(key(e)) ? e : e.markResolved());
        }
        for (ValidationIssue e : remaining) {
            if (!originalKeys.contains(key(e))) reconciled.add(e);
        }
        reconciled.addAll(metricErrors);
        return new ValidationOutcome(remaining.isEmpty() && metricErrors.isEmpty(), reconciled, warnings, corrections);
    }

    // ── battery ───────────────────────────────────────────────────────────────

    private void runBattery(Action action, Levels v, Double atr, double currentPrice,
                            List<ValidationIssue> errors, List<ValidationIssue> warnings,
                            Map<String, Double> corrections) {
        checkPriceOrdering(action, v, errors);
        checkStopLoss(action, v, atr, errors, warnings, corrections);
        checkRiskReward(action, v, errors, warnings);
        checkActionTarget(action, v, currentPrice, errors, warnings);
        checkRanges(v, currentPrice, errors, corrections);
    }

    private void checkPriceOrdering(Action action, Levels v, List<ValidationIssue> errors) {
        if (action.isBuyClass() && !(v.stop < v.entry && v.entry < v.target)) {
            errors.add(new ValidationIssue(ValidationCheck.PRICE_ORDERING, null,
                String.format("%s requires stop < entry < target, got stop=%.2f entry=%.2f target=%.2f",
                              action, v.stop, v.entry, v.target), false));
        } else if (action.isSellClass() && !(v.target < v.entry && v.entry < v.stop)) {
            errors.add(new ValidationIssue(ValidationCheck.PRICE_ORDERING, null,
                String.format("%s requires target < entry < stop, got target=%.2f entry=%.2f stop=%.2f",
                              action, v.target, v.entry, v.stop), false));
        }
    }

    private void checkStopLoss(Action action, Levels v, Double atr, List<ValidationIssue> errors,
                               List<ValidationIssue> warnings, Map<String, Double> corrections) {
        if (v.entry <= 0.0) return;

        if (StopLossCalculator.isImplausible(v.stop, v.entry)) {
            double fallback = StopLossCalculator.fallbackStop(action, v.entry, atr, atrMultiplier);
            errors.add(new ValidationIssue(ValidationCheck.STOP_LOSS_SANITY, STOP_LOSS,
                String.format("stop_loss %.4f implausible for entry %.2f (unit confusion); corrected to %.2f via %s",
                              v.stop, v.entry, fallback, atr != null && atr > 0 ? "ATR" : "percentage fallback"),
                false));
            corrections.put(STOP_LOSS, fallback);
            return;
        }

        if (atr != null && atr > 0.0) {
            double expected = StopLossCalculator.fallbackStop(action, v.entry, atr, atrMultiplier);
            if (Math.abs(v.stop - expected) > atrTolerance * v.entry) {
                warnings.add(new ValidationIssue(ValidationCheck.STOP_LOSS_SANITY, STOP_LOSS,
                    String.format("stop_loss %.2f differs from ATR stop %.2f (ATR=%.2f, k=%.1f)",
                                  v.stop, expected, atr, atrMultiplier), false));
            }
        }
        if (Math.abs(v.entry - v.stop) > WIDE_STOP_FRACTION * v.entry) {
            warnings.add(new ValidationIssue(ValidationCheck.STOP_LOSS_SANITY, STOP_LOSS,
                String.format("stop_loss %.2f is more than %.0f%% from entry %.2f",
                              v.stop, WIDE_STOP_FRACTION * 100, v.entry), false));
        }
    }

    private void checkRiskReward(Action action, Levels v, List<ValidationIssue> errors,
                                 List<ValidationIssue> warnings) {
        if (!action.isBuyClass() && !action.isSellClass()) return;

        Double rr = RiskReward.ratio(action, v.entry, v.target, v.stop);
        if (rr == null) {
            errors.add(new ValidationIssue(ValidationCheck.RISK_REWARD, null,
                String.format("risk/reward undefined: risk leg ≤ 0 (entry=%.2f stop=%.2f)", v.entry, v.stop), false));
            return;
        }
        if (rr < 0.0) {
            errors.add(new ValidationIssue(ValidationCheck.RISK_REWARD, null,
                String.format("risk/reward %.2f is negative", rr), false));
            return;
        }
        if (action.isBuyClass() && rr < MIN_BUY_RISK_REWARD) {
            warnings.add(new ValidationIssue(ValidationCheck.RISK_REWARD, null,
                String.format("risk/reward %.2f below %.1f for %s", rr, MIN_BUY_RISK_REWARD, action), false));
        }
        if (rr > MAX_PLAUSIBLE_RISK_REWARD) {
            warnings.add(new ValidationIssue(ValidationCheck.RISK_REWARD, null,
                String.format("risk/reward %.2f unusually high (> %.0f)", rr, MAX_PLAUSIBLE_RISK_REWARD), false));
        }
        if (v.confidence >= HIGH_CONFIDENCE && rr < HIGH_CONFIDENCE_MIN_RR) {
            warnings.add(new ValidationIssue(ValidationCheck.RISK_REWARD, null,
                String.format("confidence %.2f is high but risk/reward only %.2f", v.confidence, rr), false));
        }
    }

    private void checkActionTarget(Action action, Levels v, double currentPrice,
                                   List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (currentPrice <= 0.0) return;

        if (action.isBuyClass() && v.target <= currentPrice) {
            errors.add(new ValidationIssue(ValidationCheck.ACTION_TARGET, TARGET_PRICE,
                String.format("%s target %.2f not above current price %.2f", action, v.target, currentPrice), false));
        } else if (action.isSellClass() && v.target >= currentPrice) {
            errors.add(new ValidationIssue(ValidationCheck.ACTION_TARGET, TARGET_PRICE,
                String.format("%s target %.2f not below current price %.2f", action, v.target, currentPrice), false));
        }
        if (v.target > MAX_TARGET_MULTIPLE * currentPrice) {
            warnings.add(new ValidationIssue(ValidationCheck.ACTION_TARGET, TARGET_PRICE,
                String.format("target %.2f exceeds %.0fx current price %.2f", v.target, MAX_TARGET_MULTIPLE, currentPrice),
                false));
        } else if (v.target > 0.0 && v.target < MIN_TARGET_MULTIPLE * currentPrice) {
            warnings.add(new ValidationIssue(ValidationCheck.ACTION_TARGET, TARGET_PRICE,
                String.format("target %.2f below %.1fx current price %.2f", v.target, MIN_TARGET_MULTIPLE, currentPrice),
                false));
        }
    }

    private void checkRanges(Levels v, double currentPrice, List<ValidationIssue> errors,
                             Map<String, Double> corrections) {
        if (Double.isNaN(v.confidence) || v.confidence < 0.0 || v.confidence > 1.0) {
            double clamped = Double.isNaN(v.confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, v.confidence));
            errors.add(new ValidationIssue(ValidationCheck.RANGE_PLAUSIBILITY, CONFIDENCE,
                String.format("confidence %.4f outside [0, 1]; clamped to %.2f", v.confidence, clamped), false));
            corrections.put(CONFIDENCE, clamped);
        }
        requirePositive(ENTRY_PRICE, v.entry, errors);
        requirePositive(TARGET_PRICE, v.target, errors);
        requirePositive(STOP_LOSS, v.stop, errors);
        if (!(currentPrice > 0.0)) {
            errors.add(new ValidationIssue(ValidationCheck.RANGE_PLAUSIBILITY, null,
                String.format("current price %.4f must be positive", currentPrice), false));
        }
    }

    // ── specialist metrics ────────────────────────────────────────────────────

    private void checkFundamentals(Map<String, ?> fundamentals, List<ValidationIssue> errors,
                                   List<ValidationIssue> warnings) {
        Double pe = ValueExtractor.firstNumber(fundamentals, "pe_ratio", "pe");
        if (pe != null) {
            if (pe < 0.0) {
                errors.add(metricIssue(ValidationCheck.FUNDAMENTALS, "pe_ratio",
                    String.format("P/E ratio %.2f cannot be negative", pe)));
            } else if (pe > EXTREME_PE) {
                warnings.add(metricIssue(ValidationCheck.FUNDAMENTALS, "pe_ratio",
                    String.format("P/E ratio %.2f is extremely high (> %.0f)", pe, EXTREME_PE)));
            }
        }

        Double roe = ValueExtractor.firstNumber(fundamentals, "roe", "return_on_equity");
        if (roe != null) {
            if (roe < -100.0) {
                errors.add(metricIssue(ValidationCheck.FUNDAMENTALS, "roe",
                    String.format("ROE %.2f%% below -100%% is impossible", roe)));
            } else if (roe > EXTREME_ROE_PCT) {
                warnings.add(metricIssue(ValidationCheck.FUNDAMENTALS, "roe",
                    String.format("ROE %.2f%% above %.0f%% is extremely high", roe, EXTREME_ROE_PCT)));
            }
        }

        requireWithinHundredPercent(fundamentals, "margin_of_safety", "margin of safety", errors);
        requireWithinHundredPercent(fundamentals, "profit_margin", "profit margin", errors);
    }

    private static void requireWithinHundredPercent(Map<String, ?> payload, String key, String label,
                                                    List<ValidationIssue> errors) {
        Double value = ValueExtractor.firstNumber(payload, key);
        if (value != null && (value > 100.0 || value < -100.0)) {
            errors.add(metricIssue(ValidationCheck.FUNDAMENTALS, key,
                String.format("%s %.2f%% outside ±100%% is impossible", label, value)));
        }
    }

    private void checkRiskMetrics(Map<String, ?> riskMetrics, List<ValidationIssue> errors,
                                  List<ValidationIssue> warnings) {
        Double sharpe = ValueExtractor.firstNumber(riskMetrics, "sharpe_ratio", "sharpe");
        if (sharpe != null) {
            if (sharpe > MAX_SHARPE) {
                errors.add(metricIssue(ValidationCheck.RISK_METRICS, "sharpe_ratio",
                    String.format("Sharpe ratio %.2f > %.0f is implausible", sharpe, MAX_SHARPE)));
            } else if (sharpe > RARE_SHARPE) {
                warnings.add(metricIssue(ValidationCheck.RISK_METRICS, "sharpe_ratio",
                    String.format("Sharpe ratio %.2f > %.0f is extremely rare", sharpe, RARE_SHARPE)));
            }
        }

        Double sortino = ValueExtractor.firstNumber(riskMetrics, "sortino_ratio", "sortino");
        if (sortino != null && sharpe != null && sharpe > 1.0 && sortino < sharpe * SORTINO_SHARPE_FLOOR) {
            warnings.add(metricIssue(ValidationCheck.RISK_METRICS, "sortino_ratio",
                String.format("Sortino %.2f far below Sharpe %.2f", sortino, sharpe)));
        }

        Double drawdown = ValueExtractor.firstNumber(riskMetrics, "max_drawdown", "max_drawdown_pct");
        if (drawdown != null) {
            if (drawdown > 100.0 || drawdown < 0.0) {
                errors.add(metricIssue(ValidationCheck.RISK_METRICS, "max_drawdown",
                    String.format("max drawdown %.2f%% outside [0, 100]%%", drawdown)));
            } else if (drawdown == 0.0
                       && ValueExtractor.number(riskMetrics.get("backtest_periods"), 0.0) > LONG_BACKTEST_PERIODS) {
                warnings.add(metricIssue(ValidationCheck.RISK_METRICS, "max_drawdown",
                    "max drawdown of 0% over more than " + LONG_BACKTEST_PERIODS + " periods is highly unusual"));
            }
        }
    }

    private static ValidationIssue metricIssue(ValidationCheck check, String field, String message) {
        return new ValidationIssue(check, field, message, false);
    }

    private static void requirePositive(String field, double value, List<ValidationIssue> errors) {
        if (!(value > 0.0)) {
            errors.add(new ValidationIssue(ValidationCheck.RANGE_PLAUSIBILITY, field,
                String.format("%s %.4f must be positive", field, value), false));
        }
    }

    private static String key(ValidationIssue issue) {
        return issue.check() + "|" + issue.field();
    }

    /** Working copy of the four checked fields. */
    private record Levels(double entry, double target, double stop, double confidence) {

        static Levels of(ConsensusRecommendation r) {
            return new Levels(r.entryPrice(), r.targetPrice(), r.stopLoss(), r.confidence());
        }

        Levels with(Map<String, Double> corrections) {
            return new Levels(
                corrections.getOrDefault(ENTRY_PRICE, entry),
                corrections.getOrDefault(TARGET_PRICE, target),
                corrections.getOrDefault(STOP_LOSS, stop),
                corrections.getOrDefault(CONFIDENCE, confidence));
        }
    }
}
