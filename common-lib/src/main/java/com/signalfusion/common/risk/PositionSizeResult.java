package com.signalfusion.common.risk;

/**
 * Output of one {@link SizingMethod}.
 *
 * @param method              the sizing model used
 * @param shares              whole shares, never negative; 0 when sizing is infeasible
 * @param positionValue       shares × entry
 * @param capitalAtRisk       shares × |entry − stop|, never above {@code riskPct × account}
 * @param positionPctOfAccount positionValue / account
 * @param riskPerShare        |entry − stop|
 * @param riskPct             risk fraction this method budgeted
 * @param reason              human-readable derivation; explains why when shares is 0
 */
public record PositionSizeResult(
    SizingMethod method,
    long shares,
    double positionValue,
    double capitalAtRisk,
    double positionPctOfAccount,
    double riskPerShare,
    double riskPct,
    String reason
) {
    public static PositionSizeResult infeasible(SizingMethod method, String reason) {
        return new PositionSizeResult(method, 0L, 0.0, 0.0, 0.0, 0.0, 0.0, reason);
    }

    public boolean feasible() {
        return shares > 0;
    }
}
