package com.signalfusion.common.risk;

/** Position-sizing models, in tie-break order for {@link PositionSizer#recommend}. */
public enum SizingMethod {
    FIXED_FRACTIONAL("fixed_fractional"),
    KELLY_CRITERION("kelly_criterion"),
    VOLATILITY_ADJUSTED("volatility_adjusted");

    private final String wireName;

    SizingMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
