package com.signalfusion.common.validation;

/** The validator's checks, in the order they run. */
public enum ValidationCheck {
    PRICE_ORDERING,
    STOP_LOSS_SANITY,
    RISK_REWARD,
    ACTION_TARGET,
    RANGE_PLAUSIBILITY,
    FUNDAMENTALS,
    RISK_METRICS
}
