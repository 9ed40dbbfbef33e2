package com.signalfusion.common.consensus;

/**
 * Entry/target/stop chosen for a recommendation, with the ATR used (null if unknown)
 * and a short note on where each level came from.
 */
public record PriceLevels(
    double entry,
    double target,
    double stop,
    Double atr,
    boolean fromTechnical,
    String basis
) {}
