package com.signalfusion.orchestrator.ai;

/** Language-model price/quality tier. */
public enum ModelTier {
    /** Fast, low-cost model for classification, extraction and short summaries. */
    CHEAP,
    /** Full-strength model for synthesis and other deep reasoning. */
    EXPENSIVE
}
