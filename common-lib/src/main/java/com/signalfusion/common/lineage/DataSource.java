package com.signalfusion.common.lineage;

/** Where a recorded value came from. */
public enum DataSource {
    MARKET_DATA,
    SPECIALIST,
    SEARCH,
    LLM,
    CALCULATED,
    CACHED,
    FALLBACK,
    USER_INPUT,
    INTERNAL
}
