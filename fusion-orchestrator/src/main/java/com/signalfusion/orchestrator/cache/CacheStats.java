package com.signalfusion.orchestrator.cache;

/** Snapshot of {@link ResponseCache} counters. */
public record CacheStats(
    long hits,
    long misses,
    long errors,
    int entries,
    double hitRate,
    double costPerCall,
    double estimatedCostSaved
) {}
