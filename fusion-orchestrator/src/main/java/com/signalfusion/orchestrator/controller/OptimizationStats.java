package com.signalfusion.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.orchestrator.ai.RouterStats;
import com.signalfusion.orchestrator.cache.CacheStats;

/** Combined cost-optimization report: cache savings plus model-tier spend. */
public record OptimizationStats(
    @JsonProperty("cache") CacheStats cache,
    @JsonProperty("router") RouterStats router,
    @JsonProperty("totalSaved") double totalSaved
) {
    public static OptimizationStats of(CacheStats cache, RouterStats router) {
        return new OptimizationStats(cache, router, cache.estimatedCostSaved() + router.costSaved());
    }
}
