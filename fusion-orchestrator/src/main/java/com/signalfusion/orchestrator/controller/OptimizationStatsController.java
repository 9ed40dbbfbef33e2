package com.signalfusion.orchestrator.controller;

import com.signalfusion.orchestrator.ai.ModelTierRouter;
import com.signalfusion.orchestrator.cache.CacheScope;
import com.signalfusion.orchestrator.cache.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Cost reporting for the response cache and the model-tier router. Resetting clears
 * counters only; cached entries stay valid.
 */
@RestController
@RequestMapping("/api/v1/optimization")
public class OptimizationStatsController {

    private static final Logger log = LoggerFactory.getLogger(OptimizationStatsController.class);

    private final ResponseCache responseCache;
    private final ModelTierRouter modelTierRouter;

    public OptimizationStatsController(ResponseCache responseCache, ModelTierRouter modelTierRouter) {
        this.responseCache = responseCache;
        this.modelTierRouter = modelTierRouter;
    }

    @GetMapping("/stats")
    public ResponseEntity<OptimizationStats> stats() {
        return ResponseEntity.ok(OptimizationStats.of(responseCache.stats(), modelTierRouter.stats()));
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<OptimizationStats> reset() {
        responseCache.resetStats();
        modelTierRouter.resetStats();
        log.info("OPTIMIZATION_STATS_RESET");
        return ResponseEntity.ok(OptimizationStats.of(responseCache.stats(), modelTierRouter.stats()));
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@RequestParam String symbol,
                                                          @RequestParam(required = false) String queryType) {
        CacheScope scope = new CacheScope(symbol, queryType);
        int removed = responseCache.invalidate(scope);
        return ResponseEntity.ok(Map.of(
            "symbol", scope.symbol(),
            "queryType", scope.queryType() != null ? scope.queryType() : "*",
            "removed", removed));
    }
}
