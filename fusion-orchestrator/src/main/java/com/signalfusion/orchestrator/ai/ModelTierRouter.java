package com.signalfusion.orchestrator.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Chooses a {@link ModelTier} per task and tracks what the calls cost.
 *
 * <p>{@link #route(TaskDescriptor)} is a pure function of the descriptor: a forced tier wins,
 * otherwise COMPLEX tasks go to {@link ModelTier#EXPENSIVE} and everything else to
 * {@link ModelTier#CHEAP}. Usage counters are atomics, shared by every caller in the process.
 */
public class ModelTierRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelTierRouter.class);

    private final Map<ModelTier, String> models;
    private final Map<ModelTier, Double> costPerCall;

    private final Map<ModelTier, AtomicLong> calls  = new EnumMap<>(ModelTier.class);
    private final Map<ModelTier, AtomicLong> tokens = new EnumMap<>(ModelTier.class);
    private final DoubleAdder actualCost = new DoubleAdder();

    public ModelTierRouter(String cheapModel, String expensiveModel,
                           double cheapCostPerCall, double expensiveCostPerCall) {
        Map<ModelTier, String> m = new EnumMap<>(ModelTier.class);
        m.put(ModelTier.CHEAP, cheapModel);
        m.put(ModelTier.EXPENSIVE, expensiveModel);
        this.models = Collections.unmodifiableMap(m);

        Map<ModelTier, Double> c = new EnumMap<>(ModelTier.class);
        c.put(ModelTier.CHEAP, cheapCostPerCall);
        c.put(ModelTier.EXPENSIVE, expensiveCostPerCall);
        this.costPerCall = Collections.unmodifiableMap(c);

        for (ModelTier tier : ModelTier.values()) {
            calls.put(tier, new AtomicLong());
            tokens.put(tier, new AtomicLong());
        }
    }

    public ModelTier route(TaskDescriptor task) {
        if (task.forcedTier() != null) {
            log.info("MODEL_TIER_SELECTED taskType={} tier={} (forced)", task.taskType(), task.forcedTier());
            return task.forcedTier();
        }
        TaskComplexity complexity = task.complexity();
        ModelTier tier = complexity == TaskComplexity.COMPLEX ? ModelTier.EXPENSIVE : ModelTier.CHEAP;
        log.info("MODEL_TIER_SELECTED taskType={} complexity={} tier={} model={}",
                 task.taskType(), complexity, tier, models.get(tier));
        return tier;
    }

    /** Model identifier sent to the provider for {@code tier}. */
    public String modelFor(ModelTier tier) {
        return models.get(tier);
    }

    /** Configured price of one call on {@code tier}. */
    public double costPerCall(ModelTier tier) {
        return costPerCall.get(tier);
    }

    public void record(ModelTier tier, long tokenCount, double cost) {
        calls.get(tier).incrementAndGet();
        tokens.get(tier).addAndGet(Math.max(0L, tokenCount));
        actualCost.add(Math.max(0.0, cost));
    }

    public RouterStats stats() {
        Map<ModelTier, Long> callSnapshot = new EnumMap<>(ModelTier.class);
        Map<ModelTier, Long> tokenSnapshot = new EnumMap<>(ModelTier.class);
        long total = 0;
        for (ModelTier tier : ModelTier.values()) {
            long n = calls.get(tier).get();
            callSnapshot.put(tier, n);
            tokenSnapshot.put(tier, tokens.get(tier).get());
            total += n;
        }
        double actual = actualCost.sum();
        double alwaysExpensive = total * costPerCall.get(ModelTier.EXPENSIVE);
        return new RouterStats(
            callSnapshot, tokenSnapshot, total,
            total == 0 ? 0.0 : 100.0 * callSnapshot.get(ModelTier.CHEAP) / total,
            actual, alwaysExpensive, alwaysExpensive - actual,
            total == 0 ? 0.0 : actual / total);
    }

    public void resetStats() {
        calls.values().forEach(c -> c.set(0));
        tokens.values().forEach(t -> t.set(0));
        actualCost.reset();
        log.info("ROUTER_STATS_RESET");
    }
}
