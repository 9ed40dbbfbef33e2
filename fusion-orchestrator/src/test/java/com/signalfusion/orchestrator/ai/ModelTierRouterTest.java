package com.signalfusion.orchestrator.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelTierRouterTest {

    private final ModelTierRouter router =
        new ModelTierRouter("cheap-model", "expensive-model", 0.002, 0.03);

    // ── routing ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("routing")
    class RoutingTests {

        @Test
        @DisplayName("final synthesis goes to the expensive tier")
        void synthesisIsExpensive() {
            assertEquals(TaskComplexity.COMPLEX, TaskDescriptor.of("synthesis_reasoning").complexity());
            assertEquals(ModelTier.EXPENSIVE, router.route(TaskDescriptor.of("synthesis_reasoning")));
        }

        @Test
        @DisplayName("headline extraction and sentiment classification stay cheap")
        void highVolumeIsCheap() {
            assertEquals(TaskComplexity.SIMPLE, TaskDescriptor.of("headline_extract").complexity());
            assertEquals(TaskComplexity.MODERATE, TaskDescriptor.of("sentiment_classify").complexity());
            assertEquals(ModelTier.CHEAP, router.route(TaskDescriptor.of("headline_extract")));
            assertEquals(ModelTier.CHEAP, router.route(TaskDescriptor.of("sentiment_classify")));
        }

        @Test
        @DisplayName("complex keyword in the hint wins over a simple task type")
        void hintEscalates() {
            assertEquals(ModelTier.EXPENSIVE, router.route(TaskDescriptor.of("news_summary", "blend into valuation")));
        }

        @Test
        @DisplayName("unknown task is MODERATE and routes cheap")
        void unknownTask() {
            assertEquals(TaskComplexity.MODERATE, TaskDescriptor.of("misc").complexity());
            assertEquals(ModelTier.CHEAP, router.route(TaskDescriptor.of("misc")));
        }

        @Test
        @DisplayName("forced tier overrides complexity")
        void forcedTier() {
            assertEquals(ModelTier.CHEAP, router.route(TaskDescriptor.forced("synthesis_reasoning", ModelTier.CHEAP)));
        }

        @Test
        @DisplayName("same descriptor always routes the same way")
        void deterministic() {
            TaskDescriptor task = TaskDescriptor.of("risk_assessment");
            ModelTier first = router.route(task);
            router.record(first, 1000, 0.03);
            assertEquals(first, router.route(task));
        }
    }

    // ── stats ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stats")
    class StatsTests {

        @Test
        @DisplayName("three cheap calls and one expensive call")
        void mixedUsage() {
            router.record(ModelTier.CHEAP, 100, 0.002);
            router.record(ModelTier.CHEAP, 100, 0.002);
            router.record(ModelTier.CHEAP, 100, 0.002);
            router.record(ModelTier.EXPENSIVE, 500, 0.03);

            RouterStats stats = router.stats();
            assertEquals(4, stats.totalCalls());
            assertEquals(3L, stats.callsByTier().get(ModelTier.CHEAP));
            assertEquals(500L, stats.tokensByTier().get(ModelTier.EXPENSIVE));
            assertEquals(75.0, stats.cheapPercentage(), 1e-9);
            assertEquals(0.036, stats.actualCost(), 1e-9);
            assertEquals(0.12, stats.alwaysExpensiveCost(), 1e-9);
            assertEquals(0.084, stats.costSaved(), 1e-9);
            assertEquals(0.009, stats.averageCostPerCall(), 1e-9);
        }

        @Test
        @DisplayName("empty stats have no division by zero")
        void empty() {
            RouterStats stats = router.stats();
            assertEquals(0, stats.totalCalls());
            assertEquals(0.0, stats.cheapPercentage());
            assertEquals(0.0, stats.averageCostPerCall());
        }

        @Test
        @DisplayName("reset zeroes every counter")
        void reset() {
            router.record(ModelTier.EXPENSIVE, 500, 0.03);
            router.resetStats();

            RouterStats stats = router.stats();
            assertEquals(0, stats.totalCalls());
            assertEquals(0L, stats.tokensByTier().get(ModelTier.EXPENSIVE));
            assertEquals(0.0, stats.actualCost(), 1e-9);
        }
    }
}
