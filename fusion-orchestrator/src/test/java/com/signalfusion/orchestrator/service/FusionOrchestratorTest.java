package com.signalfusion.orchestrator.service;

import com.signalfusion.common.consensus.EnrichmentContext;
import com.signalfusion.common.consensus.QuorumPolicy;
import com.signalfusion.common.consensus.WeightedConsensusStrategy;
import com.signalfusion.common.exception.InsufficientQuorumException;
import com.signalfusion.common.exception.PriceUnavailableException;
import com.signalfusion.common.lineage.DataSource;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.AnalysisTask;
import com.signalfusion.common.model.Capability;
import com.signalfusion.common.model.MarketQuote;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import com.signalfusion.common.validation.SynthesisValidator;
import com.signalfusion.common.validation.ValidationCheck;
import com.signalfusion.orchestrator.ai.LanguageModelClient;
import com.signalfusion.orchestrator.config.FusionProperties;
import com.signalfusion.orchestrator.dispatch.SpecialistDispatcher;
import com.signalfusion.orchestrator.enrichment.EnrichmentService;
import com.signalfusion.orchestrator.enrichment.GatheredEnrichment;
import com.signalfusion.orchestrator.logger.PipelineFlowLogger;
import com.signalfusion.orchestrator.market.MarketDataClient;
import com.signalfusion.orchestrator.specialist.Specialist;
import com.signalfusion.orchestrator.specialist.SpecialistContext;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome.Status;
import com.signalfusion.orchestrator.specialist.SpecialistRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end pipeline runs against in-memory specialists, quote source and publisher.
 */
class FusionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");
    private static final Set<Capability> SPECIALISTS_ONLY =
        EnumSet.complementOf(EnumSet.of(Capability.ENRICHMENT));

    private final List<FusionReport> published = new ArrayList<>();
    private final EnrichmentService enrichmentService = mock(EnrichmentService.class);

    private static Specialist fixed(SpecialistKind kind, double confidence, Map<String, Object> payload) {
        return new Specialist() {
            @Override public SpecialistKind kind() { return kind; }

            @Override
            public Mono<SpecialistResult> analyze(SpecialistContext context) {
                return Mono.just(SpecialistResult.of(kind, context.symbol(), payload, confidence));
            }
        };
    }

    private static MarketDataClient quoteAt(double price) {
        return symbol -> Mono.just(new MarketQuote(symbol, price, price, 1_000_000L, 2.5e12, NOW.minusSeconds(30)));
    }

    private static final MarketDataClient NO_QUOTE = symbol -> Mono.empty();
    private static final LanguageModelClient NO_LLM = (prompt, task) -> Mono.empty();

    private FusionOrchestrator orchestrator(MarketDataClient market, LanguageModelClient llm, Specialist... specialists) {
        FusionProperties properties = new FusionProperties();
        SpecialistDispatcher dispatcher = new SpecialistDispatcher(new SpecialistRegistry(List.of(specialists)),
            Duration.ofSeconds(1), 0, Duration.ofMillis(1), Duration.ofMillis(1));
        return new FusionOrchestrator(dispatcher,
            new WeightedConsensusStrategy(properties.getConsensus().toConsensusWeights()),
            QuorumPolicy.defaults(), new SynthesisValidator(), market, enrichmentService, llm,
            published::add, new PipelineFlowLogger(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AnalysisTask task(String... symbols) {
        return AnalysisTask.of(List.of(symbols), SPECIALISTS_ONLY);
    }

    // ── quorum ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("quorum")
    class QuorumTests {

        @Test
        @DisplayName("only sentiment responds → InsufficientQuorum, nothing published")
        void singleNonAnchor() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM,
                fixed(SpecialistKind.SENTIMENT, 0.9, Map.of("sentiment", "bullish")));

            StepVerifier.create(o.run(task("AAPL")))
                .expectErrorSatisfies(e -> {
                    InsufficientQuorumException q = assertInstanceOf(InsufficientQuorumException.class, e);
                    assertEquals("AAPL", q.getSymbol());
                    assertEquals(List.of(SpecialistKind.SENTIMENT), List.copyOf(q.getResponded()));
                })
                .verify();
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("fundamental plus news → finalized BUY with valuation levels")
        void fundamentalPlusNews() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM,
                fixed(SpecialistKind.FUNDAMENTAL, 0.8,
                      Map.of("signal", "BUY", "fair_value_high", 180.0, "fair_value", 170.0)),
                fixed(SpecialistKind.NEWS, 0.6, Map.of("sentiment", "bullish")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    assertEquals(1, reports.size());
                    FusionReport r = reports.get(0);
                    assertTrue(r.finalized());
                    assertEquals(Action.BUY, r.recommendation().action());
                    assertEquals(150.0, r.recommendation().entryPrice(), 1e-9);
                    assertEquals(180.0, r.recommendation().targetPrice(), 1e-9);
                    assertEquals(147.0, r.recommendation().stopLoss(), 1e-9);
                    assertTrue(r.recommendation().reasoning().contains("levels from"));

                    assertEquals(Status.SUCCESS, r.specialists().get(SpecialistKind.FUNDAMENTAL));
                    assertEquals(Status.ABSENT, r.specialists().get(SpecialistKind.TECHNICAL));
                    assertEquals(0.0, r.recommendation().consensusBreakdown().enrichmentWeight());
                    assertEquals(4, r.recommendation().consensusBreakdown().absentSpecialists().size());

                    assertNotNull(r.sizing());
                    assertTrue(r.sizing().recommended().shares() > 0);
                    assertTrue(r.sizing().recommended().positionPctOfAccount() <= 0.20 + 1e-9);
                    assertTrue(r.lineage().bySource().containsKey(DataSource.MARKET_DATA));
                    assertTrue(r.lineage().totalFields() > 0);
                })
                .verifyComplete();
            assertEquals(1, published.size());
        }
    }

    // ── market price ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("market price")
    class PriceTests {

        @Test
        @DisplayName("quote unavailable → technical current_price with FALLBACK lineage and ATR stop")
        void technicalFallback() {
            FusionOrchestrator o = orchestrator(NO_QUOTE, NO_LLM,
                fixed(SpecialistKind.TECHNICAL, 0.7, Map.of("signal", "BUY", "current_price", "$100.00", "atr", 2.0)),
                fixed(SpecialistKind.FUNDAMENTAL, 0.7, Map.of("signal", "BUY")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertTrue(r.finalized());
                    assertEquals(100.0, r.recommendation().entryPrice(), 1e-9);
                    assertEquals(96.0, r.recommendation().stopLoss(), 1e-9);
                    assertEquals(115.0, r.recommendation().targetPrice(), 1e-9);
                    assertTrue(r.lineage().bySource().containsKey(DataSource.FALLBACK));
                    assertFalse(r.lineage().bySource().containsKey(DataSource.MARKET_DATA));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no price from any source → PriceUnavailableException")
        void noPrice() {
            FusionOrchestrator o = orchestrator(NO_QUOTE, NO_LLM,
                fixed(SpecialistKind.TECHNICAL, 0.7, Map.of("signal", "BUY")),
                fixed(SpecialistKind.FUNDAMENTAL, 0.7, Map.of("signal", "BUY")));

            StepVerifier.create(o.run(task("AAPL")))
                .expectError(PriceUnavailableException.class)
                .verify();
        }
    }

    // ── validation and sizing ─────────────────────────────────────────────────

    @Nested
    @DisplayName("validation and sizing")
    class ValidationTests {

        @Test
        @DisplayName("inverted technical levels → not finalized, not sized, not published")
        void blocked() {
            FusionOrchestrator o = orchestrator(quoteAt(100.0), NO_LLM,
                fixed(SpecialistKind.TECHNICAL, 0.8,
                      Map.of("signal", "BUY", "entry_price", 100.0, "target_price", 90.0, "stop_loss", 95.0)),
                fixed(SpecialistKind.FUNDAMENTAL, 0.8, Map.of("signal", "BUY")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertFalse(r.finalized());
                    assertFalse(r.validation().valid());
                    assertFalse(r.validation().unresolvedErrors().isEmpty());
                    assertNull(r.sizing());
                })
                .verifyComplete();
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("HOLD is finalized but not sized")
        void holdNotSized() {
            FusionOrchestrator o = orchestrator(quoteAt(100.0), NO_LLM,
                fixed(SpecialistKind.FUNDAMENTAL, 0.8, Map.of("signal", "HOLD")),
                fixed(SpecialistKind.RISK, 0.8, Map.of("risk_level", "medium")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertEquals(Action.HOLD, r.recommendation().action());
                    assertTrue(r.finalized());
                    assertNull(r.sizing());
                })
                .verifyComplete();
            assertEquals(1, published.size());
        }

        @Test
        @DisplayName("negative P/E from the fundamental specialist blocks finalization")
        void impossibleFundamentalsBlock() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM,
                fixed(SpecialistKind.FUNDAMENTAL, 0.8,
                      Map.of("signal", "BUY", "fair_value_high", 180.0, "pe_ratio", -12.0)),
                fixed(SpecialistKind.NEWS, 0.6, Map.of("sentiment", "bullish")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertFalse(r.finalized());
                    assertTrue(r.validation().unresolvedErrors().stream()
                                .anyMatch(e -> e.check() == ValidationCheck.FUNDAMENTALS));
                    assertNull(r.sizing());
                })
                .verifyComplete();
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("Sharpe above 10 from the risk specialist blocks finalization")
        void impossibleSharpeBlocks() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM,
                fixed(SpecialistKind.FUNDAMENTAL, 0.8, Map.of("signal", "BUY", "fair_value_high", 180.0)),
                fixed(SpecialistKind.RISK, 0.8, Map.of("risk_level", "low", "sharpe_ratio", 12.0)));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertFalse(r.finalized());
                    assertTrue(r.validation().unresolvedErrors().stream()
                                .anyMatch(e -> e.check() == ValidationCheck.RISK_METRICS));
                })
                .verifyComplete();
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("unit-confused technical stop is corrected and the run still finalizes")
        void correctedStopFinalizes() {
            FusionOrchestrator o = orchestrator(quoteAt(100.0), NO_LLM,
                fixed(SpecialistKind.TECHNICAL, 0.8,
                      Map.of("signal", "BUY", "entry_price", 100.0, "target_price", 120.0, "stop_loss", 0.95)),
                fixed(SpecialistKind.FUNDAMENTAL, 0.8, Map.of("signal", "BUY")));

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertTrue(r.finalized());
                    assertEquals(98.0, r.recommendation().stopLoss(), 1e-9);
                    assertEquals(98.0, r.validation().correctedValues().get("stop_loss"), 1e-9);
                    assertTrue(r.lineage().bySource().containsKey(DataSource.CALCULATED));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("corrections trace back to the corrected field itself and entry price")
        void correctionLineageInputs() {
            assertEquals(List.of("confidence"), FusionOrchestrator.correctionInputs("confidence"));
            assertEquals(List.of("stop_loss", "entry_price"), FusionOrchestrator.correctionInputs("stop_loss"));
            assertEquals(List.of("target_price", "entry_price"), FusionOrchestrator.correctionInputs("target_price"));
            assertEquals(List.of("entry_price"), FusionOrchestrator.correctionInputs("entry_price"));
        }
    }

    // ── narrative and enrichment ──────────────────────────────────────────────

    @Nested
    @DisplayName("narrative and enrichment")
    class EnrichmentTests {

        private final Specialist fundamental = fixed(SpecialistKind.FUNDAMENTAL, 0.8,
            Map.of("signal", "BUY", "fair_value_high", 180.0));
        private final Specialist news = fixed(SpecialistKind.NEWS, 0.6, Map.of("signal", "BUY"));

        @Test
        @DisplayName("language-model narrative replaces the rule text and is tracked as LLM lineage")
        void llmNarrative() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0),
                (prompt, t) -> Mono.just("Valuation upside with supportive news flow."), fundamental, news);

            StepVerifier.create(o.run(task("AAPL")))
                .assertNext(reports -> {
                    assertEquals("Valuation upside with supportive news flow.",
                                 reports.get(0).recommendation().reasoning());
                    assertTrue(reports.get(0).lineage().bySource().containsKey(DataSource.LLM));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("bearish news blend pulls a BUY base down to HOLD")
        void blendMovesAction() {
            EnrichmentContext bearish = new EnrichmentContext(-1.0, 1.0, 1.0, null, null, null, null, null,
                                                              List.of("https://news.test/1"));
            when(enrichmentService.gather(eq("AAPL"), anyDouble()))
                .thenReturn(Mono.just(new GatheredEnrichment(bearish, 1, 0)));
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM, fundamental, news);

            StepVerifier.create(o.run(AnalysisTask.of("AAPL")))
                .assertNext(reports -> {
                    FusionReport r = reports.get(0);
                    assertEquals(Action.BUY, r.recommendation().consensusBreakdown().baseAction());
                    assertEquals(0.3, r.recommendation().consensusBreakdown().enrichmentWeight(), 1e-9);
                    assertEquals(0.05, r.recommendation().consensusBreakdown().finalScore(), 1e-9);
                    assertEquals(Action.HOLD, r.recommendation().action());
                    assertTrue(r.lineage().citations().contains("https://news.test/1"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("enrichment is not gathered unless requested")
        void notRequested() {
            FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM, fundamental, news);

            StepVerifier.create(o.run(task("AAPL")))
                .expectNextCount(1)
                .verifyComplete();
            verify(enrichmentService, never()).gather(eq("AAPL"), anyDouble());
        }
    }

    @Test
    @DisplayName("symbols are reported in task order")
    void multiSymbol() {
        FusionOrchestrator o = orchestrator(quoteAt(150.0), NO_LLM,
            fixed(SpecialistKind.FUNDAMENTAL, 0.8, Map.of("signal", "BUY", "fair_value_high", 180.0)),
            fixed(SpecialistKind.TECHNICAL, 0.8, Map.of("signal", "BUY")));

        StepVerifier.create(o.run(task("MSFT", "AAPL")))
            .assertNext(reports -> assertEquals(List.of("MSFT", "AAPL"),
                                                reports.stream().map(FusionReport::symbol).toList()))
            .verifyComplete();
        assertEquals(2, published.size());
    }
}
