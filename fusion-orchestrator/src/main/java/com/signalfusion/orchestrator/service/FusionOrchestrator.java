package com.signalfusion.orchestrator.service;

import com.signalfusion.common.consensus.BlendedConsensus;
import com.signalfusion.common.consensus.ConsensusEngine;
import com.signalfusion.common.consensus.ConsensusResult;
import com.signalfusion.common.consensus.ConsensusWeights;
import com.signalfusion.common.consensus.EnrichmentBlender;
import com.signalfusion.common.consensus.PriceLevelResolver;
import com.signalfusion.common.consensus.PriceLevels;
import com.signalfusion.common.consensus.QuorumPolicy;
import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.exception.PriceUnavailableException;
import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.common.lineage.DataReliability;
import com.signalfusion.common.lineage.DataSource;
import com.signalfusion.common.lineage.LineageTracker;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.AnalysisTask;
import com.signalfusion.common.model.ConsensusRecommendation;
import com.signalfusion.common.model.MarketQuote;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import com.signalfusion.common.risk.PositionSizer;
import com.signalfusion.common.risk.SizingRecommendation;
import com.signalfusion.common.trace.TraceContextUtil;
import com.signalfusion.common.validation.SynthesisValidator;
import com.signalfusion.common.validation.ValidationOutcome;
import com.signalfusion.orchestrator.ai.LanguageModelClient;
import com.signalfusion.orchestrator.ai.TaskDescriptor;
import com.signalfusion.orchestrator.config.FusionProperties;
import com.signalfusion.orchestrator.dispatch.SpecialistDispatcher;
import com.signalfusion.orchestrator.enrichment.EnrichmentService;
import com.signalfusion.orchestrator.enrichment.GatheredEnrichment;
import com.signalfusion.orchestrator.logger.PipelineFlowLogger;
import com.signalfusion.orchestrator.market.MarketDataClient;
import com.signalfusion.orchestrator.publisher.RecommendationPublisher;
import com.signalfusion.orchestrator.specialist.SpecialistContext;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the fusion pipeline for every symbol of an {@link AnalysisTask}.
 *
 * <p>Per symbol, in order: quote → concurrent specialist dispatch (timeout, retry, absent) →
 * quorum → weighted consensus → optional enrichment blend → price levels → narrative →
 * validation with auto-correction → position sizing → publish. Symbols are processed one
 * after another; specialists of one symbol run concurrently.
 *
 * <p>Every path ends in a {@link FusionReport} or a {@link FusionException}. An
 * {@code InsufficientQuorumException} or {@code PriceUnavailableException} for any symbol
 * fails the whole task. A report whose validation leaves hard errors is returned with
 * {@code finalized=false} and is not published.
 *
 * <p>Lineage is recorded per symbol in a fresh {@link LineageTracker}.
 */
@Service
public class FusionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FusionOrchestrator.class);

    static final String MARKET_PRICE = "market_price";
    static final String REASONING    = "reasoning";
    static final String SYNTHESIS_TASK = "synthesis_reasoning";
    private static final double FALLBACK_PRICE_CONFIDENCE_FACTOR = 0.5;
    private static final double QUOTE_CONFIDENCE = 0.95;

    private final SpecialistDispatcher dispatcher;
    private final ConsensusEngine consensusEngine;
    private final QuorumPolicy quorumPolicy;
    private final SynthesisValidator validator;
    private final MarketDataClient marketDataClient;
    private final EnrichmentService enrichmentService;
    private final LanguageModelClient languageModelClient;
    private final RecommendationPublisher publisher;
    private final PipelineFlowLogger flowLogger;
    private final FusionProperties properties;
    private final ConsensusWeights weights;
    private final Clock clock;

    public FusionOrchestrator(SpecialistDispatcher dispatcher,
                              ConsensusEngine consensusEngine,
                              QuorumPolicy quorumPolicy,
                              SynthesisValidator validator,
                              MarketDataClient marketDataClient,
                              EnrichmentService enrichmentService,
                              LanguageModelClient languageModelClient,
                              RecommendationPublisher publisher,
                              PipelineFlowLogger flowLogger,
                              FusionProperties properties,
                              Clock clock) {
        this.dispatcher          = dispatcher;
        this.consensusEngine     = consensusEngine;
        this.quorumPolicy        = quorumPolicy;
        this.validator           = validator;
        this.marketDataClient    = marketDataClient;
        this.enrichmentService   = enrichmentService;
        this.languageModelClient = languageModelClient;
        this.publisher           = publisher;
        this.flowLogger          = flowLogger;
        this.properties          = properties;
        this.weights             = properties.getConsensus().toConsensusWeights();
        this.clock               = clock;
    }

    /**
     * @return one report per symbol in task order, or an error if any symbol fails
     */
    public Mono<List<FusionReport>> run(AnalysisTask task) {
        log.info("TASK_STARTED taskId={} symbols={} capabilities={} priority={}",
                 task.id(), task.symbols(), task.capabilities(), task.priority());
        return Flux.fromIterable(task.symbols())
            .concatMap(symbol -> analyzeSymbol(task, symbol))
            .collectList()
            .doOnNext(reports -> log.info("TASK_COMPLETED taskId={} reports={} finalized={}",
                task.id(), reports.size(), reports.stream().filter(FusionReport::finalized).count()))
            .doOnError(e -> log.warn("TASK_FAILED taskId={} reason={}", task.id(), e.getMessage()));
    }

    private Mono<FusionReport> analyzeSymbol(AnalysisTask task, String symbol) {
        String traceId = TraceContextUtil.newTraceId();
        LineageTracker lineage = new LineageTracker(clock);
        Set<SpecialistKind> requested = task.requestedSpecialists();
        flowLogger.log(PipelineFlowLogger.TASK_RECEIVED, traceId, symbol, "taskId=" + task.id());

        Mono<FusionReport> pipeline = marketDataClient.getQuote(symbol)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(quote -> {
                MarketQuote usable = quote.filter(MarketQuote::hasUsablePrice).orElse(null);
                if (usable != null) {
                    lineage.track(MARKET_PRICE, usable.price(), DataSource.MARKET_DATA, DataReliability.HIGH,
                                  QUOTE_CONFIDENCE, usable.timestamp(), false, "market-data:" + symbol);
                }
                return dispatcher.dispatch(SpecialistContext.of(symbol, quote.orElse(null)), requested)
                    .doOnEach(flowLogger.stage(PipelineFlowLogger.SPECIALISTS_COMPLETED))
                    .flatMap(outcomes -> fuse(task, symbol, traceId, requested, usable, outcomes, lineage));
            })
            .onErrorMap(e -> !(e instanceof FusionException),
                        e -> new FusionException(symbol, "fusion pipeline failed: " + e.getMessage(), e));

        return TraceContextUtil.withTrace(pipeline, traceId, symbol);
    }

    private Mono<FusionReport> fuse(AnalysisTask task, String symbol, String traceId,
                                    Set<SpecialistKind> requested, MarketQuote quote,
                                    List<SpecialistOutcome> outcomes, LineageTracker lineage) {
        Map<SpecialistKind, SpecialistResult> byKind = new EnumMap<>(SpecialistKind.class);
        outcomes.stream().filter(SpecialistOutcome::isSuccess)
                .forEach(o -> byKind.put(o.kind(), o.result()));

        quorumPolicy.enforce(symbol, byKind.keySet());
        flowLogger.log(PipelineFlowLogger.QUORUM_CHECKED, traceId, symbol,
                       "responded=" + byKind.keySet() + " requested=" + requested.size());

        byKind.values().forEach(r -> lineage.track(
            specialistField(r.kind()), r.payload(), DataSource.SPECIALIST, reliabilityOf(r.confidence()),
            r.confidence(), r.producedAt(), false, r.citations().isEmpty() ? null : r.citations().get(0)));

        ConsensusResult base = consensusEngine.compute(new ArrayList<>(byKind.values()), requested);
        flowLogger.log(PipelineFlowLogger.CONSENSUS_MERGED, traceId, symbol,
                       String.format("action=%s score=%.3f confidence=%.3f absent=%s",
                                     base.action(), base.score(), base.confidence(), base.absent()));

        SpecialistResult technical = byKind.get(SpecialistKind.TECHNICAL);
        SpecialistResult fundamental = byKind.get(SpecialistKind.FUNDAMENTAL);
        SpecialistResult risk = byKind.get(SpecialistKind.RISK);
        double marketPrice = resolveMarketPrice(symbol, quote, technical, lineage);

        Mono<BlendedConsensus> blended = task.enrichmentRequested()
            ? enrichmentService.gather(symbol, base.score())
                .map(gathered -> blend(base, gathered, lineage))
            : Mono.just(EnrichmentBlender.passThrough(base));

        return blended.flatMap(blend -> {
            flowLogger.log(PipelineFlowLogger.ENRICHMENT_BLENDED, traceId, symbol,
                           String.format("action=%s finalScore=%.3f enrichmentWeight=%.2f parts=%s",
                                         blend.action(), blend.finalScore(), blend.enrichmentWeight(),
                                         blend.partsApplied()));

            PriceLevels levels = PriceLevelResolver.resolve(blend.action(), marketPrice, technical, fundamental);
            trackLevels(levels, technical, blend.finalConfidence(), lineage);
            String ruleReasoning = ruleReasoning(base, blend, levels);

            return narrative(symbol, base, blend, levels, ruleReasoning, lineage)
                .map(reasoning -> finish(task, symbol, traceId, marketPrice, technical, fundamental, risk,
                                         outcomes, lineage,
                    new ConsensusRecommendation(symbol, blend.action(), levels.entry(), levels.target(),
                        levels.stop(), blend.finalConfidence(), reasoning, levels.atr(),
                        EnrichmentBlender.breakdown(base, blend))));
        });
    }

    private FusionReport finish(AnalysisTask task, String symbol, String traceId, double marketPrice,
                                SpecialistResult technical, SpecialistResult fundamental,
                                SpecialistResult risk, List<SpecialistOutcome> outcomes,
                                LineageTracker lineage, ConsensusRecommendation recommendation) {
        ValidationOutcome validation = validator.validate(recommendation, marketPrice,
            fundamental != null ? fundamental.payload() : Map.of(),
            risk != null ? risk.payload() : Map.of());
        ConsensusRecommendation corrected = validation.apply(recommendation);
        validation.correctedValues().forEach((field, value) ->
            lineage.trackCalculated(field, value, correctionInputs(field), corrected.confidence()));
        flowLogger.log(PipelineFlowLogger.VALIDATED, traceId, symbol,
                       String.format("valid=%s errors=%d warnings=%d corrected=%s", validation.valid(),
                                     validation.errors().size(), validation.warnings().size(),
                                     validation.correctedValues().keySet()));

        boolean finalized = validation.valid();
        SizingRecommendation sizing = null;
        if (finalized && corrected.action() != Action.HOLD) {
            Double volatility = technical != null
                ? ValueExtractor.firstNumber(technical.payload(), "volatility", "annualized_volatility")
                : null;
            FusionProperties.Sizing cfg = properties.getSizing();
            sizing = PositionSizer.recommend(cfg.getAccountValue(), corrected.entryPrice(), corrected.stopLoss(),
                                             corrected.targetPrice(), cfg.toParameters().withVolatility(volatility));
            flowLogger.log(PipelineFlowLogger.SIZED, traceId, symbol,
                           String.format("method=%s shares=%d", sizing.recommendedMethod(),
                                         sizing.recommended().shares()));
        }

        Map<SpecialistKind, SpecialistOutcome.Status> statuses = outcomes.stream()
            .collect(Collectors.toMap(SpecialistOutcome::kind, SpecialistOutcome::status,
                                      (a, b) -> b, () -> new EnumMap<>(SpecialistKind.class)));

        FusionReport report = new FusionReport(task.id(), traceId, symbol, corrected, validation, sizing,
                                               lineage.summary(), statuses, finalized, clock.instant());
        if (finalized) {
            publisher.publish(report);
            flowLogger.log(PipelineFlowLogger.PUBLISHED, traceId, symbol);
        } else {
            TraceContextUtil.withMdc(traceId, symbol, () ->
                log.warn("VALIDATION_BLOCKED symbol={} errors={}", symbol, validation.errorMessages()));
        }
        return report;
    }

    // ── market price ──────────────────────────────────────────────────────────

    private double resolveMarketPrice(String symbol, MarketQuote quote, SpecialistResult technical,
                                      LineageTracker lineage) {
        if (quote != null) return quote.price();

        Double fallback = technical != null
            ? ValueExtractor.firstPrice(technical.payload(), "current_price", "price")
            : null;
        if (fallback == null) {
            throw new PriceUnavailableException(symbol);
        }
        log.warn("PRICE_FALLBACK symbol={} source=technical price={}", symbol, fallback);
        lineage.track(MARKET_PRICE, fallback, DataSource.FALLBACK, DataReliability.FALLBACK,
                      technical.confidence() * FALLBACK_PRICE_CONFIDENCE_FACTOR, technical.producedAt(),
                      false, "technical specialist current_price");
        return fallback;
    }

    // ── enrichment ────────────────────────────────────────────────────────────

    private BlendedConsensus blend(ConsensusResult base, GatheredEnrichment gathered, LineageTracker lineage) {
        BlendedConsensus blend = EnrichmentBlender.blend(base, gathered.context(), weights);
        if (!gathered.context().isEmpty()) {
            List<String> citations = gathered.context().citations();
            lineage.track("enrichment_adjustment", blend.adjustment(),
                          gathered.fullyCached() ? DataSource.CACHED : DataSource.SEARCH,
                          DataReliability.LOW, blend.enrichmentConfidence(), clock.instant(),
                          gathered.cacheHits() > 0, citations.isEmpty() ? null : citations.get(0));
        }
        return blend;
    }

    // ── lineage helpers ───────────────────────────────────────────────────────

    /** Upstream fields a validator correction of {@code field} was derived from. */
    static List<String> correctionInputs(String field) {
        return switch (field) {
            case ConsensusRecommendation.CONFIDENCE -> List.of(ConsensusRecommendation.CONFIDENCE);
            case ConsensusRecommendation.STOP_LOSS, ConsensusRecommendation.TARGET_PRICE ->
                List.of(field, ConsensusRecommendation.ENTRY_PRICE);
            default -> List.of(ConsensusRecommendation.ENTRY_PRICE);
        };
    }

    private void trackLevels(PriceLevels levels, SpecialistResult technical, double confidence,
                             LineageTracker lineage) {
        if (levels.fromTechnical()) {
            for (String field : List.of(ConsensusRecommendation.ENTRY_PRICE, ConsensusRecommendation.TARGET_PRICE,
                                        ConsensusRecommendation.STOP_LOSS)) {
                lineage.track(field, valueOf(levels, field), DataSource.SPECIALIST,
                              reliabilityOf(technical.confidence()), technical.confidence(),
                              technical.producedAt(), false, "technical specialist levels");
            }
        } else {
            lineage.trackCalculated(ConsensusRecommendation.ENTRY_PRICE, levels.entry(), List.of(MARKET_PRICE), confidence);
            lineage.trackCalculated(ConsensusRecommendation.TARGET_PRICE, levels.target(),
                                    List.of(MARKET_PRICE, specialistField(SpecialistKind.FUNDAMENTAL)), confidence);
            lineage.trackCalculated(ConsensusRecommendation.STOP_LOSS, levels.stop(),
                                    List.of(MARKET_PRICE, specialistField(SpecialistKind.TECHNICAL)), confidence);
        }
        lineage.trackCalculated(ConsensusRecommendation.CONFIDENCE, confidence,
                                lineage.records().keySet().stream()
                                       .filter(f -> f.startsWith("specialist.")).toList(),
                                confidence);
    }

    private static double valueOf(PriceLevels levels, String field) {
        return switch (field) {
            case ConsensusRecommendation.ENTRY_PRICE  -> levels.entry();
            case ConsensusRecommendation.TARGET_PRICE -> levels.target();
            default                                   -> levels.stop();
        };
    }

    static String specialistField(SpecialistKind kind) {
        return "specialist." + kind.wireName();
    }

    private static DataReliability reliabilityOf(double confidence) {
        if (confidence >= 0.8) return DataReliability.HIGH;
        if (confidence >= 0.5) return DataReliability.MEDIUM;
        return DataReliability.LOW;
    }

    // ── reasoning ─────────────────────────────────────────────────────────────

    private Mono<String> narrative(String symbol, ConsensusResult base, BlendedConsensus blend,
                                   PriceLevels levels, String ruleReasoning, LineageTracker lineage) {
        String prompt = String.format(
            "Write a concise (3-4 sentence) rationale for a %s recommendation on %s.%n"
            + "Weighted specialist score %.3f, agreement %.0f%%, confidence %.2f.%n"
            + "Specialist signals: %s.%nDissenting: %s. Risk adjustments: %s.%n"
            + "Entry %.2f, target %.2f, stop %.2f (%s).%n"
            + "Enrichment adjustment %.3f at weight %.2f. State only what these numbers support.",
            blend.action(), symbol, base.score(), base.agreement() * 100, blend.finalConfidence(),
            base.contributions().values().stream()
                .map(c -> c.kind().wireName() + "=" + c.signal())
                .collect(Collectors.joining(", ")),
            base.dissenters(), base.riskAdjustments(),
            levels.entry(), levels.target(), levels.stop(), levels.basis(),
            blend.adjustment(), blend.enrichmentWeight());

        return languageModelClient.complete(prompt, TaskDescriptor.of(SYNTHESIS_TASK))
            .filter(text -> !text.isBlank())
            .doOnNext(text -> lineage.trackGenerated(REASONING, text, "language-model", blend.finalConfidence()))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                lineage.track(REASONING, ruleReasoning, DataSource.INTERNAL, DataReliability.MEDIUM,
                              blend.finalConfidence(), clock.instant(), false, null);
                return ruleReasoning;
            }));
    }

    static String ruleReasoning(ConsensusResult base, BlendedConsensus blend, PriceLevels levels) {
        StringBuilder sb = new StringBuilder(base.reasoning());
        if (blend.enrichmentWeight() > 0.0) {
            sb.append(String.format("; enrichment %s adjusted score by %.3f (weight %.2f) to %.3f",
                                    blend.partsApplied(), blend.adjustment(), blend.enrichmentWeight(),
                                    blend.finalScore()));
        }
        sb.append("; levels from ").append(levels.basis());
        return sb.toString();
    }
}
