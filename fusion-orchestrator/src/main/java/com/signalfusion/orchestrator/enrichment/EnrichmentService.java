package com.signalfusion.orchestrator.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalfusion.common.consensus.EnrichmentContext;
import com.signalfusion.orchestrator.search.SearchClient;
import com.signalfusion.orchestrator.search.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Gathers the news, social and macro context used by the second-pass blend.
 *
 * <p>The three searches run concurrently through the cached {@link SearchClient}. Each part is
 * scored from the provider's {@code sentiment_score} when it sends one, otherwise by keyword
 * count over result titles and content:
 * <pre>
 *   bullish hits &gt; bearish hits + 2  →  +0.6      (confidence 0.4)
 *   bearish hits &gt; bullish hits + 2  →  -0.6
 *   otherwise                        →   0.0
 * </pre>
 * News is scaled by how far it diverges from the base score; retail divergence is measured
 * against news sentiment; macro is the market score times its confidence. A missing part
 * stays null and is skipped by the blend.
 */
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    static final double KEYWORD_SCORE       = 0.6;
    static final double KEYWORD_CONFIDENCE  = 0.4;
    static final double PROVIDER_CONFIDENCE = 0.7;
    private static final int KEYWORD_MARGIN = 2;

    private static final List<String> BULLISH = List.of(
        "upgrade", "beat", "surge", "rally", "growth", "buy", "positive", "bullish", "outperform", "record high");
    private static final List<String> BEARISH = List.of(
        "downgrade", "miss", "plunge", "decline", "sell", "negative", "warning", "bearish", "lawsuit", "cut guidance");
    private static final List<String> MACRO_BULLISH = List.of(
        "rally", "growth", "expansion", "strong economy", "optimistic", "rate cut", "dovish");
    private static final List<String> MACRO_BEARISH = List.of(
        "recession", "contraction", "downturn", "weak", "pessimistic", "rate hike", "hawkish");

    private final SearchClient searchClient;

    public EnrichmentService(SearchClient searchClient) {
        this.searchClient = searchClient;
    }

    /**
     * @param baseScore the base consensus score, used to weigh how much news changes it
     * @return the context, never an error; parts whose search failed are null
     */
    public Mono<GatheredEnrichment> gather(String symbol, double baseScore) {
        Mono<Optional<SearchResponse>> news = optional(searchClient.search(
            "news", symbol, symbol + " stock news latest earnings analyst rating", "advanced", 10));
        Mono<Optional<SearchResponse>> social = optional(searchClient.search(
            "social", symbol, symbol + " stock reddit twitter retail investor sentiment", "basic", 10));
        Mono<Optional<SearchResponse>> macro = optional(searchClient.search(
            "macro", symbol, "stock market outlook federal reserve economy " + symbol + " sector", "basic", 8));

        return Mono.zip(news, social, macro)
            .map(t -> build(symbol, baseScore, t.getT1(), t.getT2(), t.getT3()))
            .onErrorResume(e -> {
                log.warn("ENRICHMENT_FAILED symbol={} reason={}", symbol, e.getMessage());
                return Mono.just(GatheredEnrichment.none());
            });
    }

    private GatheredEnrichment build(String symbol, double baseScore, Optional<SearchResponse> news,
                                     Optional<SearchResponse> social, Optional<SearchResponse> macro) {
        int searches = 0;
        int cacheHits = 0;
        List<String> citations = new ArrayList<>();

        Double newsSentiment = null, newsScore = null, newsConfidence = null;
        if (news.isPresent()) {
            searches++;
            if (news.get().cacheHit()) cacheHits++;
            Scored s = score(news.get(), BULLISH, BEARISH);
            newsSentiment = s.score();
            newsConfidence = s.confidence();
            newsScore = Math.min(1.0, Math.abs(baseScore - s.score()) * s.confidence());
            citations.addAll(news.get().citations());
        }

        Double retailSentiment = null, retailDivergence = null, retailConfidence = null;
        if (social.isPresent()) {
            searches++;
            if (social.get().cacheHit()) cacheHits++;
            Scored s = score(social.get(), BULLISH, BEARISH);
            retailSentiment = s.score();
            retailConfidence = s.confidence();
            retailDivergence = Math.abs(s.score() - (newsSentiment != null ? newsSentiment : 0.0));
            citations.addAll(social.get().citations());
        }

        Double macroScore = null, macroConfidence = null;
        if (macro.isPresent()) {
            searches++;
            if (macro.get().cacheHit()) cacheHits++;
            Scored s = score(macro.get(), MACRO_BULLISH, MACRO_BEARISH);
            macroScore = s.score() * s.confidence();
            macroConfidence = s.confidence();
            citations.addAll(macro.get().citations());
        }

        EnrichmentContext context = new EnrichmentContext(
            newsSentiment, newsScore, newsConfidence,
            retailSentiment, retailDivergence, retailConfidence,
            macroScore, macroConfidence,
            citations.stream().distinct().toList());
        log.info("ENRICHMENT_GATHERED symbol={} news={} retail={} macro={} searches={} cacheHits={}",
                 symbol, newsSentiment, retailSentiment, macroScore, searches, cacheHits);
        return new GatheredEnrichment(context, searches, cacheHits);
    }

    static Scored score(SearchResponse response, List<String> bullish, List<String> bearish) {
        JsonNode provided = response.body().path("sentiment_score");
        if (provided.isNumber()) {
            double conf = response.body().path("confidence").asDouble(PROVIDER_CONFIDENCE);
            return new Scored(clamp(provided.asDouble()), Math.max(0.0, Math.min(1.0, conf)));
        }
        String text = response.text().toLowerCase(Locale.ROOT);
        long up = bullish.stream().filter(text::contains).count();
        long down = bearish.stream().filter(text::contains).count();
        double score = up > down + KEYWORD_MARGIN ? KEYWORD_SCORE
                     : down > up + KEYWORD_MARGIN ? -KEYWORD_SCORE
                     : 0.0;
        return new Scored(score, KEYWORD_CONFIDENCE);
    }

    private static <T> Mono<Optional<T>> optional(Mono<T> mono) {
        return mono.map(Optional::of).defaultIfEmpty(Optional.empty());
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    record Scored(double score, double confidence) {}
}
