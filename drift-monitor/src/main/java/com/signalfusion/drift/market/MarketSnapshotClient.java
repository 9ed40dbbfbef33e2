package com.signalfusion.drift.market;

import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.drift.model.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link MarketSnapshot} from the market-data service: the quote supplies price,
 * volume and volatility, a separate lightweight call supplies sentiment.
 *
 * <p>A missing sentiment leaves the field null. A missing or priceless quote yields an empty
 * result, which the monitor counts as a failed check.
 */
public class MarketSnapshotClient implements MarketSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketSnapshotClient.class);
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
        new ParameterizedTypeReference<>() {};

    private final WebClient marketDataWebClient;
    private final Clock clock;

    public MarketSnapshotClient(WebClient marketDataWebClient, Clock clock) {
        this.marketDataWebClient = marketDataWebClient;
        this.clock = clock;
    }

    @Override
    public Mono<MarketSnapshot> snapshot(String symbol) {
        return Mono.zip(quote(symbol), sentiment(symbol))
            .flatMap(t -> Mono.justOrEmpty(toSnapshot(symbol, t.getT1(), t.getT2().orElse(null))));
    }

    private Mono<Map<String, Object>> quote(String symbol) {
        return marketDataWebClient.get()
            .uri("/api/v1/market-data/quote/{symbol}", symbol)
            .retrieve()
            .bodyToMono(JSON_MAP)
            .onErrorResume(e -> {
                log.warn("SNAPSHOT_QUOTE_UNAVAILABLE symbol={} reason={}", symbol, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Optional<Double>> sentiment(String symbol) {
        return marketDataWebClient.get()
            .uri("/api/v1/market-data/sentiment/{symbol}", symbol)
            .retrieve()
            .bodyToMono(JSON_MAP)
            .map(body -> Optional.ofNullable(ValueExtractor.firstNumber(body, "sentiment_score", "score", "sentiment")))
            .onErrorResume(e -> {
                log.debug("SNAPSHOT_SENTIMENT_UNAVAILABLE symbol={} reason={}", symbol, e.getMessage());
                return Mono.just(Optional.empty());
            })
            .defaultIfEmpty(Optional.empty());
    }

    Optional<MarketSnapshot> toSnapshot(String symbol, Map<String, Object> quote, Double sentiment) {
        Double price = ValueExtractor.firstPrice(quote, "price", "current_price", "close");
        if (price == null || price <= 0.0) {
            log.warn("SNAPSHOT_NO_PRICE symbol={}", symbol);
            return Optional.empty();
        }
        double volume = ValueExtractor.number(quote.get("volume"), 0.0);
        Double volatility = ValueExtractor.firstNumber(quote, "volatility", "annualized_volatility");
        return Optional.of(new MarketSnapshot(symbol, price, Math.max(0L, (long) volume),
                                              volatility, sentiment, clock.instant()));
    }
}
