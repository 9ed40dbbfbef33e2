package com.signalfusion.orchestrator.market;

import com.signalfusion.common.model.MarketQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Fetches quotes from the market-data service.
 *
 * <p>Errors are absorbed with an empty result so the pipeline can fall back to the price a
 * specialist reported; the orchestrator records that value with FALLBACK lineage.
 */
public class RestMarketDataClient implements MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(RestMarketDataClient.class);

    private final WebClient marketDataWebClient;

    public RestMarketDataClient(WebClient marketDataWebClient) {
        this.marketDataWebClient = marketDataWebClient;
    }

    @Override
    public Mono<MarketQuote> getQuote(String symbol) {
        return marketDataWebClient.get()
            .uri("/api/v1/market-data/quote/{symbol}", symbol)
            .retrieve()
            .bodyToMono(MarketQuote.class)
            .doOnNext(q -> log.debug("QUOTE_FETCHED symbol={} price={} timestamp={}", symbol, q.price(), q.timestamp()))
            .onErrorResume(e -> {
                log.warn("QUOTE_UNAVAILABLE symbol={} reason={}", symbol, e.getMessage());
                return Mono.empty();
            });
    }
}
